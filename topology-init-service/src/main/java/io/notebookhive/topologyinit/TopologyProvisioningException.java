package io.notebookhive.topologyinit;

public class TopologyProvisioningException extends RuntimeException {

  private final String step;
  private final int attempts;

  public TopologyProvisioningException(String step, int attempts, Throwable cause) {
    super("Failed to " + step + " after " + attempts + " attempt(s)"
        + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
    this.step = step;
    this.attempts = attempts;
  }

  public String step() {
    return step;
  }

  public int attempts() {
    return attempts;
  }
}
