package io.notebookhive.converter.process;

import java.io.IOException;
import java.time.Duration;

public class ProcessTimeoutException extends IOException {

  private final Duration timeout;

  public ProcessTimeoutException(String executable, Duration timeout) {
    super(executable + " did not finish within " + timeout.toSeconds() + "s");
    this.timeout = timeout;
  }

  public Duration timeout() {
    return timeout;
  }
}
