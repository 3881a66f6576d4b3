package io.notebookhive.topologyinit;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "notebookhive.topology")
public class TopologyInitProperties {

  /**
   * Delete every bus queue before declaring it again. Drops queued messages.
   */
  private boolean forceRecreate = false;

  @Min(1)
  private int maxAttempts = 5;

  /**
   * Base delay between declaration attempts; the n-th retry waits n times this value.
   */
  @NotNull
  private Duration backoff = Duration.ofSeconds(1);

  public boolean isForceRecreate() {
    return forceRecreate;
  }

  public void setForceRecreate(boolean forceRecreate) {
    this.forceRecreate = forceRecreate;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public Duration getBackoff() {
    return backoff;
  }

  public void setBackoff(Duration backoff) {
    this.backoff = backoff;
  }
}
