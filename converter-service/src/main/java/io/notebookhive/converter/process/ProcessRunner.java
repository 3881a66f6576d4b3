package io.notebookhive.converter.process;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs an external command to completion.
 */
public interface ProcessRunner {

  /**
   * @param command executable followed by its arguments
   * @param environment variables added to the inherited environment
   * @param workingDirectory directory the process starts in
   * @param timeout upper bound for the whole run; the process is killed when it is exceeded
   * @throws ProcessTimeoutException when the timeout elapsed
   * @throws IOException when the process cannot be started
   */
  ProcessResult run(List<String> command,
                    Map<String, String> environment,
                    Path workingDirectory,
                    Duration timeout) throws IOException, InterruptedException;
}
