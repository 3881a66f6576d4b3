package io.notebookhive.converter.render;

import io.notebookhive.converter.process.ProcessResult;
import io.notebookhive.converter.process.ProcessRunner;
import io.notebookhive.converter.process.ProcessTimeoutException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Stands in for the render engines: records the invocation and writes {@link #output} to the
 * file the caller expects.
 */
class FakeProcessRunner implements ProcessRunner {

  List<String> command;
  Map<String, String> environment;
  Path workingDirectory;
  Duration timeout;
  String inputContent;

  Path outputFile;
  byte[] output = {(byte) 0x89, 'P', 'N', 'G'};
  int exitCode;
  String stderr = "";
  boolean timesOut;

  FakeProcessRunner writingTo(Path relativeOutput) {
    this.outputFile = relativeOutput;
    return this;
  }

  @Override
  public ProcessResult run(List<String> command,
                           Map<String, String> environment,
                           Path workingDirectory,
                           Duration timeout) throws IOException {
    this.command = command;
    this.environment = environment;
    this.workingDirectory = workingDirectory;
    this.timeout = timeout;
    try (var files = Files.list(workingDirectory)) {
      Path input = files.findFirst().orElseThrow();
      this.inputContent = Files.readString(input);
    }
    if (timesOut) {
      throw new ProcessTimeoutException(command.get(0), timeout);
    }
    if (outputFile != null && output != null) {
      Files.write(workingDirectory.resolve(outputFile), output);
    }
    return new ProcessResult(exitCode, "", stderr);
  }
}
