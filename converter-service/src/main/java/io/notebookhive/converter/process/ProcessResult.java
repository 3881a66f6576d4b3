package io.notebookhive.converter.process;

/**
 * Exit code plus the captured (truncated) output streams of a finished process.
 */
public record ProcessResult(int exitCode, String stdout, String stderr) {

  public boolean succeeded() {
    return exitCode == 0;
  }
}
