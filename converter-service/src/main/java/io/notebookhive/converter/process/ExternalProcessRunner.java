package io.notebookhive.converter.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProcessRunner} on top of {@link ProcessBuilder}. Both output streams are drained on
 * background threads so a chatty engine cannot block on a full pipe; at most
 * {@value #MAX_CAPTURE_CHARS} characters of each are kept.
 */
public class ExternalProcessRunner implements ProcessRunner, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ExternalProcessRunner.class);

  static final int MAX_CAPTURE_CHARS = 16 * 1024;

  private static final Duration DRAIN_GRACE = Duration.ofSeconds(5);

  private final ExecutorService streamReaders;

  public ExternalProcessRunner() {
    AtomicInteger counter = new AtomicInteger();
    this.streamReaders = Executors.newCachedThreadPool(runnable -> {
      Thread thread = new Thread(runnable, "process-stream-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  @Override
  public ProcessResult run(List<String> command,
                           Map<String, String> environment,
                           Path workingDirectory,
                           Duration timeout) throws IOException, InterruptedException {
    if (command == null || command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    String executable = command.get(0);
    ProcessBuilder builder = new ProcessBuilder(command);
    if (workingDirectory != null) {
      builder.directory(workingDirectory.toFile());
    }
    if (environment != null) {
      builder.environment().putAll(environment);
    }
    log.debug("starting {}", command);
    Process process = builder.start();
    StringBuilder stdout = new StringBuilder();
    StringBuilder stderr = new StringBuilder();
    Future<?> stdoutReader = streamReaders.submit(new StreamDrain(process.getInputStream(), stdout, null));
    Future<?> stderrReader = streamReaders.submit(new StreamDrain(process.getErrorStream(), stderr,
        line -> log.debug("[{}-stderr] {}", executable, line)));

    if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      process.destroyForcibly();
      stdoutReader.cancel(true);
      stderrReader.cancel(true);
      throw new ProcessTimeoutException(executable, timeout);
    }
    await(stdoutReader);
    await(stderrReader);
    int exitCode = process.exitValue();
    log.debug("{} exited with {}", executable, exitCode);
    return new ProcessResult(exitCode, stdout.toString().trim(), stderr.toString().trim());
  }

  private static void await(Future<?> reader) throws InterruptedException {
    try {
      reader.get(DRAIN_GRACE.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException | TimeoutException ex) {
      log.warn("process output was not fully captured: {}", ex.toString());
      reader.cancel(true);
    }
  }

  @Override
  public void close() {
    streamReaders.shutdownNow();
  }

  private static final class StreamDrain implements Runnable {

    private final InputStream stream;
    private final StringBuilder capture;
    private final Consumer<String> lineLogger;

    StreamDrain(InputStream stream, StringBuilder capture, Consumer<String> lineLogger) {
      this.stream = stream;
      this.capture = capture;
      this.lineLogger = lineLogger;
    }

    @Override
    public void run() {
      try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
        String line;
        while ((line = reader.readLine()) != null) {
          if (lineLogger != null) {
            lineLogger.accept(line);
          }
          synchronized (capture) {
            if (capture.length() < MAX_CAPTURE_CHARS) {
              capture.append(line, 0, Math.min(line.length(), MAX_CAPTURE_CHARS - capture.length()))
                  .append('\n');
            }
          }
        }
      } catch (IOException ex) {
        log.warn("error reading process stream: {}", ex.getMessage());
      }
    }
  }
}
