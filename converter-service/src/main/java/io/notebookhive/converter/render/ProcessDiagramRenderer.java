package io.notebookhive.converter.render;

import io.notebookhive.converter.process.ProcessResult;
import io.notebookhive.converter.process.ProcessRunner;
import io.notebookhive.converter.process.ProcessTimeoutException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

/**
 * Shared flow of the command line engines: write the source into a fresh temporary directory, run
 * the engine, read the expected output file, delete the directory.
 */
abstract class ProcessDiagramRenderer implements DiagramRenderer {

  private static final Logger log = LoggerFactory.getLogger(ProcessDiagramRenderer.class);

  private static final int MAX_REASON_CHARS = 500;

  private final ProcessRunner processRunner;
  private final Duration timeout;

  ProcessDiagramRenderer(ProcessRunner processRunner, Duration timeout) {
    this.processRunner = Objects.requireNonNull(processRunner, "processRunner");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  protected abstract String engineName();

  protected abstract String inputFileName();

  protected abstract Path outputFile(Path inputFile, String format);

  protected abstract List<String> command(Path inputFile, Path outputFile, String format);

  protected Map<String, String> environment() {
    return Map.of();
  }

  @Override
  public RenderedArtifact render(String source, String outputFormat) throws RenderException {
    Objects.requireNonNull(source, "source");
    String format = outputFormat.toLowerCase(Locale.ROOT);
    if (!supportedFormats().contains(format)) {
      throw new RenderException("%s cannot produce '%s' output (supported: %s)"
          .formatted(engineName(), outputFormat, String.join(", ", supportedFormats())));
    }
    Path workDir = null;
    try {
      workDir = Files.createTempDirectory("notebookhive-" + kind().wireName() + "-");
      Path input = workDir.resolve(inputFileName());
      Files.writeString(input, source, StandardCharsets.UTF_8);
      Path output = outputFile(input, format);

      ProcessResult result = processRunner.run(command(input, output, format), environment(), workDir, timeout);
      if (!result.succeeded()) {
        throw new RenderException("%s exited with code %d: %s"
            .formatted(engineName(), result.exitCode(), reason(result)));
      }
      if (!Files.isRegularFile(output) || Files.size(output) == 0) {
        throw new RenderException("%s produced no %s output: %s"
            .formatted(engineName(), format, reason(result)));
      }
      return new RenderedArtifact(Files.readAllBytes(output), mimeType(format), format);
    } catch (ProcessTimeoutException ex) {
      throw new RenderException(engineName() + " timed out after " + ex.timeout().toSeconds() + "s", ex);
    } catch (IOException ex) {
      throw new RenderException(engineName() + " could not be run: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new RenderException(engineName() + " render was interrupted", ex);
    } finally {
      cleanUp(workDir);
    }
  }

  static String mimeType(String format) {
    return switch (format) {
      case "svg" -> "image/svg+xml";
      case "pdf" -> "application/pdf";
      default -> "image/" + format;
    };
  }

  private static String reason(ProcessResult result) {
    String text = result.stderr().isBlank() ? result.stdout() : result.stderr();
    if (text.isBlank()) {
      return "no diagnostics";
    }
    return text.length() > MAX_REASON_CHARS ? text.substring(0, MAX_REASON_CHARS) + "..." : text;
  }

  private static void cleanUp(Path workDir) {
    if (workDir == null) {
      return;
    }
    try {
      FileSystemUtils.deleteRecursively(workDir);
    } catch (IOException ex) {
      log.warn("could not delete render directory {}: {}", workDir, ex.getMessage());
    }
  }
}
