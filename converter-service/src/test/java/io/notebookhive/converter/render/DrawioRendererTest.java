package io.notebookhive.converter.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.notebookhive.converter.ConverterProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class DrawioRendererTest {

  private static final String SOURCE = "<mxfile><diagram id=\"a\"/></mxfile>";

  private final ConverterProperties.Drawio settings = new ConverterProperties.Drawio();

  @Test
  void exportsPngWithScaleBorderAndDisplay() throws Exception {
    FakeProcessRunner runner = new FakeProcessRunner().writingTo(Path.of("output.png"));
    DrawioRenderer renderer = new DrawioRenderer(runner, Duration.ofSeconds(30), settings);

    RenderedArtifact artifact = renderer.render(SOURCE, "png");

    assertThat(artifact.mimeType()).isEqualTo("image/png");
    assertThat(artifact.bytes()).isEqualTo(runner.output);
    assertThat(runner.inputContent).isEqualTo(SOURCE);
    Path dir = runner.workingDirectory;
    assertThat(runner.command).containsExactly(
        "drawio", "--no-sandbox",
        "--export", dir.resolve("input.drawio").toString(),
        "--format", "png",
        "--output", dir.resolve("output.png").toString(),
        "--border", "20",
        "--scale", "3");
    assertThat(runner.environment).containsEntry("DISPLAY", ":99");
    assertThat(runner.timeout).isEqualTo(Duration.ofSeconds(30));
    assertThat(Files.exists(dir)).as("render directory is removed").isFalse();
  }

  @Test
  void svgEmbedsImagesInsteadOfScaling() throws Exception {
    settings.setBorder(5);
    FakeProcessRunner runner = new FakeProcessRunner().writingTo(Path.of("output.svg"));
    runner.output = "<svg/>".getBytes();

    RenderedArtifact artifact = new DrawioRenderer(runner, Duration.ofSeconds(30), settings).render(SOURCE, "SVG");

    assertThat(artifact.mimeType()).isEqualTo("image/svg+xml");
    assertThat(artifact.format()).isEqualTo("svg");
    assertThat(runner.command).contains("--embed-svg-images").doesNotContain("--scale");
    assertThat(runner.command).containsSubsequence("--border", "5");
  }

  @Test
  void nonZeroExitReportsEngineDiagnostics() {
    FakeProcessRunner runner = new FakeProcessRunner().writingTo(Path.of("output.png"));
    runner.exitCode = 1;
    runner.stderr = "Error: invalid diagram XML";

    assertThatThrownBy(() -> new DrawioRenderer(runner, Duration.ofSeconds(30), settings).render(SOURCE, "png"))
        .isInstanceOf(RenderException.class)
        .hasMessage("drawio exited with code 1: Error: invalid diagram XML");
    assertThat(Files.exists(runner.workingDirectory)).isFalse();
  }

  @Test
  void missingOutputFileIsAFailure() {
    FakeProcessRunner runner = new FakeProcessRunner();

    assertThatThrownBy(() -> new DrawioRenderer(runner, Duration.ofSeconds(30), settings).render(SOURCE, "png"))
        .isInstanceOf(RenderException.class)
        .hasMessageContaining("produced no png output");
  }

  @Test
  void timeoutIsAFailure() {
    FakeProcessRunner runner = new FakeProcessRunner();
    runner.timesOut = true;

    assertThatThrownBy(() -> new DrawioRenderer(runner, Duration.ofSeconds(2), settings).render(SOURCE, "png"))
        .isInstanceOf(RenderException.class)
        .hasMessage("drawio timed out after 2s");
  }

  @Test
  void unsupportedFormatNeverStartsTheEngine() {
    FakeProcessRunner runner = new FakeProcessRunner();

    assertThatThrownBy(() -> new DrawioRenderer(runner, Duration.ofSeconds(2), settings).render(SOURCE, "gif"))
        .isInstanceOf(RenderException.class)
        .hasMessageContaining("cannot produce 'gif'");
    assertThat(runner.command).isNull();
  }
}
