package io.notebookhive.converter.render;

import io.notebookhive.converter.ConverterProperties;
import io.notebookhive.converter.process.ProcessRunner;
import io.notebookhive.topology.DiagramKind;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exports draw.io documents through the drawio desktop CLI.
 */
public class DrawioRenderer extends ProcessDiagramRenderer {

  private static final Set<String> FORMATS = Set.of("png", "svg");

  private final ConverterProperties.Drawio settings;

  public DrawioRenderer(ProcessRunner processRunner, Duration timeout, ConverterProperties.Drawio settings) {
    super(processRunner, timeout);
    this.settings = settings;
  }

  @Override
  public DiagramKind kind() {
    return DiagramKind.DRAWIO;
  }

  @Override
  public Set<String> supportedFormats() {
    return FORMATS;
  }

  @Override
  protected String engineName() {
    return "drawio";
  }

  @Override
  protected String inputFileName() {
    return "input.drawio";
  }

  @Override
  protected Path outputFile(Path inputFile, String format) {
    return inputFile.resolveSibling("output." + format);
  }

  @Override
  protected List<String> command(Path inputFile, Path outputFile, String format) {
    List<String> command = new ArrayList<>(List.of(
        settings.getCommand(),
        "--no-sandbox",
        "--export", inputFile.toString(),
        "--format", format,
        "--output", outputFile.toString(),
        "--border", Integer.toString(settings.getBorder())));
    if ("png".equals(format)) {
      command.add("--scale");
      command.add(Integer.toString(settings.getPngScale()));
    } else if ("svg".equals(format)) {
      command.add("--embed-svg-images");
    }
    return command;
  }

  @Override
  protected Map<String, String> environment() {
    return Map.of("DISPLAY", settings.getDisplay());
  }
}
