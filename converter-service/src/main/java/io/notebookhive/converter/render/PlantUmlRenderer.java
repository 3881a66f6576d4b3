package io.notebookhive.converter.render;

import io.notebookhive.converter.ConverterProperties;
import io.notebookhive.converter.process.ProcessRunner;
import io.notebookhive.topology.DiagramKind;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Runs the PlantUML jar. PlantUML names its output after the input file, so
 * {@code diagram.pu} becomes {@code diagram.png}.
 */
public class PlantUmlRenderer extends ProcessDiagramRenderer {

  private static final Set<String> FORMATS = Set.of("png", "svg");

  private final ConverterProperties.Plantuml settings;

  public PlantUmlRenderer(ProcessRunner processRunner, Duration timeout, ConverterProperties.Plantuml settings) {
    super(processRunner, timeout);
    this.settings = settings;
  }

  @Override
  public DiagramKind kind() {
    return DiagramKind.PLANTUML;
  }

  @Override
  public Set<String> supportedFormats() {
    return FORMATS;
  }

  @Override
  protected String engineName() {
    return "plantuml";
  }

  @Override
  protected String inputFileName() {
    return "diagram.pu";
  }

  @Override
  protected Path outputFile(Path inputFile, String format) {
    return inputFile.resolveSibling("diagram." + format);
  }

  @Override
  protected List<String> command(Path inputFile, Path outputFile, String format) {
    return List.of(
        settings.getJavaCommand(),
        "-jar", settings.getJarPath(),
        "-t" + format,
        "-Sdpi=" + settings.getDpi(),
        "-o", inputFile.getParent().toString(),
        inputFile.toString());
  }
}
