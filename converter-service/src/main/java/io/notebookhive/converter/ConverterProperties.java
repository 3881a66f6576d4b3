package io.notebookhive.converter;

import io.notebookhive.topology.DiagramKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "notebookhive.converter")
public class ConverterProperties {

  /**
   * Diagram kind this worker renders. Decides which request queue it consumes.
   */
  @NotNull
  private DiagramKind kind;

  /**
   * Format used when a request does not name one.
   */
  @NotBlank
  private String defaultOutputFormat = "png";

  @NotNull
  private Duration renderTimeout = Duration.ofMinutes(2);

  @Valid
  private final Drawio drawio = new Drawio();

  @Valid
  private final Plantuml plantuml = new Plantuml();

  public DiagramKind getKind() {
    return kind;
  }

  public void setKind(DiagramKind kind) {
    this.kind = kind;
  }

  public String getDefaultOutputFormat() {
    return defaultOutputFormat;
  }

  public void setDefaultOutputFormat(String defaultOutputFormat) {
    this.defaultOutputFormat = defaultOutputFormat;
  }

  public Duration getRenderTimeout() {
    return renderTimeout;
  }

  public void setRenderTimeout(Duration renderTimeout) {
    this.renderTimeout = renderTimeout;
  }

  public Drawio getDrawio() {
    return drawio;
  }

  public Plantuml getPlantuml() {
    return plantuml;
  }

  public static class Drawio {

    @NotBlank
    private String command = "drawio";

    /**
     * X display the headless Electron export attaches to.
     */
    @NotBlank
    private String display = ":99";

    @Min(0)
    private int border = 20;

    @Min(1)
    private int pngScale = 3;

    public String getCommand() {
      return command;
    }

    public void setCommand(String command) {
      this.command = command;
    }

    public String getDisplay() {
      return display;
    }

    public void setDisplay(String display) {
      this.display = display;
    }

    public int getBorder() {
      return border;
    }

    public void setBorder(int border) {
      this.border = border;
    }

    public int getPngScale() {
      return pngScale;
    }

    public void setPngScale(int pngScale) {
      this.pngScale = pngScale;
    }
  }

  public static class Plantuml {

    @NotBlank
    private String javaCommand = "java";

    @NotBlank
    private String jarPath = "/app/plantuml.jar";

    @Min(1)
    private int dpi = 600;

    public String getJavaCommand() {
      return javaCommand;
    }

    public void setJavaCommand(String javaCommand) {
      this.javaCommand = javaCommand;
    }

    public String getJarPath() {
      return jarPath;
    }

    public void setJarPath(String jarPath) {
      this.jarPath = jarPath;
    }

    public int getDpi() {
      return dpi;
    }

    public void setDpi(int dpi) {
      this.dpi = dpi;
    }
  }
}
