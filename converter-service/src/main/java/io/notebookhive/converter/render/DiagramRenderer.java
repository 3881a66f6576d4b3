package io.notebookhive.converter.render;

import io.notebookhive.topology.DiagramKind;
import java.util.Set;

/**
 * Turns diagram source text into image bytes.
 */
public interface DiagramRenderer {

  DiagramKind kind();

  /**
   * Lower-case output formats this renderer can produce, e.g. {@code png}.
   */
  Set<String> supportedFormats();

  RenderedArtifact render(String source, String outputFormat) throws RenderException;
}
