package io.notebookhive.converter.render;

import java.util.Objects;

public record RenderedArtifact(byte[] bytes, String mimeType, String format) {

  public RenderedArtifact {
    Objects.requireNonNull(bytes, "bytes");
    Objects.requireNonNull(mimeType, "mimeType");
    Objects.requireNonNull(format, "format");
  }
}
