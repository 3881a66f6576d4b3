package io.notebookhive.topology;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Diagram formats that have a converter role on the bus.
 *
 * <p>The set is closed: adding a format means adding a constant here, a default pair of subjects
 * in {@link TopologyDefaults} and a renderer in the converter service.</p>
 */
public enum DiagramKind {

  DRAWIO("drawio", "image/png"),
  PLANTUML("plantuml", "image/png");

  private static final Map<String, DiagramKind> BY_WIRE_NAME = Arrays.stream(values())
      .collect(Collectors.toUnmodifiableMap(DiagramKind::wireName, Function.identity()));

  private final String wireName;
  private final String defaultMimeType;

  DiagramKind(String wireName, String defaultMimeType) {
    this.wireName = wireName;
    this.defaultMimeType = defaultMimeType;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public String defaultMimeType() {
    return defaultMimeType;
  }

  /**
   * Resolves a declared kind, ignoring case and surrounding whitespace. Unknown names yield an empty
   * result so callers can pass them through untouched.
   */
  public static Optional<DiagramKind> fromWireName(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_WIRE_NAME.get(name.strip().toLowerCase(Locale.ROOT)));
  }

  @JsonCreator
  static DiagramKind fromJson(String name) {
    return fromWireName(name)
        .orElseThrow(() -> new IllegalArgumentException("Unknown diagram kind: " + name));
  }
}
