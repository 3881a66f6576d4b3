package io.notebookhive.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolved names of the exchange and subjects every service agrees on.
 *
 * <p>The topology initializer declares {@link #queueBindings()}; the other services only consume
 * the queues they need and publish by subject.</p>
 */
public final class BusTopology {

  private final String exchange;
  private final Map<DiagramKind, String> requestSubjects;
  private final Map<DiagramKind, String> responseSubjects;
  private final String notebookRequestSubject;
  private final String notebookResultSubject;

  public BusTopology(String exchange,
                     Map<DiagramKind, String> requestSubjects,
                     Map<DiagramKind, String> responseSubjects,
                     String notebookRequestSubject,
                     String notebookResultSubject) {
    this.exchange = requireText(exchange, "exchange");
    this.requestSubjects = complete(requestSubjects, "requestSubjects");
    this.responseSubjects = complete(responseSubjects, "responseSubjects");
    this.notebookRequestSubject = requireText(notebookRequestSubject, "notebookRequestSubject");
    this.notebookResultSubject = requireText(notebookResultSubject, "notebookResultSubject");
  }

  public static BusTopology defaults() {
    return new BusTopology(
        TopologyDefaults.EXCHANGE,
        Map.of(DiagramKind.DRAWIO, TopologyDefaults.DRAWIO_REQUEST,
            DiagramKind.PLANTUML, TopologyDefaults.PLANTUML_REQUEST),
        Map.of(DiagramKind.DRAWIO, TopologyDefaults.DRAWIO_RESPONSE,
            DiagramKind.PLANTUML, TopologyDefaults.PLANTUML_RESPONSE),
        TopologyDefaults.NOTEBOOK_REQUEST,
        TopologyDefaults.NOTEBOOK_RESULT);
  }

  public String exchange() {
    return exchange;
  }

  public String requestSubject(DiagramKind kind) {
    return requestSubjects.get(Objects.requireNonNull(kind, "kind"));
  }

  public String responseSubject(DiagramKind kind) {
    return responseSubjects.get(Objects.requireNonNull(kind, "kind"));
  }

  public List<String> responseSubjects() {
    return List.copyOf(responseSubjects.values());
  }

  public String notebookRequestSubject() {
    return notebookRequestSubject;
  }

  public String notebookResultSubject() {
    return notebookResultSubject;
  }

  /**
   * Every queue of the system, one per subject, in a stable order: per kind request then response,
   * followed by the notebook subjects. Duplicate subject names collapse into one queue.
   */
  public List<QueueBinding> queueBindings() {
    Set<String> subjects = new LinkedHashSet<>();
    for (DiagramKind kind : DiagramKind.values()) {
      subjects.add(requestSubjects.get(kind));
      subjects.add(responseSubjects.get(kind));
    }
    subjects.add(notebookRequestSubject);
    subjects.add(notebookResultSubject);
    List<QueueBinding> bindings = new ArrayList<>(subjects.size());
    for (String subject : subjects) {
      bindings.add(QueueBinding.forSubject(subject));
    }
    return Collections.unmodifiableList(bindings);
  }

  @Override
  public String toString() {
    return "BusTopology{exchange=" + exchange
        + ", requests=" + requestSubjects
        + ", responses=" + responseSubjects
        + ", notebookRequest=" + notebookRequestSubject
        + ", notebookResult=" + notebookResultSubject + '}';
  }

  private static Map<DiagramKind, String> complete(Map<DiagramKind, String> subjects, String field) {
    Objects.requireNonNull(subjects, field);
    EnumMap<DiagramKind, String> resolved = new EnumMap<>(DiagramKind.class);
    for (DiagramKind kind : DiagramKind.values()) {
      resolved.put(kind, requireText(subjects.get(kind), field + "." + kind.wireName()));
    }
    return Collections.unmodifiableMap(resolved);
  }

  static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be null or blank");
    }
    return value.strip();
  }
}
