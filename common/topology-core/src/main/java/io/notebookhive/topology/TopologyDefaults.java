package io.notebookhive.topology;

/**
 * Exchange and subject names used when {@code notebookhive.bus.*} does not override them. The
 * topology initializer, the converters and the dispatcher all start from these, so a deployment
 * that changes one name has to change it for every service.
 */
public final class TopologyDefaults {

  private TopologyDefaults() {
  }

  public static final String EXCHANGE = "notebookhive.bus";

  public static final String DRAWIO_REQUEST = "convert.drawio.request";

  public static final String DRAWIO_RESPONSE = "convert.drawio.response";

  public static final String PLANTUML_REQUEST = "convert.plantuml.request";

  public static final String PLANTUML_RESPONSE = "convert.plantuml.response";

  public static final String NOTEBOOK_REQUEST = "notebook.process.request";

  public static final String NOTEBOOK_RESULT = "notebook.process.result";
}
