package io.notebookhive.converter;

import io.notebookhive.bus.BusClient;
import java.util.ArrayList;
import java.util.List;

class RecordingBusClient implements BusClient {

  record Published(String subject, Object message, String correlationId) {
  }

  final List<Published> published = new ArrayList<>();

  @Override
  public void publish(String subject, Object message, String correlationId) {
    published.add(new Published(subject, message, correlationId));
  }
}
