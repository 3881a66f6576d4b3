package io.notebookhive.topology;

import java.util.Objects;

/**
 * A durable queue bound to the bus exchange. Queues are named after the subject they carry, so the
 * routing key and the queue name are usually identical.
 */
public record QueueBinding(String queue, String routingKey) {

  public QueueBinding {
    queue = BusTopology.requireText(queue, "queue");
    routingKey = BusTopology.requireText(routingKey, "routingKey");
  }

  public static QueueBinding forSubject(String subject) {
    Objects.requireNonNull(subject, "subject");
    return new QueueBinding(subject, subject);
  }
}
