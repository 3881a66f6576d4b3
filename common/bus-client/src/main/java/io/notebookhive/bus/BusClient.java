package io.notebookhive.bus;

/**
 * Publishes messages onto a named subject of the shared bus.
 */
public interface BusClient {

    /**
     * Publishes {@code message} as JSON to {@code subject}.
     *
     * @param correlationId carried in the transport properties for tracing; may be {@code null}
     * @throws BusPublishException once the publish retries are exhausted
     */
    void publish(String subject, Object message, String correlationId);
}
