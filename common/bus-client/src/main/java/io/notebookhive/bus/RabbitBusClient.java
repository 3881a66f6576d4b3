package io.notebookhive.bus;

import io.notebookhive.topology.BusTopology;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

/**
 * Publishes JSON messages to the bus exchange using {@link RabbitTemplate}, routed by subject.
 * Broker errors are retried according to the {@link PublishRetryPolicy}.
 */
public final class RabbitBusClient implements BusClient {

    private static final Logger log = LoggerFactory.getLogger(RabbitBusClient.class);

    private final RabbitTemplate rabbitTemplate;
    private final BusTopology topology;
    private final BusMessageCodec codec;
    private final PublishRetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public RabbitBusClient(RabbitTemplate rabbitTemplate,
                           BusTopology topology,
                           BusMessageCodec codec,
                           PublishRetryPolicy retryPolicy) {
        this(rabbitTemplate, topology, codec, retryPolicy, duration -> Thread.sleep(duration.toMillis()));
    }

    RabbitBusClient(RabbitTemplate rabbitTemplate,
                    BusTopology topology,
                    BusMessageCodec codec,
                    PublishRetryPolicy retryPolicy,
                    Sleeper sleeper) {
        this.rabbitTemplate = Objects.requireNonNull(rabbitTemplate, "rabbitTemplate");
        this.topology = Objects.requireNonNull(topology, "topology");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public void publish(String subject, Object message, String correlationId) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
        Message outbound = new Message(codec.encode(message), properties(correlationId));
        int maxAttempts = retryPolicy.maxAttempts();
        AmqpException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                rabbitTemplate.send(topology.exchange(), subject, outbound);
                if (attempt > 1) {
                    log.info("Published to {} on attempt {}/{}", subject, attempt, maxAttempts);
                } else {
                    log.debug("Published {} to {} cid={}", message.getClass().getSimpleName(), subject, correlationId);
                }
                return;
            } catch (AmqpException ex) {
                lastError = ex;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = retryPolicy.backoffAfter(attempt);
                log.warn("Publish to {} failed (attempt {}/{}), retrying in {} ms: {}",
                    subject, attempt, maxAttempts, delay.toMillis(), ex.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new BusPublishException(subject, attempt, interrupted);
                }
            }
        }
        log.error("Giving up publishing to {} after {} attempt(s)", subject, maxAttempts, lastError);
        throw new BusPublishException(subject, maxAttempts, lastError);
    }

    private static MessageProperties properties(String correlationId) {
        MessageProperties props = new MessageProperties();
        props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        props.setContentEncoding(StandardCharsets.UTF_8.name());
        props.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        props.setMessageId(UUID.randomUUID().toString());
        if (correlationId != null && !correlationId.isBlank()) {
            props.setCorrelationId(correlationId);
        }
        return props;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
