package io.notebookhive.bus;

import java.util.List;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.beans.factory.SmartInitializingSingleton;

/**
 * Refuses to start a service whose input queues have not been provisioned by the topology
 * initializer. Runs before the listener containers start consuming.
 */
public class BusQueueVerifier implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(BusQueueVerifier.class);

    private final AmqpAdmin amqpAdmin;
    private final List<String> queues;

    public BusQueueVerifier(AmqpAdmin amqpAdmin, List<String> queues) {
        this.amqpAdmin = Objects.requireNonNull(amqpAdmin, "amqpAdmin");
        this.queues = List.copyOf(Objects.requireNonNull(queues, "queues"));
    }

    @Override
    public void afterSingletonsInstantiated() {
        verify();
    }

    public void verify() {
        for (String queue : queues) {
            Properties queueProperties = amqpAdmin.getQueueProperties(queue);
            if (queueProperties == null) {
                throw new IllegalStateException(
                    "Queue %s is missing. Ensure the topology initializer has provisioned it.".formatted(queue));
            }
            log.debug("verified queue {}", queue);
        }
        log.info("verified {} input queue(s): {}", queues.size(), queues);
    }
}
