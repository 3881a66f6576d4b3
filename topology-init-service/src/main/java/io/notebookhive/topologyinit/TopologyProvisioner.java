package io.notebookhive.topologyinit;

import io.notebookhive.topology.BusTopology;
import io.notebookhive.topology.QueueBinding;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;

/**
 * Declares the bus exchange, one durable queue per subject and the subject bindings.
 * <p>
 * Declarations are idempotent on the broker side, so running the provisioner against an
 * already provisioned broker is a no-op. Each broker call is retried with linear backoff.
 */
public final class TopologyProvisioner {

  private static final Logger log = LoggerFactory.getLogger(TopologyProvisioner.class);

  private final AmqpAdmin amqp;
  private final BusTopology topology;
  private final int maxAttempts;
  private final Duration backoff;
  private final Sleeper sleeper;

  public TopologyProvisioner(AmqpAdmin amqp, BusTopology topology, TopologyInitProperties properties) {
    this(amqp, topology, properties, duration -> Thread.sleep(duration.toMillis()));
  }

  TopologyProvisioner(AmqpAdmin amqp,
                      BusTopology topology,
                      TopologyInitProperties properties,
                      Sleeper sleeper) {
    this.amqp = Objects.requireNonNull(amqp, "amqp");
    this.topology = Objects.requireNonNull(topology, "topology");
    Objects.requireNonNull(properties, "properties");
    this.maxAttempts = Math.max(1, properties.getMaxAttempts());
    this.backoff = Objects.requireNonNull(properties.getBackoff(), "backoff");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /**
   * Provisions the whole topology.
   *
   * @param forceRecreate delete the queues before declaring them
   * @return the bindings that are now in place
   * @throws TopologyProvisioningException when a broker call keeps failing
   */
  public List<QueueBinding> provision(boolean forceRecreate) {
    List<QueueBinding> bindings = topology.queueBindings();
    if (forceRecreate) {
      for (QueueBinding binding : bindings) {
        attempt("delete queue " + binding.queue(), () -> amqp.deleteQueue(binding.queue()));
        log.info("deleted queue {}", binding.queue());
      }
    }

    TopicExchange exchange = new TopicExchange(topology.exchange(), true, false);
    attempt("declare exchange " + exchange.getName(), () -> amqp.declareExchange(exchange));
    log.info("declared exchange {}", exchange.getName());

    for (QueueBinding binding : bindings) {
      Queue queue = QueueBuilder.durable(binding.queue()).build();
      attempt("declare queue " + queue.getName(), () -> amqp.declareQueue(queue));
      attempt("bind queue " + queue.getName(),
          () -> amqp.declareBinding(BindingBuilder.bind(queue).to(exchange).with(binding.routingKey())));
      log.info("declared queue {} bound to {} with key {}", queue.getName(), exchange.getName(),
          binding.routingKey());
    }
    return bindings;
  }

  private void attempt(String step, Runnable action) {
    AmqpException lastError = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        action.run();
        return;
      } catch (AmqpException ex) {
        lastError = ex;
        if (attempt == maxAttempts) {
          break;
        }
        Duration delay = backoff.multipliedBy(attempt);
        log.warn("Could not {} (attempt {}/{}), retrying in {} ms: {}", step, attempt, maxAttempts,
            delay.toMillis(), ex.getMessage());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          throw new TopologyProvisioningException(step, attempt, interrupted);
        }
      }
    }
    throw new TopologyProvisioningException(step, maxAttempts, lastError);
  }

  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
