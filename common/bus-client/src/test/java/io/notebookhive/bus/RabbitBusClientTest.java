package io.notebookhive.bus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.notebookhive.bus.message.ConversionRequest;
import io.notebookhive.topology.BusTopology;
import io.notebookhive.topology.DiagramKind;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

class RabbitBusClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final RabbitTemplate rabbitTemplate = mock(RabbitTemplate.class);
    private final BusTopology topology = BusTopology.defaults();
    private final BusMessageCodec codec = new BusMessageCodec(mapper);
    private final List<Duration> sleeps = new ArrayList<>();
    private final PublishRetryPolicy policy =
        new PublishRetryPolicy(3, Duration.ofMillis(100), 2.0, Duration.ofSeconds(1));
    private final RabbitBusClient client =
        new RabbitBusClient(rabbitTemplate, topology, codec, policy, sleeps::add);

    @Test
    void publishesJsonToExchangeRoutedBySubject() throws Exception {
        ConversionRequest request = ConversionRequest.forSource("cid-1", "job-1", DiagramKind.PLANTUML,
            "@startuml\nA -> B\n@enduml", "png", "convert.plantuml.response");

        client.publish("convert.plantuml.request", request, "cid-1");

        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(rabbitTemplate).send(eq("notebookhive.bus"), eq("convert.plantuml.request"), captor.capture());
        Message sent = captor.getValue();
        MessageProperties props = sent.getMessageProperties();
        assertThat(props.getContentType()).isEqualTo(MessageProperties.CONTENT_TYPE_JSON);
        assertThat(props.getDeliveryMode()).isEqualTo(MessageDeliveryMode.PERSISTENT);
        assertThat(props.getCorrelationId()).isEqualTo("cid-1");
        assertThat(props.getMessageId()).isNotBlank();

        JsonNode body = mapper.readTree(sent.getBody());
        assertThat(body.path("correlationId").asText()).isEqualTo("cid-1");
        assertThat(body.path("kind").asText()).isEqualTo("plantuml");
        assertThat(body.path("attempt").asInt()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void retriesWithBackoffUntilTheBrokerAccepts() {
        doThrow(new AmqpException("connection reset"))
            .doThrow(new AmqpException("connection reset"))
            .doNothing()
            .when(rabbitTemplate).send(any(String.class), any(String.class), any(Message.class));

        client.publish("notebook.process.result", "{}", null);

        verify(rabbitTemplate, times(3)).send(eq("notebookhive.bus"), eq("notebook.process.result"), any(Message.class));
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    void raisesAfterRetriesAreExhausted() {
        doThrow(new AmqpException("broker unreachable"))
            .when(rabbitTemplate).send(any(String.class), any(String.class), any(Message.class));

        assertThatThrownBy(() -> client.publish("convert.drawio.request", "{}", "cid-2"))
            .isInstanceOf(BusPublishException.class)
            .hasMessageContaining("convert.drawio.request")
            .hasMessageContaining("broker unreachable")
            .satisfies(ex -> assertThat(((BusPublishException) ex).attempts()).isEqualTo(3));
        verify(rabbitTemplate, times(3)).send(any(String.class), any(String.class), any(Message.class));
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void interruptStopsRetrying() {
        doThrow(new AmqpException("broker unreachable"))
            .when(rabbitTemplate).send(any(String.class), any(String.class), any(Message.class));
        RabbitBusClient interrupted = new RabbitBusClient(rabbitTemplate, topology, codec, policy, delay -> {
            throw new InterruptedException("shutdown");
        });

        try {
            assertThatThrownBy(() -> interrupted.publish("convert.drawio.request", "{}", null))
                .isInstanceOf(BusPublishException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
        verify(rabbitTemplate, times(1)).send(any(String.class), any(String.class), any(Message.class));
    }

    @Test
    void rejectsBlankSubject() {
        assertThatThrownBy(() -> client.publish(" ", "{}", null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void singleAttemptPolicyNeverSleeps() {
        doNothing().when(rabbitTemplate).send(any(String.class), any(String.class), any(Message.class));
        RabbitBusClient once = new RabbitBusClient(rabbitTemplate, topology, codec,
            PublishRetryPolicy.noRetry(), sleeps::add);

        once.publish("notebook.process.result", "{}", "job-9");

        assertThat(sleeps).isEmpty();
    }
}
