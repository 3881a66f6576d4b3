package io.notebookhive.bus;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.AmqpAdmin;

class BusQueueVerifierTest {

    private final AmqpAdmin amqpAdmin = mock(AmqpAdmin.class);

    @Test
    void failsWhenAQueueIsMissing() {
        when(amqpAdmin.getQueueProperties("convert.drawio.request")).thenReturn(new Properties());
        when(amqpAdmin.getQueueProperties("convert.plantuml.request")).thenReturn(null);
        BusQueueVerifier verifier = new BusQueueVerifier(amqpAdmin,
            List.of("convert.drawio.request", "convert.plantuml.request"));

        assertThatThrownBy(verifier::afterSingletonsInstantiated)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("convert.plantuml.request");
    }

    @Test
    void passesWhenAllQueuesExist() {
        when(amqpAdmin.getQueueProperties("notebook.process.request")).thenReturn(new Properties());
        BusQueueVerifier verifier = new BusQueueVerifier(amqpAdmin, List.of("notebook.process.request"));

        assertThatCode(verifier::afterSingletonsInstantiated).doesNotThrowAnyException();
    }
}
