package io.notebookhive.bus.spring;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notebookhive.bus.BusClient;
import io.notebookhive.bus.BusMessageCodec;
import io.notebookhive.bus.RabbitBusClient;
import io.notebookhive.topology.BusTopology;
import io.notebookhive.topology.DiagramKind;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class BusClientAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(BusClientAutoConfiguration.class))
        .withBean(ObjectMapper.class, ObjectMapper::new);

    @Test
    void defaultsResolveTheStandardTopology() {
        contextRunner
            .withBean(RabbitTemplate.class, () -> Mockito.mock(RabbitTemplate.class))
            .run(context -> {
                assertThat(context).hasSingleBean(BusTopology.class);
                assertThat(context).hasSingleBean(BusMessageCodec.class);
                assertThat(context.getBean(BusClient.class)).isInstanceOf(RabbitBusClient.class);
                BusTopology topology = context.getBean(BusTopology.class);
                assertThat(topology.exchange()).isEqualTo("notebookhive.bus");
                assertThat(topology.requestSubject(DiagramKind.DRAWIO)).isEqualTo("convert.drawio.request");
            });
    }

    @Test
    void subjectsAndRetriesAreConfigurable() {
        contextRunner
            .withBean(RabbitTemplate.class, () -> Mockito.mock(RabbitTemplate.class))
            .withPropertyValues(
                "notebookhive.bus.exchange=nb.test",
                "notebookhive.bus.subjects.plantuml-request=uml.in",
                "notebookhive.bus.subjects.notebook-result=nb.done",
                "notebookhive.bus.publish.max-attempts=7",
                "notebookhive.bus.publish.initial-backoff=50ms")
            .run(context -> {
                BusTopology topology = context.getBean(BusTopology.class);
                assertThat(topology.exchange()).isEqualTo("nb.test");
                assertThat(topology.requestSubject(DiagramKind.PLANTUML)).isEqualTo("uml.in");
                assertThat(topology.notebookResultSubject()).isEqualTo("nb.done");
                BusClientProperties properties = context.getBean(BusClientProperties.class);
                assertThat(properties.getPublish().toPolicy().maxAttempts()).isEqualTo(7);
                assertThat(properties.getPublish().toPolicy().initialBackoff()).isEqualTo(Duration.ofMillis(50));
            });
    }

    @Test
    void noPublisherWithoutRabbitTemplate() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(BusTopology.class);
            assertThat(context).doesNotHaveBean(BusClient.class);
        });
    }

    @Test
    void blankSubjectFailsStartup() {
        contextRunner
            .withPropertyValues("notebookhive.bus.subjects.drawio-response=")
            .run(context -> assertThat(context).hasFailed());
    }
}
