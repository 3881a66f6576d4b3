package io.notebookhive.converter;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.notebookhive.bus.BusClient;
import io.notebookhive.bus.BusQueueVerifier;
import io.notebookhive.bus.spring.BusClientAutoConfiguration;
import io.notebookhive.converter.process.ExternalProcessRunner;
import io.notebookhive.converter.render.DiagramRenderer;
import io.notebookhive.converter.render.DrawioRenderer;
import io.notebookhive.converter.render.PlantUmlRenderer;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

class ConverterConfigurationTest {

  private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(BusClientAutoConfiguration.class))
      .withUserConfiguration(TestConfig.class)
      .withBean(ObjectMapper.class, ObjectMapper::new)
      .withBean(BusClient.class, RecordingBusClient::new)
      .withBean(MeterRegistry.class, SimpleMeterRegistry::new);

  private final ApplicationContextRunner provisionedBroker = contextRunner
      .withBean(AmqpAdmin.class, () -> amqpAdmin(true));

  @Test
  void plantumlWorkerConsumesPlantumlQueue() {
    provisionedBroker
        .withPropertyValues("notebookhive.converter.kind=plantuml")
        .run(context -> {
          assertThat(context.getBean("converterRequestQueue", String.class)).isEqualTo("convert.plantuml.request");
          assertThat(context.getBean(DiagramRenderer.class)).isInstanceOf(PlantUmlRenderer.class);
          assertThat(context).hasSingleBean(ExternalProcessRunner.class);
          assertThat(context).hasSingleBean(BusQueueVerifier.class);
          assertThat(context).hasSingleBean(ConversionWorker.class);
        });
  }

  @Test
  void drawioWorkerBindsEngineSettings() {
    provisionedBroker
        .withPropertyValues(
            "notebookhive.converter.kind=DRAWIO",
            "notebookhive.converter.render-timeout=30s",
            "notebookhive.converter.drawio.display=:1",
            "notebookhive.bus.subjects.drawio-request=diagrams.drawio.in")
        .run(context -> {
          assertThat(context.getBean("converterRequestQueue", String.class)).isEqualTo("diagrams.drawio.in");
          assertThat(context.getBean(DiagramRenderer.class)).isInstanceOf(DrawioRenderer.class);
          ConverterProperties properties = context.getBean(ConverterProperties.class);
          assertThat(properties.getRenderTimeout()).isEqualTo(Duration.ofSeconds(30));
          assertThat(properties.getDrawio().getDisplay()).isEqualTo(":1");
          assertThat(properties.getDrawio().getPngScale()).isEqualTo(3);
          assertThat(properties.getPlantuml().getDpi()).isEqualTo(600);
        });
  }

  @Test
  void kindIsRequired() {
    provisionedBroker.run(context -> assertThat(context).hasFailed());
  }

  @Test
  void queueVerificationCanBeDisabled() {
    contextRunner
        .withBean(AmqpAdmin.class, () -> amqpAdmin(false))
        .withPropertyValues("notebookhive.converter.kind=plantuml", "notebookhive.bus.verify-queues=false")
        .run(context -> assertThat(context).doesNotHaveBean(BusQueueVerifier.class));
  }

  @Test
  void missingQueueFailsStartup() {
    contextRunner
        .withPropertyValues("notebookhive.converter.kind=plantuml")
        .withBean(AmqpAdmin.class, () -> amqpAdmin(false))
        .run(context -> assertThat(context).hasFailed()
            .getFailure().isInstanceOf(IllegalStateException.class).hasMessage(
                "Queue convert.plantuml.request is missing. Ensure the topology initializer has provisioned it."));
  }

  private static AmqpAdmin amqpAdmin(boolean queuesExist) {
    AmqpAdmin admin = Mockito.mock(AmqpAdmin.class);
    if (queuesExist) {
      Mockito.when(admin.getQueueProperties(Mockito.anyString())).thenReturn(new Properties());
    }
    return admin;
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(ConverterProperties.class)
  @Import(ConverterConfiguration.class)
  static class TestConfig {
  }
}
