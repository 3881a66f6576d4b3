package io.notebookhive.converter;

import io.micrometer.core.instrument.MeterRegistry;
import io.notebookhive.bus.BusClient;
import io.notebookhive.bus.BusQueueVerifier;
import io.notebookhive.converter.process.ExternalProcessRunner;
import io.notebookhive.converter.process.ProcessRunner;
import io.notebookhive.converter.render.DiagramRenderer;
import io.notebookhive.converter.render.DrawioRenderer;
import io.notebookhive.converter.render.PlantUmlRenderer;
import io.notebookhive.topology.BusTopology;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
class ConverterConfiguration {

  private static final Logger log = LoggerFactory.getLogger(ConverterConfiguration.class);

  @Bean
  String converterRequestQueue(BusTopology topology, ConverterProperties properties) {
    String queue = topology.requestSubject(properties.getKind());
    log.info("{} converter consuming {}", properties.getKind().wireName(), queue);
    return queue;
  }

  @Bean
  @ConditionalOnMissingBean(ProcessRunner.class)
  ExternalProcessRunner processRunner() {
    return new ExternalProcessRunner();
  }

  @Bean
  DiagramRenderer diagramRenderer(ConverterProperties properties, ProcessRunner processRunner) {
    return switch (properties.getKind()) {
      case DRAWIO -> new DrawioRenderer(processRunner, properties.getRenderTimeout(), properties.getDrawio());
      case PLANTUML -> new PlantUmlRenderer(processRunner, properties.getRenderTimeout(), properties.getPlantuml());
    };
  }

  @Bean
  ConversionWorker conversionWorker(DiagramRenderer diagramRenderer,
                                    BusClient busClient,
                                    BusTopology topology,
                                    MeterRegistry meterRegistry,
                                    ConverterProperties properties) {
    return new ConversionWorker(diagramRenderer, busClient, topology, meterRegistry,
        properties.getDefaultOutputFormat());
  }

  @Bean
  @ConditionalOnProperty(prefix = "notebookhive.bus", name = "verify-queues", havingValue = "true",
      matchIfMissing = true)
  BusQueueVerifier converterQueueVerifier(AmqpAdmin amqpAdmin, String converterRequestQueue) {
    return new BusQueueVerifier(amqpAdmin, List.of(converterRequestQueue));
  }
}
