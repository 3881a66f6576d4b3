package io.notebookhive.bus.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notebookhive.bus.BusClient;
import io.notebookhive.bus.BusMessageCodec;
import io.notebookhive.bus.RabbitBusClient;
import io.notebookhive.topology.BusTopology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Shared bus wiring for every NotebookHive service: the resolved topology, the JSON codec and the
 * retrying publisher.
 */
@AutoConfiguration(after = {RabbitAutoConfiguration.class, JacksonAutoConfiguration.class})
@EnableConfigurationProperties(BusClientProperties.class)
public class BusClientAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BusClientAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    BusTopology busTopology(BusClientProperties properties) {
        BusTopology topology = properties.toTopology();
        log.info("bus topology {}", topology);
        return topology;
    }

    @Bean
    @ConditionalOnMissingBean
    BusMessageCodec busMessageCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new BusMessageCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(RabbitTemplate.class)
    BusClient busClient(RabbitTemplate rabbitTemplate,
                        BusTopology busTopology,
                        BusMessageCodec busMessageCodec,
                        BusClientProperties properties) {
        return new RabbitBusClient(rabbitTemplate, busTopology, busMessageCodec,
            properties.getPublish().toPolicy());
    }
}
