package io.notebookhive.topologyinit;

import io.notebookhive.topology.BusTopology;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
class TopologyInitConfiguration {

  @Bean
  TopologyProvisioner topologyProvisioner(AmqpAdmin amqpAdmin,
                                          BusTopology busTopology,
                                          TopologyInitProperties properties) {
    return new TopologyProvisioner(amqpAdmin, busTopology, properties);
  }
}
