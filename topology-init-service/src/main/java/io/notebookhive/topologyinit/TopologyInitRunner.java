package io.notebookhive.topologyinit;

import io.notebookhive.topology.QueueBinding;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
class TopologyInitRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(TopologyInitRunner.class);

  private final TopologyProvisioner provisioner;
  private final TopologyInitProperties properties;

  TopologyInitRunner(TopologyProvisioner provisioner, TopologyInitProperties properties) {
    this.provisioner = provisioner;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (properties.isForceRecreate()) {
      log.warn("force-recreate enabled: existing bus queues and their messages are dropped");
    }
    List<QueueBinding> bindings = provisioner.provision(properties.isForceRecreate());
    log.info("Bus topology ready: {} queue(s)", bindings.size());
  }
}
