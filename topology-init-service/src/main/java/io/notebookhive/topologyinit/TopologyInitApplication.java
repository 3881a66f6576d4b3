package io.notebookhive.topologyinit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * One-shot process: declares the bus topology and exits with 0, or 1 when provisioning failed.
 */
@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "io.notebookhive.topologyinit")
public class TopologyInitApplication {

  private static final Logger log = LoggerFactory.getLogger(TopologyInitApplication.class);

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    try {
      ConfigurableApplicationContext context = SpringApplication.run(TopologyInitApplication.class, args);
      return SpringApplication.exit(context);
    } catch (RuntimeException ex) {
      log.error("Topology initialisation failed: {}", ex.getMessage());
      return 1;
    }
  }
}
