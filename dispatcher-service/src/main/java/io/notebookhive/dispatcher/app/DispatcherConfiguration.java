package io.notebookhive.dispatcher.app;

import io.micrometer.core.instrument.MeterRegistry;
import io.notebookhive.bus.BusClient;
import io.notebookhive.bus.BusMessageCodec;
import io.notebookhive.bus.BusQueueVerifier;
import io.notebookhive.dispatcher.config.DispatcherProperties;
import io.notebookhive.dispatcher.domain.JobTracker;
import io.notebookhive.dispatcher.infra.kernel.KernelCellExecutor;
import io.notebookhive.dispatcher.infra.kernel.NoopCellExecutor;
import io.notebookhive.dispatcher.notebook.ArtifactSplicer;
import io.notebookhive.dispatcher.notebook.DiagramBlockExtractor;
import io.notebookhive.topology.BusTopology;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class DispatcherConfiguration {
    private static final Logger log = LoggerFactory.getLogger(DispatcherConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    Clock dispatcherClock() {
        return Clock.systemUTC();
    }

    @Bean
    String dispatcherRequestQueue(BusTopology topology) {
        return topology.notebookRequestSubject();
    }

    @Bean
    String[] dispatcherResponseQueues(BusTopology topology) {
        return topology.responseSubjects().toArray(String[]::new);
    }

    @Bean
    JobTracker jobTracker(Clock clock, DispatcherProperties properties) {
        return new JobTracker(clock, properties.retryLimit(), properties.deadline(), properties.finalizedJobMemory());
    }

    @Bean
    DispatcherMetrics dispatcherMetrics(MeterRegistry meterRegistry, JobTracker jobTracker) {
        return new DispatcherMetrics(meterRegistry, jobTracker);
    }

    @Bean
    DiagramBlockExtractor diagramBlockExtractor() {
        return new DiagramBlockExtractor();
    }

    @Bean
    ArtifactSplicer artifactSplicer() {
        return new ArtifactSplicer();
    }

    @Bean
    CellExecutor cellExecutor(BusMessageCodec codec, DispatcherProperties properties) {
        DispatcherProperties.Kernel kernel = properties.kernel();
        if (!kernel.enabled()) {
            log.info("No kernel configured; code cells are never executed");
            return new NoopCellExecutor();
        }
        log.info("Executing code cells through kernel at {}", kernel.baseUrl());
        return new KernelCellExecutor(codec.mapper(), kernel.baseUrl(), kernel.timeout());
    }

    @Bean
    NotebookDispatcher notebookDispatcher(JobTracker jobTracker,
                                          DiagramBlockExtractor extractor,
                                          ArtifactSplicer splicer,
                                          CellExecutor cellExecutor,
                                          BusClient busClient,
                                          BusTopology topology,
                                          DispatcherProperties properties,
                                          DispatcherMetrics metrics) {
        return new NotebookDispatcher(jobTracker, extractor, splicer, cellExecutor, busClient, topology, properties,
            metrics);
    }

    @Bean
    @ConditionalOnProperty(prefix = "notebookhive.bus", name = "verify-queues", havingValue = "true",
        matchIfMissing = true)
    BusQueueVerifier dispatcherQueueVerifier(AmqpAdmin amqpAdmin, BusTopology topology) {
        List<String> queues = new ArrayList<>();
        queues.add(topology.notebookRequestSubject());
        queues.addAll(topology.responseSubjects());
        return new BusQueueVerifier(amqpAdmin, queues);
    }
}
