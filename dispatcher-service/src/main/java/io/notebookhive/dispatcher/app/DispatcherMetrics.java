package io.notebookhive.dispatcher.app;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.notebookhive.bus.message.JobStatus;
import io.notebookhive.dispatcher.domain.JobTracker;
import io.notebookhive.topology.DiagramKind;
import java.util.Locale;
import java.util.Objects;

public class DispatcherMetrics {

    static final String JOBS = "notebookhive.dispatcher.jobs";
    static final String REQUESTS = "notebookhive.dispatcher.requests";
    static final String RETRIES = "notebookhive.dispatcher.retries";
    static final String DISCARDED = "notebookhive.dispatcher.responses.discarded";
    static final String ACTIVE = "notebookhive.dispatcher.jobs.active";

    private final MeterRegistry registry;
    private final Counter discarded;

    public DispatcherMetrics(MeterRegistry registry, JobTracker tracker) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.discarded = Counter.builder(DISCARDED)
            .description("Converter responses that were unknown, stale, duplicate or undecodable")
            .register(registry);
        Gauge.builder(ACTIVE, tracker, JobTracker::activeJobs)
            .description("Notebook jobs waiting for converter responses")
            .register(registry);
    }

    public void jobFinished(JobStatus status) {
        Counter.builder(JOBS)
            .tag("status", status.name().toLowerCase(Locale.ROOT))
            .register(registry)
            .increment();
    }

    public void requestPublished(DiagramKind kind) {
        Counter.builder(REQUESTS).tag("kind", kind.wireName()).register(registry).increment();
    }

    public void retryPublished(DiagramKind kind) {
        Counter.builder(RETRIES).tag("kind", kind.wireName()).register(registry).increment();
    }

    public void responseDiscarded() {
        discarded.increment();
    }
}
