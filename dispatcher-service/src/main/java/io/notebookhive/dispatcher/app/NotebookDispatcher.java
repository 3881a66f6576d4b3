package io.notebookhive.dispatcher.app;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.notebookhive.bus.BusClient;
import io.notebookhive.bus.BusPublishException;
import io.notebookhive.bus.message.ConversionRequest;
import io.notebookhive.bus.message.ConversionResponse;
import io.notebookhive.bus.message.JobStatus;
import io.notebookhive.bus.message.NotebookResult;
import io.notebookhive.bus.message.ProcessNotebookRequest;
import io.notebookhive.dispatcher.config.DispatcherProperties;
import io.notebookhive.dispatcher.domain.BlockResult;
import io.notebookhive.dispatcher.domain.DiagramBlock;
import io.notebookhive.dispatcher.domain.JobTracker;
import io.notebookhive.dispatcher.domain.NotebookJob;
import io.notebookhive.dispatcher.domain.RecordOutcome;
import io.notebookhive.dispatcher.domain.Registration;
import io.notebookhive.dispatcher.domain.TerminalJob;
import io.notebookhive.dispatcher.notebook.ArtifactSplicer;
import io.notebookhive.dispatcher.notebook.DiagramBlockExtractor;
import io.notebookhive.dispatcher.notebook.MalformedNotebookException;
import io.notebookhive.topology.BusTopology;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives notebook jobs: extracts diagram blocks, fans them out to the converters, feeds the
 * responses into the {@link JobTracker} and publishes exactly one {@link NotebookResult} per job.
 * <p>
 * Bus calls, splicing and kernel execution all happen outside the tracker's lock.
 */
public class NotebookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotebookDispatcher.class);

    private final JobTracker tracker;
    private final DiagramBlockExtractor extractor;
    private final ArtifactSplicer splicer;
    private final CellExecutor cellExecutor;
    private final BusClient bus;
    private final BusTopology topology;
    private final DispatcherProperties properties;
    private final DispatcherMetrics metrics;

    public NotebookDispatcher(JobTracker tracker,
                              DiagramBlockExtractor extractor,
                              ArtifactSplicer splicer,
                              CellExecutor cellExecutor,
                              BusClient bus,
                              BusTopology topology,
                              DispatcherProperties properties,
                              DispatcherMetrics metrics) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.splicer = Objects.requireNonNull(splicer, "splicer");
        this.cellExecutor = Objects.requireNonNull(cellExecutor, "cellExecutor");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.topology = Objects.requireNonNull(topology, "topology");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Accepts a notebook submission.
     *
     * @return the id of the job, generated when the request carries none
     */
    public String submit(ProcessNotebookRequest request) {
        String jobId = request.jobId() != null ? request.jobId() : UUID.randomUUID().toString();
        NotebookJob job = new NotebookJob(jobId, request.notebook(), request.notebookPath(), request.replyTo(),
            request.execute());

        List<DiagramBlock> blocks;
        try {
            blocks = extractor.extract(jobId, request.notebook());
        } catch (MalformedNotebookException ex) {
            log.warn("Rejecting notebook {}: {}", job.label(), ex.getMessage());
            tracker.reject(job, "malformed notebook: " + ex.getMessage())
                .ifPresentOrElse(this::finish, () -> log.warn("Ignoring duplicate submission of job {}", jobId));
            return jobId;
        }

        Registration registration = tracker.register(job, blocks);
        if (registration.duplicateJob()) {
            log.warn("Ignoring duplicate submission of job {}", jobId);
            return jobId;
        }
        if (registration.completed() != null) {
            log.info("Notebook {} has no diagram blocks", job.label());
            finish(registration.completed());
            return jobId;
        }

        log.info("Dispatching {} diagram block(s) of {} as job {}", blocks.size(), job.label(), jobId);
        for (DiagramBlock block : blocks) {
            try {
                publish(block, 1);
            } catch (BusPublishException ex) {
                tracker.fail(jobId, "could not publish conversion request: " + ex.getMessage())
                    .ifPresent(this::finish);
                return jobId;
            }
            tracker.markInFlight(jobId);
        }
        return jobId;
    }

    /**
     * Correlates one converter response.
     */
    public void onResponse(ConversionResponse response) {
        BlockResult result = response.succeeded()
            ? BlockResult.success(response.artifact(), response.mimeType())
            : BlockResult.failure(response.error());
        RecordOutcome outcome = tracker.recordResult(response.correlationId(), response.attempt(), result);
        switch (outcome.type()) {
            case UNKNOWN -> {
                log.warn("Discarding response for unknown correlation id {} (job {})",
                    response.correlationId(), response.jobId());
                metrics.responseDiscarded();
            }
            case IGNORED -> {
                log.debug("Ignoring duplicate or stale {} response for {} (attempt {})",
                    response.status(), response.correlationId(), response.attempt());
                metrics.responseDiscarded();
            }
            case RECORDED -> log.debug("Recorded {} for {}", response.status(), response.correlationId());
            case RETRY -> retry(outcome.block(), outcome.nextAttempt(), response.error());
            case TERMINAL -> finish(outcome.terminal());
        }
    }

    /**
     * Finalizes every job whose deadline has passed.
     */
    public int sweepDeadlines() {
        List<TerminalJob> expired = tracker.sweep();
        for (TerminalJob terminal : expired) {
            log.warn("Job {} reached its deadline with {} unresolved block(s)", terminal.job().id(),
                terminal.failures().size());
            try {
                finish(terminal);
            } catch (RuntimeException ex) {
                log.error("Finalizing expired job {} failed", terminal.job().id(), ex);
            }
        }
        return expired.size();
    }

    private void retry(DiagramBlock block, int attempt, String reason) {
        log.info("Conversion of {} block {} of job {} failed ({}), retrying as attempt {}/{}",
            block.kind().wireName(), block.blockIndex(), block.jobId(), reason, attempt, properties.retryLimit());
        try {
            publish(block, attempt);
            metrics.retryPublished(block.kind());
        } catch (BusPublishException ex) {
            tracker.fail(block.jobId(), "could not publish conversion retry: " + ex.getMessage())
                .ifPresent(this::finish);
        }
    }

    private void publish(DiagramBlock block, int attempt) {
        ConversionRequest request = ConversionRequest.forSource(block.correlationId(), block.jobId(), block.kind(),
                block.source(), properties.outputFormat(block.kind()), topology.responseSubject(block.kind()))
            .withAttempt(attempt);
        bus.publish(topology.requestSubject(block.kind()), request, block.correlationId());
        metrics.requestPublished(block.kind());
    }

    /**
     * Publishes the result of a job that already left the tracker. Nothing else will ever publish
     * for this job, so output assembly problems end up in the result instead of propagating.
     */
    private void finish(TerminalJob terminal) {
        NotebookJob job = terminal.job();
        JobStatus status = terminal.status();
        String error = terminal.error();
        ObjectNode output;
        try {
            output = splicer.splice(terminal);
        } catch (RuntimeException ex) {
            log.error("Could not splice the artifacts of job {}", job.id(), ex);
            output = null;
            status = JobStatus.FAILED;
            error = "could not splice artifacts: " + ex.getMessage();
        }

        String kernelError = null;
        if (job.execute() && output != null && cellExecutor.enabled()) {
            ObjectNode executed = output.deepCopy();
            try {
                cellExecutor.execute(job.id(), executed);
                output = executed;
            } catch (CellExecutionException ex) {
                log.warn("Code cells of job {} were not executed: {}", job.id(), ex.getMessage());
                kernelError = ex.getMessage();
            } catch (RuntimeException ex) {
                log.error("Kernel execution of job {} failed unexpectedly", job.id(), ex);
                kernelError = "kernel execution failed: " + ex;
            }
        }

        NotebookResult result = new NotebookResult(job.id(), status, output, terminal.failures(), error,
            kernelError, terminal.finishedAt());
        String subject = job.replyTo() != null ? job.replyTo() : topology.notebookResultSubject();
        metrics.jobFinished(status);
        log.info("Job {} ({}) finished {} with {} failed block(s)", job.id(), job.label(), status,
            result.failures().size());
        try {
            bus.publish(subject, result, job.id());
        } catch (BusPublishException ex) {
            log.error("Result of job {} could not be published to {}", job.id(), subject, ex);
        }
    }
}
