package io.notebookhive.dispatcher.domain;

import io.notebookhive.bus.message.JobStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory state of every open notebook job.
 * <p>
 * All state lives behind one lock and no method calls out while holding it, so listener threads
 * and the deadline sweeper can share a tracker freely. A job leaves the tracker in the same
 * critical section that makes it terminal; the caller receiving the {@link TerminalJob} is the only
 * one that ever sees it, which makes finalization happen exactly once per job id. Ids of finished
 * jobs are remembered (bounded, least recently finished evicted first) so that a re-submitted
 * job id is recognised as a duplicate.
 */
public class JobTracker {

    private static final Logger log = LoggerFactory.getLogger(JobTracker.class);

    static final String DEADLINE_EXCEEDED = "deadline exceeded";

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, JobEntry> jobs = new HashMap<>();
    private final Map<String, JobEntry> jobsByCorrelation = new HashMap<>();
    private final Map<String, Boolean> finishedJobs;
    private final Clock clock;
    private final int retryLimit;
    private final Duration deadline;

    public JobTracker(Clock clock, int retryLimit, Duration deadline, int finishedJobMemory) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.deadline = Objects.requireNonNull(deadline, "deadline");
        if (retryLimit < 1) {
            throw new IllegalArgumentException("retryLimit must be at least 1");
        }
        this.retryLimit = retryLimit;
        int memory = Math.max(0, finishedJobMemory);
        this.finishedJobs = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > memory;
            }
        };
    }

    /**
     * Starts tracking a job and all of its blocks. Must be called before any request of the job is
     * published.
     */
    public Registration register(NotebookJob job, List<DiagramBlock> blocks) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(blocks, "blocks");
        lock.lock();
        try {
            if (jobs.containsKey(job.id()) || finishedJobs.containsKey(job.id())) {
                return Registration.duplicate();
            }
            Instant now = clock.instant();
            if (blocks.isEmpty()) {
                finishedJobs.put(job.id(), Boolean.TRUE);
                return Registration.completed(new TerminalJob(job, JobStatus.COMPLETED, List.of(), null, now));
            }
            JobEntry entry = new JobEntry(job, now, now.plus(deadline));
            for (DiagramBlock block : blocks) {
                if (!job.id().equals(block.jobId())) {
                    throw new IllegalArgumentException("block " + block.blockIndex() + " belongs to job " + block.jobId());
                }
                if (entry.blocks.containsKey(block.correlationId()) || jobsByCorrelation.containsKey(block.correlationId())) {
                    throw new IllegalArgumentException("correlation id " + block.correlationId() + " is already tracked");
                }
                entry.blocks.put(block.correlationId(), new BlockState(block));
            }
            jobs.put(job.id(), entry);
            entry.blocks.keySet().forEach(correlationId -> jobsByCorrelation.put(correlationId, entry));
            log.debug("tracking job {} with {} block(s), deadline {}", job.id(), blocks.size(), entry.deadline);
            return Registration.acceptedJob();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks a pending job as in flight once its first request has been published.
     *
     * @return {@code true} when the status changed
     */
    public boolean markInFlight(String jobId) {
        lock.lock();
        try {
            JobEntry entry = jobs.get(jobId);
            if (entry == null || entry.status != JobStatus.PENDING) {
                return false;
            }
            entry.status = JobStatus.IN_FLIGHT;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a converter response to its block.
     *
     * @param attempt the attempt the response answers; failures of older attempts are stale
     */
    public RecordOutcome recordResult(String correlationId, int attempt, BlockResult result) {
        Objects.requireNonNull(result, "result");
        lock.lock();
        try {
            JobEntry entry = correlationId == null ? null : jobsByCorrelation.get(correlationId);
            if (entry == null) {
                return RecordOutcome.unknown();
            }
            BlockState block = entry.blocks.get(correlationId);
            if (result.succeeded()) {
                if (block.state == BlockState.State.SUCCEEDED) {
                    return RecordOutcome.ignored();
                }
                block.succeed(result.artifact(), result.mimeType());
            } else {
                if (block.state != BlockState.State.PENDING || attempt < block.attempt) {
                    return RecordOutcome.ignored();
                }
                block.failures++;
                if (block.failures < retryLimit) {
                    block.attempt++;
                    return RecordOutcome.retry(block.block, block.attempt);
                }
                block.fail(result.reason());
            }
            if (entry.outstanding() > 0) {
                return RecordOutcome.recorded();
            }
            return RecordOutcome.terminal(finish(entry, null, null));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces every job past its deadline to a terminal state. Blocks still outstanding are failed
     * with {@value #DEADLINE_EXCEEDED}.
     */
    public List<TerminalJob> sweep() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<JobEntry> expired = new ArrayList<>();
            for (JobEntry entry : jobs.values()) {
                if (!entry.deadline.isAfter(now)) {
                    expired.add(entry);
                }
            }
            List<TerminalJob> finished = new ArrayList<>(expired.size());
            for (JobEntry entry : expired) {
                entry.failOutstanding(DEADLINE_EXCEEDED);
                finished.add(finish(entry, null, null));
            }
            return finished;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fails a job immediately, e.g. when its requests cannot be published.
     *
     * @return the terminal snapshot, or empty when the job is not open (anymore)
     */
    public Optional<TerminalJob> fail(String jobId, String reason) {
        lock.lock();
        try {
            JobEntry entry = jobs.get(jobId);
            if (entry == null) {
                return Optional.empty();
            }
            entry.failOutstanding(reason);
            return Optional.of(finish(entry, JobStatus.FAILED, reason));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Terminal snapshot for a job that was refused before any block could be tracked.
     *
     * @return empty when the job id is already known
     */
    public Optional<TerminalJob> reject(NotebookJob job, String reason) {
        lock.lock();
        try {
            if (jobs.containsKey(job.id()) || finishedJobs.containsKey(job.id())) {
                return Optional.empty();
            }
            finishedJobs.put(job.id(), Boolean.TRUE);
            return Optional.of(new TerminalJob(job, JobStatus.FAILED, List.of(), reason, clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    public boolean isTerminal(String jobId) {
        lock.lock();
        try {
            return finishedJobs.containsKey(jobId);
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobStatus> status(String jobId) {
        lock.lock();
        try {
            JobEntry entry = jobs.get(jobId);
            return entry == null ? Optional.empty() : Optional.of(entry.status);
        } finally {
            lock.unlock();
        }
    }

    public int activeJobs() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    private TerminalJob finish(JobEntry entry, JobStatus forced, String error) {
        jobs.remove(entry.job.id());
        entry.blocks.keySet().forEach(jobsByCorrelation::remove);
        finishedJobs.put(entry.job.id(), Boolean.TRUE);

        List<BlockSnapshot> snapshots = new ArrayList<>(entry.blocks.size());
        int succeeded = 0;
        for (BlockState block : entry.blocks.values()) {
            snapshots.add(block.snapshot());
            if (block.state == BlockState.State.SUCCEEDED) {
                succeeded++;
            }
        }
        JobStatus status;
        if (forced != null) {
            status = forced;
        } else if (succeeded == snapshots.size()) {
            status = JobStatus.COMPLETED;
        } else if (succeeded == 0) {
            status = JobStatus.FAILED;
        } else {
            status = JobStatus.PARTIALLY_FAILED;
        }
        entry.status = status;
        Instant now = clock.instant();
        log.debug("job {} left the tracker as {} after {} ms", entry.job.id(), status,
            Duration.between(entry.createdAt, now).toMillis());
        return new TerminalJob(entry.job, status, snapshots, error, now);
    }

    private static final class JobEntry {
        private final NotebookJob job;
        private final Instant createdAt;
        private final Instant deadline;
        // insertion order is extraction order
        private final Map<String, BlockState> blocks = new LinkedHashMap<>();
        private JobStatus status = JobStatus.PENDING;

        private JobEntry(NotebookJob job, Instant createdAt, Instant deadline) {
            this.job = job;
            this.createdAt = createdAt;
            this.deadline = deadline;
        }

        private int outstanding() {
            int outstanding = 0;
            for (BlockState block : blocks.values()) {
                if (block.state == BlockState.State.PENDING) {
                    outstanding++;
                }
            }
            return outstanding;
        }

        private void failOutstanding(String reason) {
            for (BlockState block : blocks.values()) {
                if (block.state == BlockState.State.PENDING) {
                    block.fail(reason);
                }
            }
        }
    }

    private static final class BlockState {
        enum State { PENDING, SUCCEEDED, FAILED }

        private final DiagramBlock block;
        private State state = State.PENDING;
        private int attempt = 1;
        private int failures;
        private byte[] artifact;
        private String mimeType;
        private String failureReason;

        private BlockState(DiagramBlock block) {
            this.block = block;
        }

        private void succeed(byte[] artifact, String mimeType) {
            this.state = State.SUCCEEDED;
            this.artifact = artifact;
            this.mimeType = mimeType;
            this.failureReason = null;
        }

        private void fail(String reason) {
            this.state = State.FAILED;
            this.failureReason = reason;
        }

        private BlockSnapshot snapshot() {
            return new BlockSnapshot(block, state == State.SUCCEEDED, artifact, mimeType, failureReason, attempt);
        }
    }
}
