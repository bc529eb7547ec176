package com.retail.storeintel.scheduler;

import com.retail.storeintel.config.SchedulerProperties;
import com.retail.storeintel.dto.JobStatus;
import com.retail.storeintel.exception.SchedulerJobException;
import com.retail.storeintel.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Drives the refresh jobs from an explicit job table.
 *
 * <p>The loop scheduler wakes every tick, finds due jobs and hands them to the
 * job executor. A job is claimed by moving it from IDLE to RUNNING; a trigger
 * that finds it already RUNNING is skipped, so runs of one job never overlap.
 */
@Slf4j
public class RefreshScheduler implements JobContext {

    private final Map<String, JobEntry> jobTable = new LinkedHashMap<>();
    private final Map<String, Future<?>> dispatched = new ConcurrentHashMap<>();
    private final SchedulerProperties properties;
    private final Clock clock;
    private final TaskScheduler loopScheduler;
    private final AsyncTaskExecutor jobExecutor;

    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean stopRequested;
    private ScheduledFuture<?> loop;

    public RefreshScheduler(List<RefreshJob> jobs, SchedulerProperties properties, Clock clock,
                            TaskScheduler loopScheduler, AsyncTaskExecutor jobExecutor) {
        this.properties = properties;
        this.clock = clock;
        this.loopScheduler = loopScheduler;
        this.jobExecutor = jobExecutor;
        for (RefreshJob job : jobs) {
            if (jobTable.putIfAbsent(job.name(), new JobEntry(job)) != null) {
                throw new IllegalArgumentException("Duplicate job name: " + job.name());
            }
        }
    }

    /**
     * Starts the loop. Each job first becomes due one cadence after start;
     * callers wanting an immediate run use {@link #runNow(String)}.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.info("SCHEDULER: Already started");
            return;
        }
        stopRequested = false;
        Instant now = clock.instant();
        jobTable.values().forEach(entry -> entry.nextDueAt = now.plus(entry.job.cadence()));

        Duration tick = properties.getTickInterval();
        loop = loopScheduler.scheduleWithFixedDelay(this::tick, loopScheduler.getClock().instant().plus(tick), tick);

        log.info("SCHEDULER: Started with jobs {} (tick {})", jobTable.keySet(), properties.getTickInterval());
    }

    /**
     * Requests a cooperative stop and waits up to the configured timeout for
     * running jobs to finish, then interrupts whatever is left.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        stopRequested = true;
        log.info("SCHEDULER: Stopping, waiting up to {} for running jobs", properties.getStopTimeout());

        loop.cancel(false);
        long deadline = System.nanoTime() + properties.getStopTimeout().toNanos();
        boolean forced = false;
        for (Future<?> run : dispatched.values()) {
            if (forced) {
                run.cancel(true);
                continue;
            }
            try {
                run.get(remaining(deadline), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                log.warn("SCHEDULER: Jobs still running after {}, interrupting: {}",
                        properties.getStopTimeout(), runningJobs());
                forced = true;
                run.cancel(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                forced = true;
                run.cancel(true);
            } catch (ExecutionException | CancellationException e) {
                log.debug("SCHEDULER: Dispatched run ended abnormally: {}", e.toString());
            }
        }
        dispatched.clear();
        log.info("SCHEDULER: Stopped");
    }

    /**
     * Runs the job in the calling thread unless it is already running.
     *
     * @throws ValidationException if no job has that name
     */
    public JobOutcome runNow(String jobName) {
        JobEntry entry = jobTable.get(jobName);
        if (entry == null) {
            throw new ValidationException("Unknown job: " + jobName + ", expected one of " + jobTable.keySet());
        }
        if (!entry.tryClaim(clock.instant())) {
            entry.skipCount.incrementAndGet();
            log.info("SCHEDULER: Skipping manual run of {}, previous run still in progress", jobName);
            return JobOutcome.SKIPPED;
        }
        log.info("SCHEDULER: Manual run of {}", jobName);
        return execute(entry);
    }

    public List<JobStatus> jobStatuses() {
        return jobTable.values().stream().map(JobEntry::status).collect(Collectors.toList());
    }

    public Optional<JobState> stateOf(String jobName) {
        return Optional.ofNullable(jobTable.get(jobName)).map(entry -> entry.state.get());
    }

    @Override
    public boolean isStopRequested() {
        return stopRequested || Thread.currentThread().isInterrupted();
    }

    void tick() {
        if (stopRequested) {
            return;
        }
        Instant now = clock.instant();
        for (JobEntry entry : jobTable.values()) {
            if (entry.nextDueAt == null || now.isBefore(entry.nextDueAt)) {
                continue;
            }
            if (!entry.tryClaim(now)) {
                entry.nextDueAt = now.plus(entry.job.cadence());
                entry.skipCount.incrementAndGet();
                log.info("SCHEDULER: Skipping {}, previous run still in progress", entry.job.name());
                continue;
            }
            try {
                dispatched.put(entry.job.name(), jobExecutor.submit(() -> execute(entry)));
            } catch (RuntimeException e) {
                entry.release(JobOutcome.FAILED, clock.instant());
                log.error("SCHEDULER: Could not dispatch {}: {}", entry.job.name(), e.getMessage());
            }
        }
    }

    /**
     * Runs a claimed job. Never throws; the job always ends IDLE.
     */
    private JobOutcome execute(JobEntry entry) {
        String name = entry.job.name();
        JobOutcome outcome = JobOutcome.FAILED;
        try {
            log.info("SCHEDULER: Running {}", name);
            entry.job.run(this);
            outcome = JobOutcome.COMPLETED;
            log.info("SCHEDULER: {} completed in {} ms", name,
                    Duration.between(entry.lastStartedAt, clock.instant()).toMillis());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            entry.failureCount.incrementAndGet();
            SchedulerJobException failure = e instanceof SchedulerJobException
                    ? (SchedulerJobException) e
                    : new SchedulerJobException(name, null, e);
            log.error("SCHEDULER: {}", failure.getMessage(), failure);
        } finally {
            entry.release(outcome, clock.instant());
        }
        return outcome;
    }

    private List<String> runningJobs() {
        return jobTable.values().stream()
                .filter(entry -> entry.state.get() == JobState.RUNNING)
                .map(entry -> entry.job.name())
                .collect(Collectors.toList());
    }

    private static long remaining(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    private static final class JobEntry {

        private final RefreshJob job;
        private final AtomicReference<JobState> state = new AtomicReference<>(JobState.IDLE);
        private final AtomicLong runCount = new AtomicLong();
        private final AtomicLong failureCount = new AtomicLong();
        private final AtomicLong skipCount = new AtomicLong();

        private volatile Instant nextDueAt;
        private volatile Instant lastStartedAt;
        private volatile Instant lastFinishedAt;
        private volatile JobOutcome lastOutcome;

        private JobEntry(RefreshJob job) {
            this.job = job;
        }

        boolean tryClaim(Instant now) {
            if (!state.compareAndSet(JobState.IDLE, JobState.RUNNING)) {
                return false;
            }
            lastStartedAt = now;
            nextDueAt = now.plus(job.cadence());
            runCount.incrementAndGet();
            return true;
        }

        void release(JobOutcome outcome, Instant now) {
            lastOutcome = outcome;
            lastFinishedAt = now;
            state.set(JobState.IDLE);
        }

        JobStatus status() {
            return JobStatus.builder()
                    .jobName(job.name())
                    .state(state.get().name())
                    .cadence(job.cadence())
                    .lastStartedAt(lastStartedAt)
                    .lastFinishedAt(lastFinishedAt)
                    .lastOutcome(lastOutcome != null ? lastOutcome.name() : null)
                    .runCount(runCount.get())
                    .failureCount(failureCount.get())
                    .skipCount(skipCount.get())
                    .build();
        }
    }
}
