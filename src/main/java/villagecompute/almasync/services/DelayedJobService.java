/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.almasync.data.models.DelayedJob;
import villagecompute.almasync.data.models.RepeatableJob;
import villagecompute.almasync.jobs.JobEventListener;
import villagecompute.almasync.jobs.JobOptions;
import villagecompute.almasync.jobs.JobProcessor;
import villagecompute.almasync.jobs.JobRuntime;
import villagecompute.almasync.jobs.JobState;
import villagecompute.almasync.jobs.QueueStats;
import villagecompute.almasync.jobs.QueuedJob;
import villagecompute.almasync.jobs.RepeatableJobInfo;
import villagecompute.almasync.observability.LoggingConfig;
import villagecompute.almasync.util.CronSchedules;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Database-backed {@link JobRuntime}.
 *
 * <p>
 * Jobs live in the {@code delayed_jobs} table and cron definitions in {@code repeatable_jobs}. It handles:
 * <ul>
 * <li>Create-or-replace submission keyed by job id</li>
 * <li>Spawning a job instance per cron tick of each repeatable definition</li>
 * <li>Worker polling and claiming via a conditional update on {@code state}/{@code locked_by}</li>
 * <li>Retry logic with exponential backoff</li>
 * <li>OpenTelemetry instrumentation and MDC enrichment of every execution</li>
 * </ul>
 *
 * <p>
 * <b>Retry Strategy:</b> Failed jobs retry up to {@code max_attempts} (default 3) with exponential backoff:
 * {@code delay = 2^(attempt-1) * backoff_delay} with random jitter (±25%). After exhausting retries, jobs enter FAILED
 * and listeners are notified with {@code retriesExhausted = true}.
 *
 * <p>
 * <b>Concurrency:</b> A semaphore sized to the configured concurrency bounds the number of jobs running at once. The
 * poll loop ({@link villagecompute.almasync.jobs.JobQueueScheduler}) only claims as many jobs as there are free slots.
 *
 * @see JobProcessor for processor contract
 */
@ApplicationScoped
public class DelayedJobService implements JobRuntime {

    private static final Logger LOG = Logger.getLogger(DelayedJobService.class);

    private static final String REPEAT_INSTANCE_PREFIX = "repeat:";

    private final Map<String, JobProcessor> processors = new ConcurrentHashMap<>();
    private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean processing = new AtomicBoolean(false);
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final String workerId = buildWorkerId();

    private volatile Semaphore slots = new Semaphore(0);
    private volatile int concurrency;
    private ExecutorService workers;

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "almasync.timezone",
            defaultValue = "Africa/Nairobi")
    String timezone;

    @Override
    public String submit(String jobId, String jobName, Map<String, Object> payload, JobOptions options) {
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(jobName, "jobName is required");
        JobOptions effective = options != null ? options : JobOptions.defaults();

        if (effective.isRepeating()) {
            return submitRepeatable(jobId, jobName, payload, effective);
        }

        return QuarkusTransaction.requiringNew().call(() -> {
            DelayedJob existing = DelayedJob.findById(jobId);
            if (existing != null && existing.state == JobState.ACTIVE) {
                LOG.infof("Job %s is already active; keeping the running instance", jobId);
                return existing.id;
            }
            cancelInCurrentTransaction(jobId);
            DelayedJob.create(jobId, jobName, payload, effective, null, Instant.now());
            return jobId;
        });
    }

    private String submitRepeatable(String jobId, String jobName, Map<String, Object> payload, JobOptions options) {
        JobOptions.Repeat repeat = options.repeat();
        String key = repeat.key() != null ? repeat.key() : jobId;
        Instant now = Instant.now();
        Instant firstRun = repeat.immediately() ? now
                : CronSchedules.nextRun(repeat.pattern(), now, zone())
                        .orElseThrow(() -> new IllegalArgumentException(
                                "Cron expression never fires: " + repeat.pattern()));

        QuarkusTransaction.requiringNew().run(() -> {
            cancelInCurrentTransaction(jobId);
            if (!key.equals(jobId)) {
                cancelInCurrentTransaction(key);
            }
            RepeatableJob definition = new RepeatableJob();
            definition.repeatKey = key;
            definition.jobName = jobName;
            definition.pattern = repeat.pattern();
            definition.payload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
            definition.attempts = options.attempts();
            definition.backoffDelaySeconds = options.backoffDelay().toSeconds();
            definition.nextRunAt = firstRun;
            definition.createdAt = now;
            definition.updatedAt = now;
            definition.persist();
        });

        LOG.infof("Registered repeatable job %s (pattern: %s, immediately: %s, first run: %s)", key,
                repeat.pattern(), repeat.immediately(), firstRun);
        return key;
    }

    @Override
    public boolean cancel(String jobId) {
        if (jobId == null) {
            return false;
        }
        boolean found = QuarkusTransaction.requiringNew().call(() -> cancelInCurrentTransaction(jobId));
        LOG.debugf("Cancel %s: %s", jobId, found ? "removed" : "nothing found");
        return found;
    }

    /**
     * Removes the repeatable definition and non-ACTIVE instances belonging to {@code jobId}. Must run inside a
     * transaction.
     */
    private boolean cancelInCurrentTransaction(String jobId) {
        boolean found = false;
        String repeatKey = jobId;

        DelayedJob job = DelayedJob.findById(jobId);
        if (job != null) {
            found = true;
            if (job.repeatKey != null) {
                repeatKey = job.repeatKey;
            }
            if (job.state == JobState.ACTIVE) {
                LOG.infof("Job %s is active; it will run to completion", jobId);
            } else {
                job.delete();
                DelayedJob.flush();
            }
        }

        if (RepeatableJob.deleteById(repeatKey)) {
            RepeatableJob.flush();
            found = true;
            LOG.infof("Removed repeatable job %s", repeatKey);
        }
        if (DelayedJob.deleteQueuedByRepeatKey(repeatKey) > 0) {
            found = true;
        }
        return found;
    }

    @Override
    public Optional<QueuedJob> getJob(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return QuarkusTransaction.requiringNew()
                .call(() -> DelayedJob.<DelayedJob> findByIdOptional(jobId).map(DelayedJob::toSnapshot));
    }

    @Override
    public List<QueuedJob> getJobs(Set<JobState> states) {
        return QuarkusTransaction.requiringNew()
                .call(() -> DelayedJob.findByStates(states).stream().map(DelayedJob::toSnapshot).toList());
    }

    @Override
    public Optional<QueuedJob> findJobByScheduleId(String scheduleId) {
        if (scheduleId == null) {
            return Optional.empty();
        }
        return QuarkusTransaction.requiringNew().call(() -> {
            DelayedJob direct = DelayedJob.findById(scheduleId);
            if (direct != null) {
                return Optional.of(direct.toSnapshot());
            }
            return DelayedJob.findLatestByRepeatKey(scheduleId).map(DelayedJob::toSnapshot);
        });
    }

    @Override
    public List<RepeatableJobInfo> getRepeatableJobs() {
        return QuarkusTransaction.requiringNew()
                .call(() -> RepeatableJob.listOrdered().stream().map(RepeatableJob::toInfo).toList());
    }

    @Override
    public Optional<RepeatableJobInfo> getRepeatableJob(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return QuarkusTransaction.requiringNew()
                .call(() -> RepeatableJob.<RepeatableJob> findByIdOptional(key).map(RepeatableJob::toInfo));
    }

    @Override
    public QueueStats getStats() {
        return QuarkusTransaction.requiringNew()
                .call(() -> new QueueStats(DelayedJob.countByState(JobState.WAITING),
                        DelayedJob.countByState(JobState.ACTIVE), DelayedJob.countByState(JobState.COMPLETED),
                        DelayedJob.countByState(JobState.FAILED), DelayedJob.countByState(JobState.DELAYED),
                        DelayedJob.countByState(JobState.PAUSED)));
    }

    @Override
    public void registerProcessor(String name, JobProcessor processor) {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(processor, "processor is required");
        JobProcessor previous = processors.putIfAbsent(name, processor);
        if (previous != null) {
            throw new IllegalStateException("Duplicate processors registered for job name " + name + ": "
                    + previous.getClass().getName() + " and " + processor.getClass().getName());
        }
        LOG.infof("Registered processor for job name %s", name);
    }

    @Override
    public Collection<String> getProcessorNames() {
        return List.copyOf(processors.keySet());
    }

    @Override
    public boolean hasProcessor(String name) {
        return name != null && processors.containsKey(name);
    }

    @Override
    public void addListener(JobEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    @Override
    public synchronized void startProcessing(int concurrency) {
        if (processing.get()) {
            LOG.warnf("Job processing already started with %d slots", this.concurrency);
            return;
        }
        int slotCount = Math.max(1, concurrency);

        requeueStalled();

        this.workers = Executors.newFixedThreadPool(slotCount, runnable -> {
            Thread thread = new Thread(runnable, "alma-sync-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.slots = new Semaphore(slotCount);
        this.concurrency = slotCount;
        processing.set(true);
        LOG.infof("Started job processing (worker: %s, concurrency: %d)", workerId, slotCount);
    }

    @Override
    public int requeueStalled() {
        int requeued = QuarkusTransaction.requiringNew().call(() -> DelayedJob.requeueStalled(workerId));
        if (requeued > 0) {
            LOG.warnf("Re-queued %d jobs left active by a previous process", requeued);
        }
        return requeued;
    }

    @Override
    @PreDestroy
    public synchronized void stopProcessing() {
        if (!processing.compareAndSet(true, false)) {
            return;
        }
        if (workers != null) {
            workers.shutdown();
        }
        LOG.infof("Stopped job processing (worker: %s)", workerId);
    }

    public boolean isProcessing() {
        return processing.get();
    }

    /**
     * One poll cycle: spawn instances for due repeatable definitions, then claim and dispatch as many ready jobs as
     * there are free worker slots.
     *
     * @return number of jobs dispatched to workers
     */
    public int pollOnce() {
        if (!processing.get()) {
            return 0;
        }
        fireDueRepeatables();

        int free = slots.availablePermits();
        if (free == 0 || processors.isEmpty()) {
            return 0;
        }

        Set<String> names = Set.copyOf(processors.keySet());
        List<String> ready = QuarkusTransaction.requiringNew()
                .call(() -> DelayedJob.findReadyIds(names, Instant.now(), free));

        int dispatched = 0;
        for (String jobId : ready) {
            if (!slots.tryAcquire()) {
                break;
            }
            if (!claim(jobId)) {
                slots.release();
                continue;
            }
            try {
                workers.execute(() -> {
                    try {
                        executeJob(jobId);
                    } finally {
                        slots.release();
                    }
                });
                dispatched++;
            } catch (RejectedExecutionException e) {
                slots.release();
                LOG.warnf("Worker pool rejected job %s; returning it to the queue", jobId);
                QuarkusTransaction.requiringNew().run(() -> DelayedJob.update(
                        "state = ?1, lockedAt = null, lockedBy = null where id = ?2", JobState.WAITING, jobId));
            }
        }
        return dispatched;
    }

    /**
     * Claims a ready job for this worker.
     *
     * @return true if the job moved to ACTIVE under this worker
     */
    public boolean claim(String jobId) {
        return QuarkusTransaction.requiringNew().call(() -> DelayedJob.claim(jobId, workerId, Instant.now()));
    }

    /**
     * Spawns a job instance for every repeatable definition whose next run has passed, then advances the definition to
     * its next cron tick. A tick is skipped while an earlier instance of the same definition is still in flight.
     *
     * @return number of instances spawned
     */
    public int fireDueRepeatables() {
        ZoneId zone = zone();
        return QuarkusTransaction.requiringNew().call(() -> {
            Instant now = Instant.now();
            int fired = 0;
            for (RepeatableJob definition : RepeatableJob.findDue(now)) {
                Instant fireTime = definition.nextRunAt;
                String instanceId = REPEAT_INSTANCE_PREFIX + definition.repeatKey + ":" + fireTime.toEpochMilli();

                if (DelayedJob.countInFlightByRepeatKey(definition.repeatKey) > 0) {
                    LOG.infof("Skipping tick %s of repeatable job %s: previous run still in flight", fireTime,
                            definition.repeatKey);
                } else if (DelayedJob.findById(instanceId) == null) {
                    DelayedJob.create(instanceId, definition.jobName, definition.payload,
                            definition.instanceOptions(), definition.repeatKey, now);
                    fired++;
                }

                Optional<Instant> next = CronSchedules.nextRun(definition.pattern, now, zone);
                if (next.isEmpty()) {
                    LOG.warnf("Repeatable job %s has no further fire times; removing it", definition.repeatKey);
                    definition.delete();
                    continue;
                }
                definition.lastRunAt = fireTime;
                definition.nextRunAt = next.get();
                definition.updatedAt = now;
            }
            return fired;
        });
    }

    /**
     * Executes a claimed job by dispatching to its registered processor.
     *
     * <p>
     * This method wraps processor execution with:
     * <ul>
     * <li>OpenTelemetry span for distributed tracing</li>
     * <li>MDC enrichment (job id, schedule id, trace id)</li>
     * <li>Progress reset to 0 before and forced to 100 after a successful run</li>
     * <li>Retry scheduling or final failure when the processor throws</li>
     * </ul>
     *
     * @param jobId
     *            id of a job this worker has claimed
     */
    public void executeJob(String jobId) {
        QueuedJob job = QuarkusTransaction.requiringNew().call(() -> {
            DelayedJob entity = DelayedJob.findById(jobId);
            if (entity == null) {
                return null;
            }
            entity.updateProgress(0);
            return entity.toSnapshot();
        });
        if (job == null) {
            LOG.warnf("Job %s disappeared before execution", jobId);
            return;
        }

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", jobId).setAttribute("job.name", job.name())
                .setAttribute("job.attempt", job.attemptsMade()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(jobId);
            LoggingConfig.setScheduleId(job.scheduleId());
            LoggingConfig.setRequestOrigin("job:" + job.name());

            JobProcessor processor = processors.get(job.name());
            if (processor == null) {
                throw new IllegalStateException("No processor registered for job name " + job.name());
            }

            processor.process(job, value -> updateProgress(jobId, value));

            QueuedJob completed = complete(jobId);
            span.addEvent("job.completed");
            LOG.infof("Job %s (%s) completed successfully on attempt %d", jobId, job.name(), job.attemptsMade());
            if (completed != null) {
                listeners.forEach(listener -> notifyCompleted(listener, completed));
            }

        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            span.recordException(e);
            span.addEvent("job.failed");
            handleFailure(job, e);

        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private void updateProgress(String jobId, double value) {
        double clamped = Math.max(0, Math.min(100, value));
        QuarkusTransaction.requiringNew().run(() -> {
            DelayedJob entity = DelayedJob.findById(jobId);
            if (entity != null) {
                entity.updateProgress(clamped);
            }
        });
    }

    private QueuedJob complete(String jobId) {
        return QuarkusTransaction.requiringNew().call(() -> {
            DelayedJob entity = DelayedJob.findById(jobId);
            if (entity == null) {
                return null;
            }
            entity.markCompleted();
            QueuedJob snapshot = entity.toSnapshot();
            if (entity.removeOnComplete) {
                entity.delete();
            }
            return snapshot;
        });
    }

    private void handleFailure(QueuedJob job, Exception error) {
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();

        FailureOutcome outcome = QuarkusTransaction.requiringNew().call(() -> {
            DelayedJob entity = DelayedJob.findById(job.id());
            if (entity == null) {
                return null;
            }
            boolean exhausted = entity.attemptsMade >= entity.maxAttempts;
            if (exhausted) {
                entity.markFailed(reason);
            } else {
                entity.scheduleRetry(
                        calculateBackoffDelay(entity.attemptsMade, Duration.ofSeconds(entity.backoffDelaySeconds)),
                        reason);
            }
            QueuedJob snapshot = entity.toSnapshot();
            if (exhausted && entity.removeOnFail) {
                entity.delete();
            }
            return new FailureOutcome(snapshot, exhausted);
        });

        if (outcome == null) {
            LOG.errorf(error, "Job %s failed and its record is gone", job.id());
            return;
        }
        if (outcome.retriesExhausted()) {
            LOG.errorf(error, "Job %s (%s) failed permanently after %d attempts", job.id(), job.name(),
                    outcome.job().attemptsMade());
        } else {
            LOG.warnf(error, "Job %s (%s) failed on attempt %d/%d; retry scheduled for %s", job.id(), job.name(),
                    outcome.job().attemptsMade(), outcome.job().maxAttempts(), outcome.job().scheduledAt());
        }
        listeners.forEach(listener -> notifyFailed(listener, outcome, error));
    }

    private void notifyCompleted(JobEventListener listener, QueuedJob job) {
        try {
            listener.onCompleted(job);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Job listener %s failed handling completion of %s", listener.getClass().getSimpleName(),
                    job.id());
        }
    }

    private void notifyFailed(JobEventListener listener, FailureOutcome outcome, Throwable error) {
        try {
            listener.onFailed(outcome.job(), error, outcome.retriesExhausted());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Job listener %s failed handling failure of %s", listener.getClass().getSimpleName(),
                    outcome.job().id());
        }
    }

    @Override
    public int purgeFinished(Duration retention) {
        Instant cutoff = Instant.now().minus(retention);
        long purged = QuarkusTransaction.requiringNew().call(() -> DelayedJob.deleteFinishedBefore(cutoff));
        if (purged > 0) {
            LOG.infof("Purged %d finished jobs older than %s", purged, retention);
        }
        return (int) purged;
    }

    /**
     * Calculates the next retry delay using exponential backoff with jitter.
     *
     * <p>
     * <b>Formula:</b> {@code delay = 2^(attempt-1) * baseDelay * (1.0 ± 0.25)}
     *
     * @param attempt
     *            attempt that just failed (1-indexed)
     * @param baseDelay
     *            delay before the first retry
     * @return delay before the next attempt
     */
    public Duration calculateBackoffDelay(int attempt, Duration baseDelay) {
        int exponent = Math.max(0, Math.min(attempt - 1, 20));
        double delayMillis = Math.pow(2, exponent) * baseDelay.toMillis();
        double jitter = 0.75 + (Math.random() * 0.5); // Random multiplier in [0.75, 1.25]
        return Duration.ofMillis((long) (delayMillis * jitter));
    }

    /**
     * Returns the number of free worker slots. Exposed for metrics.
     */
    public int getAvailableSlots() {
        return slots.availablePermits();
    }

    public int getConcurrency() {
        return concurrency;
    }

    public String getWorkerId() {
        return workerId;
    }

    private ZoneId zone() {
        return ZoneId.of(timezone);
    }

    private static String buildWorkerId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "unknown-host";
        }
        return host + ":" + ProcessHandle.current().pid() + ":" + UUID.randomUUID().toString().substring(0, 8);
    }

    private record FailureOutcome(QueuedJob job, boolean retriesExhausted) {
    }
}
