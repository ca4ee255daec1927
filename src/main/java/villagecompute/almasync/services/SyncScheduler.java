/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.services;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import villagecompute.almasync.api.types.ScheduleType;
import villagecompute.almasync.config.InstanceRegistry;
import villagecompute.almasync.data.models.Schedule;
import villagecompute.almasync.data.models.ScheduleUpdate;
import villagecompute.almasync.exceptions.ConfigurationException;
import villagecompute.almasync.exceptions.ResourceNotFoundException;
import villagecompute.almasync.exceptions.RetriesExhaustedException;
import villagecompute.almasync.exceptions.ValidationException;
import villagecompute.almasync.jobs.JobEventListener;
import villagecompute.almasync.jobs.JobOptions;
import villagecompute.almasync.jobs.JobRuntime;
import villagecompute.almasync.jobs.JobState;
import villagecompute.almasync.jobs.JobType;
import villagecompute.almasync.jobs.ProgressReporter;
import villagecompute.almasync.jobs.QueueStats;
import villagecompute.almasync.jobs.QueuedJob;
import villagecompute.almasync.jobs.RepeatableJobInfo;
import villagecompute.almasync.jobs.SyncJobPayload;
import villagecompute.almasync.util.CronSchedules;

/**
 * Reconciles schedule intent in the {@link ScheduleStore} with runtime state in the {@link JobRuntime}.
 *
 * <p>
 * <b>Lifecycle:</b>
 * <ul>
 * <li>{@link #create} stores an inactive schedule; nothing is submitted</li>
 * <li>{@link #start} arms the schedule: a repeatable definition keyed by the schedule id for recurring schedules, a
 * single job keyed by the schedule id otherwise</li>
 * <li>{@link #stop} cancels future firings and queued instances; a job already running finishes</li>
 * <li>{@link #update} re-arms an active schedule whose trigger or sync parameters changed</li>
 * <li>{@link #delete} stops (best effort) and removes the record</li>
 * </ul>
 *
 * <p>
 * <b>Job Execution:</b> the {@code dhis2-alma-sync} processor registered here runs {@link SyncExecutor} and mirrors
 * every transition into the store before broadcasting it, so observers never see state the store does not hold.
 *
 * <p>
 * <b>Startup Recovery:</b> {@link #restoreActiveSchedules()} runs once before the workers start and brings the
 * runtime back in line with the store after a crash or restart.
 *
 * <p>
 * Mutations of one schedule ({@code start}, {@code stop}, {@code update}) are serialized by a per-id lock.
 */
@ApplicationScoped
public class SyncScheduler implements JobEventListener {

    private static final Logger LOG = Logger.getLogger(SyncScheduler.class);

    static final String MSG_CREATED = "Schedule created";
    static final String MSG_READY = "Ready to start";
    static final String MSG_STARTING = "Starting job...";
    static final String MSG_STARTED = "Job started";
    static final String MSG_COMPLETED = "Job completed successfully";
    static final String MSG_STOPPED = "Stopped";
    static final String MSG_INTERRUPTED = "Task interrupted due to server restart";

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Inject
    ScheduleStore store;

    @Inject
    JobRuntime runtime;

    @Inject
    StatusBroadcaster broadcaster;

    @Inject
    SyncExecutor executor;

    @Inject
    InstanceRegistry instanceRegistry;

    @ConfigProperty(
            name = "almasync.worker.concurrency",
            defaultValue = "4")
    int concurrency;

    @ConfigProperty(
            name = "almasync.timezone",
            defaultValue = "Africa/Nairobi")
    String timezone;

    /**
     * Result of {@link #getStatus(String)}.
     *
     * @param schedule
     *            schedule record
     * @param job
     *            job currently representing the schedule, if the runtime holds one
     */
    public record ScheduleStatus(Schedule schedule, Optional<QueuedJob> job) {
    }

    /**
     * Counts of what startup recovery did.
     *
     * @param requeued
     *            jobs left active by a dead worker and put back in the queue
     * @param rearmed
     *            recurring schedules re-registered
     * @param inFlight
     *            running schedules whose job is still in flight
     * @param reconciled
     *            running schedules whose finished job outcome was mirrored
     * @param interrupted
     *            running schedules whose job vanished and were reset to idle
     * @param resubmitted
     *            one-shot schedules submitted again
     * @param orphansRemoved
     *            runtime entries removed by the orphan sweep
     */
    public record RecoveryReport(int requeued, int rearmed, int inFlight, int reconciled, int interrupted,
            int resubmitted, int orphansRemoved) {
    }

    void onStart(@Observes StartupEvent event) {
        initialize();
    }

    /**
     * Registers the sync processor and the failure listener, recovers active schedules, then starts the workers.
     */
    public void initialize() {
        String processorName = JobType.DHIS2_ALMA_SYNC.getProcessorName();
        if (!runtime.hasProcessor(processorName)) {
            runtime.registerProcessor(processorName, this::processJob);
            runtime.addListener(this);
        }

        RecoveryReport report = restoreActiveSchedules();
        LOG.infof("Schedule recovery finished: %s", report);

        runtime.startProcessing(concurrency);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------------------------------------------------

    /**
     * Creates an inactive schedule.
     *
     * @throws ValidationException
     *             if name or type is missing, or the cron expression of a recurring schedule is missing or invalid
     */
    public Schedule create(Schedule draft) {
        validateDefinition(draft.name, draft.trigger, draft.cronExpression, draft.maxRetries, draft.retryDelay);

        draft.active = false;
        draft.status = Schedule.Status.IDLE;
        draft.progress = 0;
        draft.message = MSG_CREATED;
        draft.currentJobId = null;
        draft.nextRun = null;
        draft.retryAttempts = 0;
        if (draft.processor == null || draft.processor.isBlank()) {
            draft.processor = Schedule.DEFAULT_PROCESSOR;
        }

        Schedule created = store.create(draft);
        LOG.infof("Created schedule %s (%s, type %s)", created.id, created.name, created.trigger.getValue());
        broadcaster.scheduleCreated(ScheduleType.fromEntity(created));
        return created;
    }

    /**
     * Merges a partial update. An active schedule whose trigger or sync parameters changed is re-armed; if the merged
     * definition can no longer run, the schedule is deactivated and the configuration error is rethrown.
     *
     * @throws ResourceNotFoundException
     *             if the schedule does not exist
     * @throws ValidationException
     *             if the merged trigger definition is invalid
     */
    public Schedule update(String id, ScheduleUpdate update) {
        return withLock(id, () -> {
            Schedule current = get(id);
            validateDefinition(update.name() != null ? update.name() : current.name,
                    update.trigger() != null ? update.trigger() : current.trigger,
                    update.cronExpression() != null ? update.cronExpression() : current.cronExpression,
                    update.maxRetries() != null ? update.maxRetries() : current.maxRetries,
                    update.retryDelay() != null ? update.retryDelay() : current.retryDelay);

            ScheduleStore.UpdateResult result = store.update(id, update);
            Schedule schedule = result.schedule();

            if (schedule.active && result.jobDefinitionChanged()) {
                LOG.infof("Schedule %s changed while active; re-arming its job", id);
                try {
                    requireStartable(schedule);
                    schedule = setupJob(schedule);
                } catch (ConfigurationException e) {
                    runtime.cancel(id);
                    store.setNextRun(id, null);
                    Schedule deactivated = store.setActivation(id, false, Schedule.Status.IDLE, 0,
                            "Deactivated: " + e.getMessage());
                    broadcaster.scheduleUpdated(ScheduleType.fromEntity(deactivated));
                    throw e;
                }
            }

            broadcaster.scheduleUpdated(ScheduleType.fromEntity(schedule));
            return schedule;
        });
    }

    /**
     * Activates a schedule and submits its job.
     *
     * @throws ResourceNotFoundException
     *             if the schedule does not exist
     * @throws ConfigurationException
     *             if the processor is not registered or the sync binding is incomplete
     */
    public Schedule start(String id) {
        return withLock(id, () -> {
            Schedule schedule = get(id);
            requireStartable(schedule);

            store.setActivation(id, true, Schedule.Status.IDLE, 0, MSG_READY);
            broadcaster.progress(id, 0, MSG_STARTING);

            Schedule armed = setupJob(get(id));
            LOG.infof("Started schedule %s (job %s, next run %s)", id, armed.currentJobId, armed.nextRun);
            broadcaster.scheduleStarted(ScheduleType.fromEntity(armed));
            return armed;
        });
    }

    /**
     * Deactivates a schedule. A job that is already running is left to finish.
     *
     * @throws ResourceNotFoundException
     *             if the schedule does not exist
     */
    public Schedule stop(String id) {
        return withLock(id, () -> {
            Schedule schedule = get(id);
            runtime.cancel(id);
            store.setNextRun(id, null);
            Schedule stopped = store.setActivation(id, false, Schedule.Status.IDLE, schedule.progress, MSG_STOPPED);
            LOG.infof("Stopped schedule %s", id);
            broadcaster.scheduleStopped(ScheduleType.fromEntity(stopped));
            return stopped;
        });
    }

    /**
     * Stops (best effort) and deletes a schedule.
     *
     * @throws ResourceNotFoundException
     *             if the schedule does not exist
     */
    public void delete(String id) {
        withLock(id, () -> {
            get(id);
            try {
                stop(id);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Stopping schedule %s before deletion failed; deleting anyway", id);
            }
            store.delete(id);
            return null;
        });
        LOG.infof("Deleted schedule %s", id);
        broadcaster.scheduleDeleted(id);
    }

    /**
     * Submits the runtime job for a schedule, replacing any previous one, and records the job id (and next run for
     * recurring schedules).
     *
     * @return the schedule as stored after submission
     */
    Schedule setupJob(Schedule schedule) {
        String id = schedule.id;
        runtime.cancel(id);

        Map<String, Object> payload = SyncJobPayload.fromSchedule(schedule).toMap();
        Duration backoff = Duration.ofSeconds(Math.max(0, schedule.retryDelay));

        if (schedule.isRecurring()) {
            JobOptions options = JobOptions.repeating(schedule.maxRetries, backoff,
                    new JobOptions.Repeat(schedule.cronExpression, schedule.runImmediately, id));
            String key = runtime.submit(id, schedule.processor, payload, options);
            store.setCurrentJobId(id, key);
            Instant nextRun = runtime.getRepeatableJob(key).map(RepeatableJobInfo::nextRunAt)
                    .orElseGet(() -> computeNextRun(schedule));
            return store.setNextRun(id, nextRun);
        }

        String jobId = runtime.submit(id, schedule.processor, payload, JobOptions.oneShot(schedule.maxRetries, backoff));
        store.setCurrentJobId(id, jobId);
        return store.setNextRun(id, null);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------------------------------------------------

    /**
     * @throws ResourceNotFoundException
     *             if the schedule does not exist
     */
    public Schedule get(String id) {
        return store.find(id).orElseThrow(() -> ResourceNotFoundException.schedule(id));
    }

    public List<Schedule> list() {
        return store.listAll();
    }

    public List<Schedule> listByStatus(Schedule.Status status) {
        return store.listByStatus(status);
    }

    /**
     * Returns the schedule and the job currently representing it: the job recorded in {@code currentJobId}, else the
     * newest job keyed by the schedule id.
     *
     * @throws ResourceNotFoundException
     *             if the schedule does not exist
     */
    public ScheduleStatus getStatus(String id) {
        Schedule schedule = get(id);
        Optional<QueuedJob> job = runtime.getJob(schedule.currentJobId);
        if (job.isEmpty()) {
            job = runtime.findJobByScheduleId(id);
        }
        return new ScheduleStatus(schedule, job);
    }

    public QueueStats queueStats() {
        return runtime.getStats();
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Job execution
    // ---------------------------------------------------------------------------------------------------------------

    /**
     * Processor of {@code dhis2-alma-sync} jobs.
     *
     * <p>
     * Marks the schedule running, runs the sync pass while folding progress into the store and the broadcaster, then
     * records the outcome. Failures are recorded and broadcast before they are rethrown to the runtime, which decides
     * about retries.
     */
    void processJob(QueuedJob job, ProgressReporter jobProgress) throws Exception {
        String scheduleId = job.scheduleId();
        if (store.find(scheduleId).isEmpty()) {
            LOG.warnf("Job %s belongs to unknown schedule %s; nothing to do", job.id(), scheduleId);
            return;
        }

        updateQuietly(scheduleId, () -> {
            store.setCurrentJobId(scheduleId, job.id());
            store.setRetryAttempts(scheduleId, job.attemptsMade());
            store.updateProgress(scheduleId, 0);
            return store.updateStatus(scheduleId, Schedule.Status.RUNNING, MSG_STARTED);
        }).ifPresent(running -> broadcaster.scheduleUpdated(ScheduleType.fromEntity(running)));

        ScheduleProgress progress = new ScheduleProgress(scheduleId, jobProgress);
        try {
            SyncResult result = executor.execute(SyncJobPayload.fromMap(job.payload()), progress);

            String message = result.hasFailures()
                    ? MSG_COMPLETED + " (" + result.failedUnits() + " of " + result.totalUnits()
                            + " sync units failed)"
                    : MSG_COMPLETED;
            updateQuietly(scheduleId, () -> {
                store.updateProgress(scheduleId, 100);
                store.setRetryAttempts(scheduleId, 0);
                Schedule schedule = store.setCurrentJobId(scheduleId, null);
                if (schedule.isRecurring()) {
                    // A schedule stopped during the run has no definition left and keeps nextRun cleared
                    Instant nextRun = schedule.active
                            ? runtime.getRepeatableJob(scheduleId).map(RepeatableJobInfo::nextRunAt).orElse(null)
                            : null;
                    store.setNextRun(scheduleId, nextRun);
                }
                return store.updateStatus(scheduleId, Schedule.Status.COMPLETED, message);
            }).ifPresent(completed -> {
                broadcaster.progress(scheduleId, 100, message);
                broadcaster.scheduleUpdated(ScheduleType.fromEntity(completed));
            });

        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            updateQuietly(scheduleId, () -> store.updateStatus(scheduleId, Schedule.Status.FAILED, message))
                    .ifPresent(failed -> broadcaster.scheduleUpdated(ScheduleType.fromEntity(failed)));
            throw e;
        }
    }

    @Override
    public void onFailed(QueuedJob job, Throwable error, boolean retriesExhausted) {
        String scheduleId = job.scheduleId();
        if (!retriesExhausted) {
            updateQuietly(scheduleId, () -> store.setRetryAttempts(scheduleId, job.attemptsMade()));
            return;
        }

        String message = new RetriesExhaustedException(job.id(), job.attemptsMade(), error).getMessage();
        updateQuietly(scheduleId, () -> {
            store.setRetryAttempts(scheduleId, job.attemptsMade());
            return store.updateStatus(scheduleId, Schedule.Status.FAILED, message);
        }).ifPresent(failed -> broadcaster.scheduleUpdated(ScheduleType.fromEntity(failed)));
    }

    /**
     * Progress callback of one job run: clamps to [0, 100], never moves backwards, persists and broadcasts.
     */
    final class ScheduleProgress implements ProgressReporter {

        private final String scheduleId;
        private final ProgressReporter jobProgress;
        private double last;

        ScheduleProgress(String scheduleId, ProgressReporter jobProgress) {
            this.scheduleId = scheduleId;
            this.jobProgress = jobProgress;
        }

        @Override
        public synchronized void report(double value) {
            double clamped = Double.isNaN(value) ? last : Math.max(0, Math.min(100, value));
            if (clamped < last) {
                clamped = last;
            }
            last = clamped;

            jobProgress.report(clamped);
            String message = String.format(Locale.ROOT, "Processing... %.1f%%", clamped);
            double reported = clamped;
            updateQuietly(scheduleId, () -> {
                store.updateProgress(scheduleId, reported);
                return store.updateStatus(scheduleId, Schedule.Status.RUNNING, message);
            }).ifPresent(schedule -> broadcaster.progress(scheduleId, reported, message));
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Recovery
    // ---------------------------------------------------------------------------------------------------------------

    /**
     * Brings the runtime back in line with the store.
     *
     * <ol>
     * <li>Jobs left active by a dead worker go back to the queue, so the sweep below can remove those of stopped
     * schedules</li>
     * <li>Recurring active schedules are re-registered (idempotent)</li>
     * <li>Running one-shot schedules are matched with their job: in flight is left alone, completed or failed is
     * mirrored, a vanished job resets the schedule to idle and resubmits it when its type is immediate</li>
     * <li>Other active one-shot schedules sitting idle are resubmitted</li>
     * <li>Inactive schedules still marked running are mirrored from their finished job or reset to idle</li>
     * <li>Runtime entries without an active schedule are removed</li>
     * </ol>
     */
    public RecoveryReport restoreActiveSchedules() {
        int requeued = runtime.requeueStalled();
        int rearmed = 0;
        int inFlight = 0;
        int reconciled = 0;
        int interrupted = 0;
        int resubmitted = 0;

        for (Schedule schedule : store.listByActive(true)) {
            String id = schedule.id;
            try {
                if (schedule.isRecurring()) {
                    setupJob(schedule);
                    rearmed++;
                    continue;
                }
                if (schedule.trigger == Schedule.Trigger.RECURRING) {
                    LOG.warnf("Active recurring schedule %s has no cron expression; deactivating it", id);
                    store.setActivation(id, false, Schedule.Status.IDLE, 0,
                            "Deactivated: recurring schedule has no cron expression");
                    continue;
                }

                if (schedule.status == Schedule.Status.RUNNING) {
                    Optional<QueuedJob> job = findCurrentJob(schedule);
                    JobState state = job.map(QueuedJob::state).orElse(null);

                    if (state != null && state.isInFlight()) {
                        LOG.infof("Schedule %s: job %s still %s; leaving it", id, job.get().id(), state.getValue());
                        inFlight++;
                    } else if (job.isPresent() && mirrorFinishedJob(id, job.get())) {
                        reconciled++;
                    } else {
                        LOG.warnf("Schedule %s was running but its job is gone; resetting", id);
                        store.setActivation(id, true, Schedule.Status.IDLE, 0, MSG_INTERRUPTED);
                        interrupted++;
                        if (schedule.trigger == Schedule.Trigger.IMMEDIATE) {
                            setupJob(get(id));
                            resubmitted++;
                        }
                    }
                    continue;
                }

                if (schedule.status == Schedule.Status.IDLE) {
                    setupJob(schedule);
                    resubmitted++;
                }
            } catch (RuntimeException e) {
                LOG.errorf(e, "Could not recover schedule %s", id);
            }
        }

        // Stopped schedules whose run was cut short; a requeued job of theirs is removed by the sweep
        for (Schedule schedule : store.listByStatus(Schedule.Status.RUNNING)) {
            if (schedule.active) {
                continue;
            }
            String id = schedule.id;
            try {
                Optional<QueuedJob> job = findCurrentJob(schedule);
                if (job.isPresent() && job.get().state() == JobState.ACTIVE) {
                    LOG.infof("Stopped schedule %s: job %s still active; leaving it", id, job.get().id());
                    inFlight++;
                } else if (job.isPresent() && mirrorFinishedJob(id, job.get())) {
                    reconciled++;
                } else {
                    LOG.warnf("Stopped schedule %s was still marked running; resetting", id);
                    store.updateStatus(id, Schedule.Status.IDLE, MSG_INTERRUPTED);
                    interrupted++;
                }
            } catch (RuntimeException e) {
                LOG.errorf(e, "Could not recover schedule %s", id);
            }
        }

        int orphans = sweepOrphans();
        return new RecoveryReport(requeued, rearmed, inFlight, reconciled, interrupted, resubmitted, orphans);
    }

    private Optional<QueuedJob> findCurrentJob(Schedule schedule) {
        Optional<QueuedJob> job = runtime.getJob(schedule.currentJobId);
        return job.isPresent() ? job : runtime.findJobByScheduleId(schedule.id);
    }

    /**
     * Copies the outcome of a COMPLETED or FAILED job onto its schedule.
     *
     * @return false if the job has not finished
     */
    private boolean mirrorFinishedJob(String id, QueuedJob job) {
        if (job.state() == JobState.COMPLETED) {
            store.updateProgress(id, 100);
            store.updateStatus(id, Schedule.Status.COMPLETED, MSG_COMPLETED);
        } else if (job.state() == JobState.FAILED) {
            store.updateStatus(id, Schedule.Status.FAILED,
                    job.failedReason() != null ? job.failedReason() : "Job failed");
        } else {
            return false;
        }
        LOG.infof("Schedule %s: job %s %s before restart; status reconciled", id, job.id(), job.state().getValue());
        return true;
    }

    /**
     * Removes runtime entries whose schedule is missing or inactive. Running jobs are skipped.
     *
     * @return number of repeatable definitions and jobs removed
     */
    public int sweepOrphans() {
        Set<String> activeIds = store.listByActive(true).stream().map(schedule -> schedule.id)
                .collect(Collectors.toSet());
        int removed = 0;

        for (RepeatableJobInfo definition : runtime.getRepeatableJobs()) {
            if (!activeIds.contains(definition.key()) && runtime.cancel(definition.key())) {
                LOG.infof("Removed orphaned repeatable job %s", definition.key());
                removed++;
            }
        }

        for (QueuedJob job : runtime.getJobs(Set.of())) {
            if (job.state() == JobState.ACTIVE || activeIds.contains(job.scheduleId())) {
                continue;
            }
            if (runtime.cancel(job.id())) {
                LOG.infof("Removed orphaned job %s (schedule %s, %s)", job.id(), job.scheduleId(),
                        job.state().getValue());
                removed++;
            }
        }
        return removed;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------------------------------------------------

    private void validateDefinition(String name, Schedule.Trigger trigger, String cronExpression, int maxRetries,
            int retryDelay) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Schedule name is required");
        }
        if (trigger == null) {
            throw new ValidationException("Schedule type is required");
        }
        if (trigger == Schedule.Trigger.RECURRING && (cronExpression == null || cronExpression.isBlank())) {
            throw new ValidationException("Cron expression is required for recurring schedules");
        }
        if (cronExpression != null && !cronExpression.isBlank() && !CronSchedules.isValid(cronExpression)) {
            throw new ValidationException("Invalid cron expression: " + cronExpression);
        }
        if (maxRetries < 1) {
            throw new ValidationException("maxRetries must be at least 1");
        }
        if (retryDelay < 0) {
            throw new ValidationException("retryDelay must not be negative");
        }
    }

    private void requireStartable(Schedule schedule) {
        if (!runtime.hasProcessor(schedule.processor)) {
            throw new ConfigurationException("No processor registered for " + schedule.processor);
        }
        if (schedule.trigger == Schedule.Trigger.RECURRING && !schedule.isRecurring()) {
            throw new ConfigurationException("Recurring schedule " + schedule.id + " has no cron expression");
        }
        SyncJobPayload payload = SyncJobPayload.fromSchedule(schedule).requireComplete();
        instanceRegistry.requireDhis2(payload.dhis2Instance());
        instanceRegistry.requireAlma(payload.almaInstance());
    }

    private Instant computeNextRun(Schedule schedule) {
        return CronSchedules.nextRun(schedule.cronExpression, Instant.now(), ZoneId.of(timezone)).orElse(null);
    }

    /**
     * Lock serializing lifecycle calls of one schedule id. Locks are kept after deletion so a caller still waiting on
     * one is serialized with later callers.
     */
    ReentrantLock lockFor(String id) {
        return locks.computeIfAbsent(id, key -> new ReentrantLock());
    }

    private <T> T withLock(String id, Supplier<T> action) {
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a store update on behalf of a job. A schedule deleted while its job was running is not an error for the
     * job.
     */
    private <T> Optional<T> updateQuietly(String scheduleId, Supplier<T> update) {
        try {
            return Optional.ofNullable(update.get());
        } catch (ResourceNotFoundException e) {
            LOG.debugf("Schedule %s no longer exists; skipping status update", scheduleId);
            return Optional.empty();
        }
    }
}
