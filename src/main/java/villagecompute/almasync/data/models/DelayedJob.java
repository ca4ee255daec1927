/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jboss.logging.Logger;
import villagecompute.almasync.jobs.JobOptions;
import villagecompute.almasync.jobs.JobState;
import villagecompute.almasync.jobs.QueuedJob;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Panache entity backing one job instance in the database-backed queue.
 *
 * <p>
 * Workers poll this table for ready rows and claim them with a conditional update, so two workers can never run the
 * same instance. One-shot jobs use the schedule id as primary key; instances spawned from a {@link RepeatableJob} use
 * {@code repeat:<key>:<fireTimeMillis>} and carry the repeat key.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (TEXT, PK) - Job identifier</li>
 * <li>{@code job_name} (TEXT) - Processor name</li>
 * <li>{@code payload} (JSON) - Job parameters</li>
 * <li>{@code state} (TEXT) - WAITING, ACTIVE, DELAYED, COMPLETED, FAILED, PAUSED</li>
 * <li>{@code progress} (DOUBLE) - 0-100</li>
 * <li>{@code attempts_made} / {@code max_attempts} (INT) - Retry bookkeeping</li>
 * <li>{@code backoff_delay_seconds} (BIGINT) - Base delay of the exponential backoff</li>
 * <li>{@code repeat_key} (TEXT) - Owning repeatable definition, null for one-shot jobs</li>
 * <li>{@code scheduled_at} (TIMESTAMPTZ) - Earliest execution time (used for backoff)</li>
 * <li>{@code locked_at} / {@code locked_by} (TIMESTAMPTZ / TEXT) - Claim bookkeeping (worker = hostname:pid)</li>
 * <li>{@code processed_on} / {@code finished_on} (TIMESTAMPTZ) - Attempt start and final outcome times</li>
 * <li>{@code failed_reason} (TEXT) - Error message from the last failed attempt</li>
 * </ul>
 *
 * @see villagecompute.almasync.services.DelayedJobService for job orchestration
 */
@Entity
@Table(
        name = "delayed_jobs")
public class DelayedJob extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(DelayedJob.class);

    /**
     * States a worker may claim from, once {@code scheduled_at} has passed.
     */
    public static final Set<JobState> READY_STATES = EnumSet.of(JobState.WAITING, JobState.DELAYED);

    private static final int MAX_REASON_LENGTH = 2000;

    @Id
    @Column(
            name = "id",
            nullable = false)
    public String id;

    @Column(
            name = "job_name",
            nullable = false)
    public String jobName;

    @Column(
            name = "payload")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> payload = new LinkedHashMap<>();

    @Column(
            name = "state",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobState state;

    @Column(
            name = "progress",
            nullable = false)
    public double progress;

    @Column(
            name = "attempts_made",
            nullable = false)
    public int attemptsMade;

    @Column(
            name = "max_attempts",
            nullable = false)
    public int maxAttempts;

    @Column(
            name = "backoff_delay_seconds",
            nullable = false)
    public long backoffDelaySeconds;

    @Column(
            name = "repeat_key")
    public String repeatKey;

    @Column(
            name = "remove_on_complete",
            nullable = false)
    public boolean removeOnComplete;

    @Column(
            name = "remove_on_fail",
            nullable = false)
    public boolean removeOnFail;

    @Column(
            name = "scheduled_at",
            nullable = false)
    public Instant scheduledAt;

    @Column(
            name = "locked_at")
    public Instant lockedAt;

    @Column(
            name = "locked_by")
    public String lockedBy;

    @Column(
            name = "processed_on")
    public Instant processedOn;

    @Column(
            name = "finished_on")
    public Instant finishedOn;

    @Column(
            name = "failed_reason",
            length = MAX_REASON_LENGTH)
    public String failedReason;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Creates and persists a WAITING job instance.
     *
     * @param id
     *            job id
     * @param jobName
     *            processor name
     * @param payload
     *            job parameters
     * @param options
     *            attempts, backoff and removal policy
     * @param repeatKey
     *            owning repeatable definition, or null
     * @param scheduledAt
     *            earliest execution time
     * @return persisted job
     */
    public static DelayedJob create(String id, String jobName, Map<String, Object> payload, JobOptions options,
            String repeatKey, Instant scheduledAt) {
        Instant now = Instant.now();
        DelayedJob job = new DelayedJob();
        job.id = id;
        job.jobName = jobName;
        job.payload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
        job.state = JobState.WAITING;
        job.progress = 0;
        job.attemptsMade = 0;
        job.maxAttempts = options.attempts();
        job.backoffDelaySeconds = options.backoffDelay().toSeconds();
        job.repeatKey = repeatKey;
        job.removeOnComplete = options.removeOnComplete();
        job.removeOnFail = options.removeOnFail();
        job.scheduledAt = scheduledAt;
        job.createdAt = now;
        job.updatedAt = now;

        job.persist();
        LOG.infof("Created job %s (name: %s, repeatKey: %s, scheduled: %s)", id, jobName, repeatKey, scheduledAt);
        return job;
    }

    /**
     * Finds ready job ids for the given processors, oldest schedule first.
     *
     * @param jobNames
     *            processor names with a registered processor
     * @param now
     *            reference time
     * @param limit
     *            max ids to return
     * @return ids of WAITING or DELAYED jobs whose scheduled time has passed
     */
    public static List<String> findReadyIds(Collection<String> jobNames, Instant now, int limit) {
        if (jobNames == null || jobNames.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<DelayedJob> ready = find("state in ?1 and scheduledAt <= ?2 and jobName in ?3",
                Sort.ascending("scheduledAt"), READY_STATES, now, jobNames).page(0, limit).list();
        return ready.stream().map(job -> job.id).toList();
    }

    /**
     * Atomically claims a ready job for a worker.
     *
     * @return true if this worker won the claim
     */
    public static boolean claim(String id, String workerId, Instant now) {
        int updated = update(
                "state = ?1, lockedAt = ?2, lockedBy = ?3, processedOn = ?2, attemptsMade = attemptsMade + 1, "
                        + "updatedAt = ?2 where id = ?4 and state in ?5 and scheduledAt <= ?2",
                JobState.ACTIVE, now, workerId, id, READY_STATES);
        return updated == 1;
    }

    /**
     * Re-queues jobs left ACTIVE by a worker that no longer exists.
     *
     * @param currentWorkerId
     *            identifier of the live worker, whose claims are kept
     * @return number of jobs moved back to WAITING
     */
    public static int requeueStalled(String currentWorkerId) {
        return update(
                "state = ?1, lockedAt = null, lockedBy = null, updatedAt = ?2 "
                        + "where state = ?3 and (lockedBy is null or lockedBy <> ?4)",
                JobState.WAITING, Instant.now(), JobState.ACTIVE, currentWorkerId);
    }

    public static List<DelayedJob> findByStates(Set<JobState> states) {
        if (states == null || states.isEmpty()) {
            return listAll(Sort.descending("createdAt"));
        }
        return list("state in ?1", Sort.descending("createdAt"), states);
    }

    public static Optional<DelayedJob> findLatestByRepeatKey(String repeatKey) {
        return find("repeatKey", Sort.descending("createdAt"), repeatKey).firstResultOptional();
    }

    public static long countInFlightByRepeatKey(String repeatKey) {
        return count("repeatKey = ?1 and state in ?2", repeatKey, JobState.IN_FLIGHT);
    }

    /**
     * Deletes every non-ACTIVE instance spawned by a repeatable definition.
     */
    public static long deleteQueuedByRepeatKey(String repeatKey) {
        return delete("repeatKey = ?1 and state <> ?2", repeatKey, JobState.ACTIVE);
    }

    public static long countByState(JobState state) {
        return count("state", state);
    }

    /**
     * Deletes COMPLETED and FAILED jobs whose final outcome is older than the cutoff.
     */
    public static long deleteFinishedBefore(Instant cutoff) {
        return delete("state in ?1 and finishedOn < ?2", JobState.FINISHED, cutoff);
    }

    public void updateProgress(double value) {
        this.progress = value;
        this.updatedAt = Instant.now();
    }

    /**
     * Marks this job as completed with progress forced to 100.
     */
    public void markCompleted() {
        Instant now = Instant.now();
        this.state = JobState.COMPLETED;
        this.progress = 100;
        this.finishedOn = now;
        this.lockedAt = null;
        this.lockedBy = null;
        this.updatedAt = now;
        LOG.infof("Job %s marked COMPLETED (attempt %d/%d)", this.id, this.attemptsMade, this.maxAttempts);
    }

    /**
     * Marks this job as finally failed and records the error message.
     *
     * @param reason
     *            the error description
     */
    public void markFailed(String reason) {
        Instant now = Instant.now();
        this.state = JobState.FAILED;
        this.failedReason = truncate(reason);
        this.finishedOn = now;
        this.lockedAt = null;
        this.lockedBy = null;
        this.updatedAt = now;
        LOG.errorf("Job %s marked FAILED after %d attempts: %s", this.id, this.attemptsMade, reason);
    }

    /**
     * Moves the job to DELAYED so it becomes claimable again once the backoff elapses.
     *
     * @param backoff
     *            delay before the next attempt
     * @param reason
     *            error message of the failed attempt
     */
    public void scheduleRetry(Duration backoff, String reason) {
        Instant now = Instant.now();
        this.state = JobState.DELAYED;
        this.failedReason = truncate(reason);
        this.scheduledAt = now.plus(backoff);
        this.lockedAt = null;
        this.lockedBy = null;
        this.updatedAt = now;
        LOG.infof("Job %s scheduled for retry in %d seconds (attempt %d/%d)", this.id, backoff.toSeconds(),
                this.attemptsMade, this.maxAttempts);
    }

    public QueuedJob toSnapshot() {
        return new QueuedJob(id, jobName, payload != null ? Map.copyOf(withoutNulls(payload)) : Map.of(), state,
                progress, attemptsMade, maxAttempts, repeatKey, scheduledAt, processedOn, finishedOn, failedReason,
                createdAt);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH);
    }
}
