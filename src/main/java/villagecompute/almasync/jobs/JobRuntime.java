/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.jobs;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable job queue with one-shot, delayed and cron-repeated submissions.
 *
 * <p>
 * <b>Guarantees:</b>
 * <ul>
 * <li>At-least-once execution: a job left ACTIVE by a dead process is re-queued when processing starts</li>
 * <li>Bounded retries with exponential backoff; a job that exhausts its attempts moves to FAILED and stays there</li>
 * <li>Create-or-replace submission keyed by job id, so submitting twice never yields two live entries</li>
 * <li>ACTIVE jobs are never removed: cancellation only prevents future firings and deletes queued instances</li>
 * </ul>
 *
 * @see villagecompute.almasync.services.DelayedJobService for the database-backed implementation
 */
public interface JobRuntime {

    /**
     * Creates or replaces a job.
     *
     * <p>
     * Any existing entry under {@code jobId} (one-shot instance or repeatable definition) is cancelled first. When
     * {@code options} carries a repeat, a repeatable definition keyed by the repeat key is registered; otherwise a
     * single WAITING instance with id {@code jobId} is created. A one-shot instance that is currently ACTIVE is left
     * running and returned as is.
     *
     * @return id of the registered job (the repeat key for repeatable definitions)
     */
    String submit(String jobId, String jobName, Map<String, Object> payload, JobOptions options);

    /**
     * Removes the repeatable definition keyed by {@code jobId} (or by the instance's repeat key) and every non-ACTIVE
     * instance belonging to it.
     *
     * @return true if anything was found, false for unknown ids
     */
    boolean cancel(String jobId);

    Optional<QueuedJob> getJob(String jobId);

    /**
     * @param states
     *            states to include; empty means all
     * @return matching jobs, newest first
     */
    List<QueuedJob> getJobs(Set<JobState> states);

    /**
     * Finds the job that currently represents a schedule: the one-shot instance with the schedule's id, else the newest
     * instance spawned by its repeatable definition.
     */
    Optional<QueuedJob> findJobByScheduleId(String scheduleId);

    List<RepeatableJobInfo> getRepeatableJobs();

    Optional<RepeatableJobInfo> getRepeatableJob(String key);

    QueueStats getStats();

    /**
     * Registers the processor invoked for jobs submitted under {@code name}.
     *
     * @throws IllegalStateException
     *             if a processor is already registered under that name
     */
    void registerProcessor(String name, JobProcessor processor);

    Collection<String> getProcessorNames();

    boolean hasProcessor(String name);

    void addListener(JobEventListener listener);

    /**
     * Moves jobs left ACTIVE by a worker that no longer exists back to WAITING.
     *
     * @return number of jobs re-queued
     */
    int requeueStalled();

    /**
     * Starts workers with {@code concurrency} parallel slots and re-queues jobs stalled by a previous process.
     */
    void startProcessing(int concurrency);

    /**
     * Stops claiming new jobs. Running jobs finish on their worker threads.
     */
    void stopProcessing();

    /**
     * Deletes COMPLETED and FAILED jobs that finished more than {@code retention} ago.
     *
     * @return number of jobs deleted
     */
    int purgeFinished(Duration retention);
}
