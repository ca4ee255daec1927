/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.jobs;

import java.time.Duration;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.almasync.services.SyncScheduler;

/**
 * Periodic housekeeping of the job queue.
 *
 * <ul>
 * <li>Orphan sweep (every 5 minutes by default): removes runtime entries whose schedule is gone or inactive</li>
 * <li>Retention purge (hourly by default): deletes completed and failed jobs older than
 * {@code almasync.jobs.retention}</li>
 * </ul>
 */
@ApplicationScoped
public class JobMaintenanceScheduler {

    private static final Logger LOG = Logger.getLogger(JobMaintenanceScheduler.class);

    @Inject
    SyncScheduler syncScheduler;

    @Inject
    JobRuntime jobRuntime;

    @ConfigProperty(
            name = "almasync.jobs.retention",
            defaultValue = "PT24H")
    Duration retention;

    @Scheduled(
            every = "{almasync.jobs.orphan-sweep-interval}",
            delayed = "30s",
            identity = "orphan-job-sweep",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweepOrphans() {
        try {
            int removed = syncScheduler.sweepOrphans();
            if (removed > 0) {
                LOG.infof("Orphan sweep removed %d job entries", removed);
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Orphan job sweep failed");
        }
    }

    @Scheduled(
            every = "{almasync.jobs.purge-interval}",
            delayed = "1m",
            identity = "finished-job-purge",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void purgeFinished() {
        try {
            jobRuntime.purgeFinished(retention);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Purge of finished jobs failed");
        }
    }
}
