/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.jobs;

import java.util.concurrent.atomic.AtomicBoolean;

import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.almasync.services.DelayedJobService;

/**
 * Poll loop feeding the worker pool of {@link DelayedJobService}.
 *
 * <p>
 * Each tick spawns instances for due repeatable definitions and claims as many ready jobs as there are free worker
 * slots. Ticks never overlap: the scheduler skips a tick while the previous one is still running.
 */
@ApplicationScoped
public class JobQueueScheduler {

    private static final Logger LOG = Logger.getLogger(JobQueueScheduler.class);

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Inject
    DelayedJobService jobService;

    @Scheduled(
            every = "{almasync.worker.poll-interval}",
            identity = "job-queue-poll",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void poll() {
        if (!jobService.isProcessing() || !running.compareAndSet(false, true)) {
            return;
        }
        try {
            int dispatched = jobService.pollOnce();
            if (dispatched > 0) {
                LOG.debugf("Dispatched %d jobs (%d slots free)", dispatched, jobService.getAvailableSlots());
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Job queue poll failed");
        } finally {
            running.set(false);
        }
    }
}
