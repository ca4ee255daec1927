/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.almasync.data.models.DelayedJob;
import villagecompute.almasync.data.models.Schedule;
import villagecompute.almasync.jobs.JobState;
import villagecompute.almasync.services.DelayedJobService;

import java.util.List;

/**
 * Registers the custom gauges of the sync service.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Gauges:</b> {@code almasync_jobs_depth{state}} - Jobs per queue state</li>
 * <li><b>Gauges:</b> {@code almasync_worker_slots_available} - Free worker permits of this process</li>
 * <li><b>Gauges:</b> {@code almasync_schedules_active} - Armed schedules</li>
 * <li><b>Counters:</b> {@code almasync.sync.units.total{result}} - Sync unit outcomes (registered by
 * {@code SyncExecutor})</li>
 * <li><b>Timers:</b> {@code almasync.sync.pass.duration} - Sync pass duration (registered by
 * {@code SyncExecutor})</li>
 * </ul>
 *
 * <p>
 * Metrics are exported in Prometheus format at {@code /q/metrics}; HTTP server metrics come from Quarkus.
 *
 * @see LoggingConfig for structured logging field definitions
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    DelayedJobService delayedJobService;

    /**
     * Registers all gauges once the application scope is up.
     */
    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        LOG.info("Registering observability metrics");

        for (JobState state : JobState.values()) {
            Gauge.builder("almasync_jobs_depth", this, m -> getJobDepth(state))
                    .description("Number of jobs in state " + state.getValue())
                    .tags(List.of(Tag.of("state", state.getValue()))).register(registry);
        }

        Gauge.builder("almasync_worker_slots_available", delayedJobService, DelayedJobService::getAvailableSlots)
                .description("Free worker permits of this process").register(registry);

        Gauge.builder("almasync_schedules_active", this, m -> getActiveScheduleCount())
                .description("Number of active schedules").register(registry);

        LOG.infof("Observability metrics registration complete. Access metrics at /q/metrics");
    }

    private double getJobDepth(JobState state) {
        try {
            return DelayedJob.countByState(state);
        } catch (Exception e) {
            LOG.warnf(e, "Failed to count %s jobs, returning 0", state.getValue());
            return 0.0;
        }
    }

    private double getActiveScheduleCount() {
        try {
            return Schedule.count("active", true);
        } catch (Exception e) {
            LOG.warnf(e, "Failed to count active schedules, returning 0");
            return 0.0;
        }
    }
}
