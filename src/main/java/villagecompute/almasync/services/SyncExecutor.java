/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.services;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.almasync.config.AlmaInstance;
import villagecompute.almasync.config.Dhis2Instance;
import villagecompute.almasync.config.InstanceRegistry;
import villagecompute.almasync.exceptions.ConfigurationException;
import villagecompute.almasync.exceptions.ExternalServiceException;
import villagecompute.almasync.integration.alma.AlmaClient;
import villagecompute.almasync.integration.dhis2.Dhis2Client;
import villagecompute.almasync.integration.dhis2.Dhis2Indicator;
import villagecompute.almasync.jobs.ProgressReporter;
import villagecompute.almasync.jobs.SyncJobPayload;
import villagecompute.almasync.util.PeriodResolver;

/**
 * Runs one DHIS2 to ALMA sync pass.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Resolve source and target instances from the {@link InstanceRegistry}</li>
 * <li>Resolve target periods via {@link PeriodResolver}</li>
 * <li>Fetch the indicator list of the indicator group once</li>
 * <li>For each period x org unit level (1..n) x indicator: download the analytics slice and upload it to the
 * scorecard</li>
 * <li>Report progress after each unit</li>
 * </ol>
 *
 * <p>
 * The ALMA session opened for the first upload is reused for the rest of the pass and renewed when ALMA answers 401 or
 * 403.
 *
 * <p>
 * <b>Unit Failure Policy</b> ({@code almasync.sync.unit-failure-policy}):
 * <ul>
 * <li>{@code CONTINUE} - log the failed unit and move on; the pass succeeds</li>
 * <li>{@code FAIL_AT_END} - process every unit, then fail the pass if any unit failed</li>
 * <li>{@code ABORT} - fail the pass at the first failed unit</li>
 * </ul>
 *
 * <p>
 * <b>Metrics:</b>
 * <ul>
 * <li>{@code almasync.sync.units.total{result}} - Units processed by outcome</li>
 * <li>{@code almasync.sync.pass.duration} - Wall time of a pass</li>
 * </ul>
 */
@ApplicationScoped
public class SyncExecutor {

    private static final Logger LOG = Logger.getLogger(SyncExecutor.class);

    private static final int MAX_RECORDED_FAILURES = 20;

    /**
     * How a failing sync unit affects the whole pass.
     */
    public enum UnitFailurePolicy {
        CONTINUE, FAIL_AT_END, ABORT
    }

    @Inject
    InstanceRegistry instanceRegistry;

    @Inject
    Dhis2Client dhis2Client;

    @Inject
    AlmaClient almaClient;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "almasync.sync.org-unit-levels",
            defaultValue = "6")
    int orgUnitLevels;

    @ConfigProperty(
            name = "almasync.sync.unit-failure-policy",
            defaultValue = "CONTINUE")
    UnitFailurePolicy unitFailurePolicy;

    @ConfigProperty(
            name = "almasync.sync.unit-attempts",
            defaultValue = "1")
    int unitAttempts;

    @ConfigProperty(
            name = "almasync.timezone",
            defaultValue = "Africa/Nairobi")
    String timezone;

    Clock clock = Clock.systemUTC();

    /**
     * Executes a sync pass.
     *
     * @param payload
     *            job payload
     * @param progress
     *            receives the completed share of the grid (0-100) after every unit
     * @return unit counts of the pass
     * @throws ConfigurationException
     *             if the payload references unknown instances or misses a required field
     * @throws ExternalServiceException
     *             if the indicator list cannot be fetched, or when the unit failure policy fails the pass
     */
    public SyncResult execute(SyncJobPayload payload, ProgressReporter progress) {
        payload.requireComplete();
        Dhis2Instance source = instanceRegistry.requireDhis2(payload.dhis2Instance());
        AlmaInstance target = instanceRegistry.requireAlma(payload.almaInstance());

        LocalDate today = LocalDate.now(clock.withZone(ZoneId.of(timezone)));
        List<String> periods = PeriodResolver.resolve(payload.periodType(), payload.runFor(), payload.periods(),
                today);

        Span span = tracer.spanBuilder("sync.execute").setAttribute("schedule.id", String.valueOf(payload.scheduleId()))
                .setAttribute("sync.dhis2_instance", source.name()).setAttribute("sync.alma_instance", target.name())
                .setAttribute("sync.scorecard", payload.scorecard().longValue()).startSpan();
        Timer.Sample timerSample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            List<Dhis2Indicator> indicators = dhis2Client.fetchIndicators(source, payload.indicatorGroup());
            int levels = Math.max(0, orgUnitLevels);
            int total = periods.size() * levels * indicators.size();

            LOG.infof("Sync pass for schedule %s: periods %s, %d levels, %d indicators (%d units, policy %s)",
                    payload.scheduleId(), periods, levels, indicators.size(), total, unitFailurePolicy);

            if (total == 0) {
                progress.report(100);
                return new SyncResult(payload.scheduleId(), periods, 0, 0, 0, List.of());
            }

            UnitContext context = new UnitContext(source, target, payload.scorecard());
            int completed = 0;
            int failed = 0;
            List<String> failures = new ArrayList<>();

            for (String period : periods) {
                for (int level = 1; level <= levels; level++) {
                    for (Dhis2Indicator indicator : indicators) {
                        try {
                            runUnit(context, indicator, period, level);
                            unitCounter("success").increment();
                        } catch (RuntimeException e) {
                            failed++;
                            unitCounter("failure").increment();
                            String unit = indicator.id() + "/" + period + "/LEVEL-" + level;
                            LOG.warnf("Sync unit %s of schedule %s failed: %s", unit, payload.scheduleId(),
                                    e.getMessage());
                            if (failures.size() < MAX_RECORDED_FAILURES) {
                                failures.add(unit + ": " + e.getMessage());
                            }
                            if (unitFailurePolicy == UnitFailurePolicy.ABORT) {
                                throw new ExternalServiceException(
                                        "Sync aborted at unit " + unit + ": " + e.getMessage(), e);
                            }
                        }
                        completed++;
                        progress.report(completed * 100.0 / total);
                    }
                }
            }

            SyncResult result = new SyncResult(payload.scheduleId(), periods, total, total - failed, failed,
                    failures);
            span.setAttribute("sync.units.total", total);
            span.setAttribute("sync.units.failed", failed);

            if (failed > 0 && unitFailurePolicy == UnitFailurePolicy.FAIL_AT_END) {
                throw new ExternalServiceException(failed + " of " + total + " sync units failed; first: "
                        + failures.get(0));
            }

            LOG.infof("Sync pass for schedule %s finished: %d/%d units uploaded", payload.scheduleId(),
                    result.succeededUnits(), total);
            return result;

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            throw e;
        } finally {
            timerSample.stop(Timer.builder("almasync.sync.pass.duration").register(meterRegistry));
            span.end();
        }
    }

    private void runUnit(UnitContext context, Dhis2Indicator indicator, String period, int level) {
        int attempts = Math.max(1, unitAttempts);
        RuntimeException lastError = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                JsonNode analytics = dhis2Client.fetchAnalytics(context.source, indicator.id(), period, level);
                upload(context, analytics);
                return;
            } catch (RuntimeException e) {
                lastError = e;
                if (attempt < attempts) {
                    LOG.debugf("Retrying sync unit %s/%s/LEVEL-%d (attempt %d/%d): %s", indicator.id(), period, level,
                            attempt, attempts, e.getMessage());
                }
            }
        }
        throw lastError;
    }

    private void upload(UnitContext context, JsonNode analytics) {
        if (context.sessionCookie == null) {
            context.sessionCookie = almaClient.login(context.target);
        }
        try {
            almaClient.upload(context.target, context.sessionCookie, context.scorecard, analytics);
        } catch (ExternalServiceException e) {
            if (!AlmaClient.isAuthenticationFailure(e)) {
                throw e;
            }
            LOG.debugf("ALMA session on %s expired; logging in again", context.target.name());
            context.sessionCookie = almaClient.login(context.target);
            almaClient.upload(context.target, context.sessionCookie, context.scorecard, analytics);
        }
    }

    private Counter unitCounter(String result) {
        return Counter.builder("almasync.sync.units.total").tag("result", result).register(meterRegistry);
    }

    /**
     * Per-pass state shared by the units of one pass.
     */
    private static final class UnitContext {
        private final Dhis2Instance source;
        private final AlmaInstance target;
        private final int scorecard;
        private String sessionCookie;

        private UnitContext(Dhis2Instance source, AlmaInstance target, int scorecard) {
            this.source = source;
            this.target = target;
            this.scorecard = scorecard;
        }
    }
}
