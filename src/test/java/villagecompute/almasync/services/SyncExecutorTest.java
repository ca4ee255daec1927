/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.almasync.config.AlmaInstance;
import villagecompute.almasync.config.Dhis2Instance;
import villagecompute.almasync.config.InstanceRegistry;
import villagecompute.almasync.data.models.PeriodType;
import villagecompute.almasync.data.models.RunFor;
import villagecompute.almasync.exceptions.ConfigurationException;
import villagecompute.almasync.exceptions.ExternalServiceException;
import villagecompute.almasync.integration.alma.AlmaClient;
import villagecompute.almasync.integration.dhis2.Dhis2Client;
import villagecompute.almasync.integration.dhis2.Dhis2Indicator;
import villagecompute.almasync.jobs.SyncJobPayload;

/**
 * Unit tests for {@link SyncExecutor}.
 */
class SyncExecutorTest {

    private static final Dhis2Instance DHIS2 = new Dhis2Instance("A", "http://dhis2.test/api", "admin", "district");
    private static final AlmaInstance ALMA = new AlmaInstance("B", "http://alma.test/api", "user", "pass",
            "https://backend.test");

    @Mock
    Dhis2Client dhis2Client;

    @Mock
    AlmaClient almaClient;

    @Mock
    Tracer tracer;

    @InjectMocks
    SyncExecutor executor;

    private MeterRegistry meterRegistry;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<Double> progress = new ArrayList<>();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        meterRegistry = new SimpleMeterRegistry();
        executor.meterRegistry = meterRegistry;
        executor.instanceRegistry = InstanceRegistry.of(Map.of("A", DHIS2), Map.of("B", ALMA));
        executor.orgUnitLevels = 2;
        executor.unitFailurePolicy = SyncExecutor.UnitFailurePolicy.CONTINUE;
        executor.unitAttempts = 1;
        executor.timezone = "UTC";
        executor.clock = Clock.fixed(Instant.parse("2024-03-15T08:00:00Z"), ZoneOffset.UTC);

        when(tracer.spanBuilder(anyString())).thenReturn(TracerProvider.noop().get("test").spanBuilder("test"));
        when(dhis2Client.fetchIndicators(DHIS2, "grp"))
                .thenReturn(List.of(new Dhis2Indicator("ind1", "Coverage"), new Dhis2Indicator("ind2", "Stockouts")));
        when(dhis2Client.fetchAnalytics(eq(DHIS2), anyString(), anyString(), anyInt()))
                .thenReturn(objectMapper.createObjectNode().put("value", "1"));
        when(almaClient.login(ALMA)).thenReturn("session=abc");
    }

    @Test
    void testExecute_processesEveryUnitAndReportsProgress() {
        SyncResult result = executor.execute(payload(), progress::add);

        assertEquals(List.of("202402"), result.periods());
        assertEquals(4, result.totalUnits());
        assertEquals(4, result.succeededUnits());
        assertEquals(0, result.failedUnits());
        assertEquals(List.of(25.0, 50.0, 75.0, 100.0), progress);

        verify(dhis2Client).fetchAnalytics(DHIS2, "ind1", "202402", 1);
        verify(dhis2Client).fetchAnalytics(DHIS2, "ind2", "202402", 2);
        verify(almaClient, times(4)).upload(eq(ALMA), eq("session=abc"), eq(42), any(JsonNode.class));
        verify(almaClient, times(1)).login(ALMA);
        assertEquals(4.0, meterRegistry.get("almasync.sync.units.total").tag("result", "success").counter().count());
    }

    @Test
    void testExecute_explicitPeriodsMultiplyTheGrid() {
        SyncJobPayload payload = new SyncJobPayload("s1", "dhis2-alma-sync", "A", "B", 42, "grp", PeriodType.MONTH,
                RunFor.CURRENT, List.of("202401", "202402", "202403"), Map.of());

        SyncResult result = executor.execute(payload, progress::add);

        assertEquals(12, result.totalUnits());
        assertEquals(100.0, progress.get(progress.size() - 1));
    }

    @Test
    void testExecute_continuePolicyRecordsFailedUnit() {
        when(dhis2Client.fetchAnalytics(DHIS2, "ind1", "202402", 2))
                .thenThrow(new ExternalServiceException("DHIS2 returned 500", 500));

        SyncResult result = executor.execute(payload(), progress::add);

        assertEquals(3, result.succeededUnits());
        assertEquals(1, result.failedUnits());
        assertTrue(result.failures().get(0).startsWith("ind1/202402/LEVEL-2"));
        assertEquals(100.0, progress.get(progress.size() - 1));
        assertEquals(1.0, meterRegistry.get("almasync.sync.units.total").tag("result", "failure").counter().count());
    }

    @Test
    void testExecute_failAtEndPolicyFailsAfterAllUnits() {
        executor.unitFailurePolicy = SyncExecutor.UnitFailurePolicy.FAIL_AT_END;
        when(dhis2Client.fetchAnalytics(DHIS2, "ind1", "202402", 1))
                .thenThrow(new ExternalServiceException("DHIS2 returned 500", 500));

        ExternalServiceException e = assertThrows(ExternalServiceException.class,
                () -> executor.execute(payload(), progress::add));

        assertTrue(e.getMessage().startsWith("1 of 4 sync units failed"));
        verify(almaClient, times(3)).upload(eq(ALMA), anyString(), eq(42), any(JsonNode.class));
    }

    @Test
    void testExecute_abortPolicyStopsAtFirstFailure() {
        executor.unitFailurePolicy = SyncExecutor.UnitFailurePolicy.ABORT;
        when(dhis2Client.fetchAnalytics(DHIS2, "ind1", "202402", 1))
                .thenThrow(new ExternalServiceException("DHIS2 returned 500", 500));

        assertThrows(ExternalServiceException.class, () -> executor.execute(payload(), progress::add));

        verify(dhis2Client, times(1)).fetchAnalytics(eq(DHIS2), anyString(), anyString(), anyInt());
        verify(almaClient, never()).upload(any(), anyString(), anyInt(), any());
        assertTrue(progress.isEmpty());
    }

    @Test
    void testExecute_retriesUnitWhenConfigured() {
        executor.unitAttempts = 2;
        when(dhis2Client.fetchAnalytics(DHIS2, "ind1", "202402", 1))
                .thenThrow(new ExternalServiceException("timeout"))
                .thenReturn(objectMapper.createObjectNode());

        SyncResult result = executor.execute(payload(), progress::add);

        assertEquals(0, result.failedUnits());
        verify(dhis2Client, times(2)).fetchAnalytics(DHIS2, "ind1", "202402", 1);
    }

    @Test
    void testExecute_renewsExpiredAlmaSession() {
        when(almaClient.login(ALMA)).thenReturn("session=abc", "session=def");
        doThrow(new ExternalServiceException("ALMA returned 401", 401)).doNothing().when(almaClient)
                .upload(eq(ALMA), eq("session=abc"), eq(42), any(JsonNode.class));
        doNothing().when(almaClient).upload(eq(ALMA), eq("session=def"), eq(42), any(JsonNode.class));

        SyncResult result = executor.execute(payload(), progress::add);

        assertEquals(0, result.failedUnits());
        verify(almaClient, times(2)).login(ALMA);
        verify(almaClient, times(4)).upload(eq(ALMA), eq("session=def"), eq(42), any(JsonNode.class));
    }

    @Test
    void testExecute_emptyIndicatorGroupCompletesImmediately() {
        when(dhis2Client.fetchIndicators(DHIS2, "grp")).thenReturn(List.of());

        SyncResult result = executor.execute(payload(), progress::add);

        assertEquals(0, result.totalUnits());
        assertEquals(List.of(100.0), progress);
        verify(almaClient, never()).login(any());
    }

    @Test
    void testExecute_unknownInstanceIsConfigurationError() {
        SyncJobPayload payload = new SyncJobPayload("s1", "dhis2-alma-sync", "missing", "B", 42, "grp",
                PeriodType.MONTH, RunFor.PREVIOUS, List.of(), Map.of());

        assertThrows(ConfigurationException.class, () -> executor.execute(payload, progress::add));
        verify(dhis2Client, never()).fetchIndicators(any(), anyString());
    }

    private static SyncJobPayload payload() {
        return new SyncJobPayload("s1", "dhis2-alma-sync", "A", "B", 42, "grp", PeriodType.MONTH, RunFor.PREVIOUS,
                List.of(), Map.of());
    }
}
