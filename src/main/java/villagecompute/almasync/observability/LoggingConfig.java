/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching logs with job and schedule context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code schedule_id} - Schedule the current work belongs to</li>
 * <li>{@code job_id} - Job instance being executed (only for async job execution)</li>
 * <li>{@code request_origin} - HTTP request path or job name</li>
 * </ul>
 *
 * <p>
 * <b>Usage in Job Execution:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobId(job.id());
 * LoggingConfig.setScheduleId(job.scheduleId());
 * LoggingConfig.setRequestOrigin("job:" + job.name());
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Worker threads are reused,
 * so every job execution must end with {@link #clearMDC()}.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    /**
     * Schedule identifier. Present for API calls that target a schedule and for job execution.
     */
    public static final String MDC_SCHEDULE_ID = "schedule_id";

    /**
     * Job instance id ({@code <scheduleId>} or {@code repeat:<key>:<millis>}).
     */
    public static final String MDC_JOB_ID = "job_id";

    /**
     * HTTP request path (e.g., "/api/schedules") or job origin (e.g., "job:dhis2-alma-sync").
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Empty strings are written when no
     * span is active.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setScheduleId(String scheduleId) {
        if (scheduleId != null) {
            MDC.put(MDC_SCHEDULE_ID, scheduleId);
        }
    }

    public static void setJobId(String jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId);
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Clears all observability-related MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_SCHEDULE_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
