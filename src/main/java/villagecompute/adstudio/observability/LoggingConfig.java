package villagecompute.adstudio.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * MDC field names and helpers for structured logging.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code request_origin} - HTTP method and path, or scheduler name</li>
 * <li>{@code generation_job_id} - Generation job being worked on</li>
 * <li>{@code platform} - Provider tag of that job</li>
 * </ul>
 *
 * <p>
 * <b>Usage in HTTP Filters:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setRequestOrigin("POST /api/webhooks/higgsfield");
 * </pre>
 *
 * <p>
 * <b>Usage in Services:</b>
 *
 * <pre>
 * LoggingConfig.setGenerationJob(job.id, job.platform);
 * </pre>
 *
 * <p>
 * MDC is thread-local; whoever enriches it clears it with {@link #clearMDC()} when the unit of work ends.
 *
 * @see villagecompute.adstudio.api.filters.RequestLoggingFilter
 */
public final class LoggingConfig {

    /**
     * OpenTelemetry trace identifier (32 hex characters).
     */
    public static final String MDC_TRACE_ID = "trace_id";

    /**
     * OpenTelemetry span identifier (16 hex characters).
     */
    public static final String MDC_SPAN_ID = "span_id";

    /**
     * HTTP request line (e.g., "PATCH /api/generate/{id}") or scheduler identifier (e.g., "StalePendingJobSweep").
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    /**
     * Generation job id. Present once a request or sweep has resolved the job it acts on.
     */
    public static final String MDC_GENERATION_JOB_ID = "generation_job_id";

    /**
     * Provider tag of the job in {@link #MDC_GENERATION_JOB_ID}.
     */
    public static final String MDC_PLATFORM = "platform";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span into MDC. Empty strings when there is no valid
     * span so the JSON log schema stays stable.
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

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Tags subsequent log lines with the job being acted on.
     *
     * @param jobId
     *            generation job id
     * @param platform
     *            provider tag (may be null)
     */
    public static void setGenerationJob(String jobId, String platform) {
        if (jobId != null) {
            MDC.put(MDC_GENERATION_JOB_ID, jobId);
        }
        if (platform != null) {
            MDC.put(MDC_PLATFORM, platform);
        }
    }

    /**
     * Removes the job fields only, keeping request-level context. Used by loops that process several jobs.
     */
    public static void clearGenerationJob() {
        MDC.remove(MDC_GENERATION_JOB_ID);
        MDC.remove(MDC_PLATFORM);
    }

    /**
     * Clears every field this class manages.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
        clearGenerationJob();
    }
}
