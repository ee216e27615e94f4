package villagecompute.adstudio.api.filters;

import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import villagecompute.adstudio.observability.LoggingConfig;

/**
 * JAX-RS filter that seeds MDC with trace context and the request line for every API call, and clears it when the
 * response is written.
 *
 * <p>
 * Services add {@code generation_job_id}/{@code platform} once they resolve the job, so every log line of a webhook
 * or disposition can be traced back to the job it touched.
 *
 * @see LoggingConfig
 */
@Provider
@Priority(Priorities.USER - 100)
public class RequestLoggingFilter implements ContainerRequestFilter, ContainerResponseFilter {

    private static final Logger LOG = Logger.getLogger(RequestLoggingFilter.class);

    private static final String START_NANOS_PROPERTY = "adstudio.request.startNanos";

    @Override
    public void filter(ContainerRequestContext requestContext) {
        LoggingConfig.enrichWithTraceContext();
        String path = requestContext.getUriInfo().getRequestUri().getPath();
        LoggingConfig.setRequestOrigin(requestContext.getMethod() + " " + path);
        requestContext.setProperty(START_NANOS_PROPERTY, System.nanoTime());
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        Object start = requestContext.getProperty(START_NANOS_PROPERTY);
        if (start instanceof Long startNanos) {
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
            LOG.debugf("%s %s -> %d (%d ms)", requestContext.getMethod(), requestContext.getUriInfo().getPath(),
                    responseContext.getStatus(), elapsedMs);
        }
        LoggingConfig.clearMDC();
    }
}
