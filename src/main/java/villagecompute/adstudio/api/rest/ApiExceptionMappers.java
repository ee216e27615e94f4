package villagecompute.adstudio.api.rest;

import jakarta.persistence.PersistenceException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;
import villagecompute.adstudio.api.types.ErrorType;
import villagecompute.adstudio.exceptions.InvalidStateException;
import villagecompute.adstudio.exceptions.ResourceNotFoundException;
import villagecompute.adstudio.exceptions.ValidationException;
import villagecompute.adstudio.observability.LoggingConfig;

/**
 * Global mapping of domain exceptions to HTTP responses with a {@code {"error": "..."}} body.
 *
 * <p>
 * <b>Mappings:</b>
 * <ul>
 * <li>{@link ValidationException} - 400</li>
 * <li>{@link InvalidStateException} - 400, body also carries the job's current status</li>
 * <li>{@link ResourceNotFoundException} - 404</li>
 * <li>{@link PersistenceException} and anything unexpected - 500 with a generic message; details only go to the
 * log</li>
 * </ul>
 * JAX-RS exceptions keep their own response.
 */
public class ApiExceptionMappers {

    private static final Logger LOG = Logger.getLogger(ApiExceptionMappers.class);

    static final String GENERIC_ERROR = "Internal server error";

    @ServerExceptionMapper
    public Response mapValidation(ValidationException e) {
        LOG.debugf("Rejecting request: %s", e.getMessage());
        return error(Response.Status.BAD_REQUEST, new ErrorType(e.getMessage(), null));
    }

    @ServerExceptionMapper
    public Response mapInvalidState(InvalidStateException e) {
        LOG.infof("Invalid state transition: %s", e.getMessage());
        String status = e.getCurrentStatus() != null ? e.getCurrentStatus().wireValue() : null;
        return error(Response.Status.BAD_REQUEST, new ErrorType(e.getMessage(), status));
    }

    @ServerExceptionMapper
    public Response mapNotFound(ResourceNotFoundException e) {
        return error(Response.Status.NOT_FOUND, ErrorType.of(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapPersistence(PersistenceException e) {
        LOG.errorf(e, "Persistence failure (generation_job_id=%s, origin=%s)",
                MDC.get(LoggingConfig.MDC_GENERATION_JOB_ID), MDC.get(LoggingConfig.MDC_REQUEST_ORIGIN));
        return error(Response.Status.INTERNAL_SERVER_ERROR, ErrorType.of(GENERIC_ERROR));
    }

    @ServerExceptionMapper
    public Response mapUnexpected(Exception e) {
        if (e instanceof WebApplicationException webException) {
            return webException.getResponse();
        }
        LOG.errorf(e, "Unhandled exception (generation_job_id=%s, origin=%s)",
                MDC.get(LoggingConfig.MDC_GENERATION_JOB_ID), MDC.get(LoggingConfig.MDC_REQUEST_ORIGIN));
        return error(Response.Status.INTERNAL_SERVER_ERROR, ErrorType.of(GENERIC_ERROR));
    }

    private static Response error(Response.Status status, ErrorType body) {
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body).build();
    }
}
