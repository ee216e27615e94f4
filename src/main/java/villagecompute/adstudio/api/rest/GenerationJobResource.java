package villagecompute.adstudio.api.rest;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.adstudio.api.types.ActionResultType;
import villagecompute.adstudio.api.types.ApprovalResultType;
import villagecompute.adstudio.api.types.ApproveRequestType;
import villagecompute.adstudio.api.types.CreateGenerationJobRequestType;
import villagecompute.adstudio.api.types.GenerationJobDetailType;
import villagecompute.adstudio.api.types.GenerationJobListType;
import villagecompute.adstudio.api.types.GenerationJobType;
import villagecompute.adstudio.api.types.JobCreatedType;
import villagecompute.adstudio.api.types.ProviderReferenceRequestType;
import villagecompute.adstudio.api.types.RejectRequestType;
import villagecompute.adstudio.api.types.RejectionResultType;
import villagecompute.adstudio.api.types.UpdateGenerationJobRequestType;
import villagecompute.adstudio.data.models.GenerationJob;
import villagecompute.adstudio.services.GenerationJobService;

/**
 * REST resource for generation jobs.
 *
 * <p>
 * <b>Review Workflow:</b>
 * <ol>
 * <li>Client creates a job via POST /api/generate; it starts {@code pending} with a queue entry</li>
 * <li>The dispatcher submits the render and may report the provider id via POST /{id}/provider-reference</li>
 * <li>The provider calls /api/webhooks/{provider}; the job moves to {@code review} or {@code failed}</li>
 * <li>A reviewer approves via POST /{id}/approve or rejects via POST /{id}/reject, optionally regenerating</li>
 * </ol>
 *
 * <p>
 * PATCH /{id} is an operator override outside this workflow. Domain errors are mapped by {@link ApiExceptionMappers}.
 *
 * @see GenerationJobService
 */
@Path("/api/generate")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(
        name = "Generation Jobs",
        description = "AI video generation job lifecycle and review")
public class GenerationJobResource {

    private static final Logger LOG = Logger.getLogger(GenerationJobResource.class);

    @Inject
    GenerationJobService generationJobService;

    /**
     * Creates a generation job.
     *
     * <p>
     * <b>Example Request:</b>
     *
     * <pre>
     * {
     *   "inputType": "product-url",
     *   "productUrl": "https://shop.example.com/products/glow-serum",
     *   "script": "Your skin, but brighter.",
     *   "sourceAdId": "ad_3f9a"
     * }
     * </pre>
     *
     * @param request
     *            creation request
     * @return 201 with ids, platform and {@code pending} status
     */
    @POST
    @Operation(
            summary = "Create generation job",
            description = "Routes the job to a provider and queues it")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "Job queued"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Missing inputType")})
    public Response create(@Valid CreateGenerationJobRequestType request) {
        LOG.infof("Creating generation job: inputType=%s, platform=%s", request != null ? request.inputType() : null,
                request != null ? request.platform() : null);

        JobCreatedType created = generationJobService.createJob(request);
        return Response.status(Response.Status.CREATED).entity(created).build();
    }

    @GET
    @Operation(
            summary = "List generation jobs",
            description = "Newest first, optionally filtered by status and platform")
    public GenerationJobListType list(@QueryParam("status") String status, @QueryParam("platform") String platform,
            @QueryParam("limit") Integer limit, @QueryParam("offset") Integer offset) {
        LOG.debugf("Listing generation jobs: status=%s, platform=%s, limit=%s, offset=%s", status, platform, limit,
                offset);
        return generationJobService.listJobs(status, platform, limit, offset);
    }

    @GET
    @Path("/{id}")
    @Operation(
            summary = "Get generation job",
            description = "Job with source ad summary and queue entry")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Job found"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Job not found")})
    public GenerationJobDetailType get(@PathParam("id") String id) {
        return generationJobService.getJobDetail(id);
    }

    /**
     * Operator override of job fields. Reconciles the queue with the resulting status.
     *
     * @param id
     *            job id
     * @param request
     *            fields to overwrite
     * @return the updated job
     */
    @PATCH
    @Path("/{id}")
    @Operation(
            summary = "Override generation job",
            description = "Administrative repair; bypasses the review workflow")
    public GenerationJobType update(@PathParam("id") String id, @Valid UpdateGenerationJobRequestType request) {
        LOG.infof("Overriding generation job %s: status=%s", id, request != null ? request.status() : null);

        GenerationJob job = generationJobService.override(id, request);
        return generationJobService.toType(job);
    }

    @DELETE
    @Path("/{id}")
    @Operation(
            summary = "Delete generation job",
            description = "Removes the queue entry, then the job")
    public ActionResultType delete(@PathParam("id") String id) {
        LOG.infof("Deleting generation job %s", id);

        generationJobService.delete(id);
        return new ActionResultType(true, "Job deleted");
    }

    /**
     * Approves a rendered video.
     *
     * <p>
     * <b>Request Body:</b>
     *
     * <pre>
     * {
     *   "notes": "Strong hook, ship it"
     * }
     * </pre>
     *
     * @param id
     *            job id
     * @param request
     *            optional notes; the body may be omitted entirely, with or without a Content-Type
     * @return 200 with the approved job, 400 if the job is not in review, 404 if missing
     */
    @POST
    @Path("/{id}/approve")
    @Consumes({MediaType.APPLICATION_JSON, MediaType.WILDCARD})
    @Operation(
            summary = "Approve video",
            description = "Moves a job from review to approved")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Approved"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Job not in review"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Job not found")})
    public ApprovalResultType approve(@PathParam("id") String id, @Valid ApproveRequestType request) {
        LOG.infof("Approving generation job %s", id);

        String notes = request != null ? request.notes() : null;
        GenerationJob job = generationJobService.approve(id, notes);
        return new ApprovalResultType(true, "Video approved", generationJobService.toType(job));
    }

    /**
     * Rejects a rendered video.
     *
     * <p>
     * <b>Request Body:</b>
     *
     * <pre>
     * {
     *   "notes": "Product barely visible",
     *   "regenerate": true
     * }
     * </pre>
     *
     * @param id
     *            job id
     * @param request
     *            optional notes and regeneration flag; may be omitted
     * @return 200 with the regenerated job id (null without regeneration)
     */
    @POST
    @Path("/{id}/reject")
    @Consumes({MediaType.APPLICATION_JSON, MediaType.WILDCARD})
    @Operation(
            summary = "Reject video",
            description = "Moves a job from review to rejected and optionally queues a regeneration")
    public RejectionResultType reject(@PathParam("id") String id, @Valid RejectRequestType request) {
        boolean regenerate = request != null && request.shouldRegenerate();
        LOG.infof("Rejecting generation job %s (regenerate=%s)", id, regenerate);

        String notes = request != null ? request.notes() : null;
        String newJobId = generationJobService.reject(id, notes, regenerate);
        String message = newJobId != null ? "Video rejected and queued for regeneration" : "Video rejected";
        return new RejectionResultType(true, message, newJobId);
    }

    @POST
    @Path("/{id}/provider-reference")
    @Operation(
            summary = "Attach provider reference",
            description = "Records the provider request/task id on a pending job")
    public GenerationJobType attachProviderReference(@PathParam("id") String id,
            ProviderReferenceRequestType request) {
        String reference = request != null ? request.providerRequestId() : null;
        LOG.infof("Attaching provider reference %s to generation job %s", reference, id);

        GenerationJob job = generationJobService.attachProviderReference(id, reference);
        return generationJobService.toType(job);
    }
}
