package villagecompute.adstudio.api.rest;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.adstudio.TestFixtures;
import villagecompute.adstudio.data.models.GenerationJob;
import villagecompute.adstudio.data.models.GenerationStatus;

import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end tests for GenerationJobResource and the webhook resources working together.
 *
 * <p>
 * Covers the two reference review flows:
 * <ul>
 * <li>Text-to-video on Higgsfield: completed callback, approval, second approval refused</li>
 * <li>Product URL on TopView: failed callback, reject-and-regenerate refused</li>
 * </ul>
 */
@QuarkusTest
public class GenerationJobResourceTest {

    @BeforeEach
    void setUp() {
        TestFixtures.clearAll();
    }

    @Test
    public void testTextToVideoReviewFlow() {
        String jobId = given().contentType(ContentType.JSON)
                .body(Map.of("inputType", "text-to-video", "prompt", "Sunrise over a coffee cup")).when()
                .post("/api/generate").then().statusCode(201).body("platform", equalTo("higgsfield"))
                .body("status", equalTo("pending")).body("queueId", notNullValue()).extract().path("id");

        TestFixtures.setHiggsfieldRequestId(jobId, "hf_req_flow");

        given().contentType(ContentType.JSON)
                .body(Map.of("request_id", "hf_req_flow", "status", "completed", "video_url",
                        "https://cdn.example.com/flow.mp4"))
                .when().post("/api/webhooks/higgsfield").then().statusCode(200).body("success", equalTo(true))
                .body("jobId", equalTo(jobId)).body("status", equalTo("review"));

        assertTrue(TestFixtures.queueEntry(jobId).isEmpty());

        given().contentType(ContentType.JSON).body(Map.of("notes", "Great hook")).when()
                .post("/api/generate/" + jobId + "/approve").then().statusCode(200).body("success", equalTo(true))
                .body("message", equalTo("Video approved")).body("job.status", equalTo("approved"))
                .body("job.reviewNotes", equalTo("Great hook"))
                .body("job.outputVideoUrl", equalTo("https://cdn.example.com/flow.mp4"));

        given().contentType(ContentType.JSON).body(Map.of()).when().post("/api/generate/" + jobId + "/approve").then()
                .statusCode(400).body("error", containsString("approved")).body("status", equalTo("approved"));
    }

    @Test
    public void testProductUrlFailureFlow() {
        String jobId = given().contentType(ContentType.JSON)
                .body(Map.of("inputType", "product-url", "productUrl", "https://shop.example.com/p/glow-serum"))
                .when().post("/api/generate").then().statusCode(201).body("platform", equalTo("topview")).extract()
                .path("id");

        given().contentType(ContentType.JSON).body(Map.of("providerRequestId", "tv_task_flow")).when()
                .post("/api/generate/" + jobId + "/provider-reference").then().statusCode(200)
                .body("topviewTaskId", equalTo("tv_task_flow"));

        given().contentType(ContentType.JSON)
                .body(Map.of("task_id", "tv_task_flow", "status", "failed", "error", "render timeout")).when()
                .post("/api/webhooks/topview").then().statusCode(200).body("status", equalTo("failed"));

        given().contentType(ContentType.JSON).body(Map.of("notes", "retry", "regenerate", true)).when()
                .post("/api/generate/" + jobId + "/reject").then().statusCode(400)
                .body("error", containsString("failed"));

        GenerationJob job = TestFixtures.reload(jobId);
        assertEquals(GenerationStatus.FAILED, job.status);
        assertEquals("render timeout", job.errorMessage);
        assertNotNull(job.generatedAt);
        assertEquals(0, TestFixtures.regeneratedCount(jobId));
    }

    @Test
    public void testRejectWithRegeneration() {
        GenerationJob job = TestFixtures.createJobInStatus(GenerationStatus.REVIEW);

        String newJobId = given().contentType(ContentType.JSON)
                .body(Map.of("notes", "Product barely visible", "regenerate", true)).when()
                .post("/api/generate/" + job.id + "/reject").then().statusCode(200)
                .body("message", equalTo("Video rejected and queued for regeneration"))
                .body("newJobId", notNullValue()).extract().path("newJobId");

        given().when().get("/api/generate/" + newJobId).then().statusCode(200).body("status", equalTo("pending"))
                .body("retryCount", equalTo(1)).body("regeneratedFromJobId", equalTo(job.id))
                .body("queue.priority", equalTo(1));
    }

    @Test
    public void testRejectWithoutRegeneration() {
        GenerationJob job = TestFixtures.createJobInStatus(GenerationStatus.REVIEW);

        given().contentType(ContentType.JSON).body(Map.of("notes", "Off-brand colors")).when()
                .post("/api/generate/" + job.id + "/reject").then().statusCode(200)
                .body("message", equalTo("Video rejected")).body("newJobId", nullValue());

        assertEquals(GenerationStatus.REJECTED, TestFixtures.reload(job.id).status);
        assertEquals(0, TestFixtures.regeneratedCount(job.id));
    }

    @Test
    public void testDispositionsAcceptRequestsWithoutBody() {
        GenerationJob approved = TestFixtures.createJobInStatus(GenerationStatus.REVIEW);
        GenerationJob rejected = TestFixtures.createJobInStatus(GenerationStatus.REVIEW);

        given().when().post("/api/generate/" + approved.id + "/approve").then().statusCode(200)
                .body("job.status", equalTo("approved"));
        given().when().post("/api/generate/" + rejected.id + "/reject").then().statusCode(200)
                .body("message", equalTo("Video rejected"));
        given().contentType(ContentType.JSON).when().post("/api/generate/" + rejected.id + "/approve").then()
                .statusCode(400).body("status", equalTo("rejected"));

        assertEquals(GenerationStatus.APPROVED, TestFixtures.reload(approved.id).status);
        assertEquals(GenerationStatus.REJECTED, TestFixtures.reload(rejected.id).status);
    }

    @Test
    public void testCreateWithoutInputTypeReturns400() {
        given().contentType(ContentType.JSON).body(Map.of("prompt", "No input type")).when().post("/api/generate")
                .then().statusCode(400).body("error", equalTo("inputType is required"));

        assertEquals(0, TestFixtures.jobCount());
    }

    @Test
    public void testListAndDetail() {
        TestFixtures.createAd("ad-1", "[\"https://cdn.example.com/a.mp4\"]");
        GenerationJob job = TestFixtures.createPendingJob();

        given().when().get("/api/generate?status=pending").then().statusCode(200).body("total", equalTo(1))
                .body("limit", equalTo(50)).body("offset", equalTo(0)).body("jobs[0].id", equalTo(job.id))
                .body("jobs[0].inputData.aspectRatio", equalTo("9:16"));

        given().when().get("/api/generate/" + job.id).then().statusCode(200).body("id", equalTo(job.id))
                .body("status", equalTo("pending")).body("sourceAd.headline", equalTo("Glow Serum: 30% off"))
                .body("sourceAd.mediaUrls[0]", equalTo("https://cdn.example.com/a.mp4"))
                .body("queue.jobId", equalTo(job.id));

        given().when().get("/api/generate?status=processing").then().statusCode(400);
        given().when().get("/api/generate/does-not-exist").then().statusCode(404).body("error",
                containsString("does-not-exist"));
    }

    @Test
    public void testPatchOverrideReconcilesQueue() {
        GenerationJob job = TestFixtures.createPendingJob();

        given().contentType(ContentType.JSON).body(Map.of("status", "failed", "errorMessage", "Cancelled")).when()
                .patch("/api/generate/" + job.id).then().statusCode(200).body("status", equalTo("failed"))
                .body("errorMessage", equalTo("Cancelled"));
        assertEquals(0, TestFixtures.queueEntryCount(job.id));

        given().contentType(ContentType.JSON).body(Map.of("status", "pending")).when()
                .patch("/api/generate/" + job.id).then().statusCode(200).body("status", equalTo("pending"));
        assertEquals(1, TestFixtures.queueEntryCount(job.id));

        given().contentType(ContentType.JSON).body(Map.of("status", "bogus")).when().patch("/api/generate/" + job.id)
                .then().statusCode(400);
    }

    @Test
    public void testDelete() {
        GenerationJob job = TestFixtures.createPendingJob();

        given().when().delete("/api/generate/" + job.id).then().statusCode(200).body("success", equalTo(true))
                .body("message", equalTo("Job deleted"));
        assertEquals(0, TestFixtures.queueEntryCount(job.id));

        given().when().delete("/api/generate/" + job.id).then().statusCode(404);
    }
}
