package villagecompute.adstudio.api.rest;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.adstudio.TestFixtures;
import villagecompute.adstudio.data.models.GenerationJob;
import villagecompute.adstudio.data.models.GenerationStatus;

import java.time.Instant;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusTest
public class TopviewWebhookResourceTest {

    private static final String ENDPOINT = "/api/webhooks/topview";

    @BeforeEach
    void setUp() {
        TestFixtures.clearAll();
    }

    @Test
    public void testCompletedStoresVideoAndPreview() {
        GenerationJob job = TestFixtures.createPendingJob("topview", Instant.now());
        TestFixtures.setTopviewTaskId(job.id, "tv_task_1");

        given().contentType(ContentType.JSON)
                .body(Map.of("task_id", "tv_task_1", "status", "completed", "video_url",
                        "https://cdn.example.com/tv.mp4", "preview_url", "https://cdn.example.com/tv.jpg"))
                .when().post(ENDPOINT).then().statusCode(200).body("status", equalTo("review"));

        GenerationJob updated = TestFixtures.reload(job.id);
        assertEquals(GenerationStatus.REVIEW, updated.status);
        assertEquals("https://cdn.example.com/tv.mp4", updated.outputVideoUrl);
        assertEquals("https://cdn.example.com/tv.jpg", updated.previewUrl);
        assertTrue(TestFixtures.queueEntry(job.id).isEmpty());
    }

    @Test
    public void testFailedStoresProviderError() {
        GenerationJob job = TestFixtures.createPendingJob("topview", Instant.now());
        TestFixtures.setTopviewTaskId(job.id, "tv_task_2");

        given().contentType(ContentType.JSON)
                .body(Map.of("task_id", "tv_task_2", "status", "failed", "error", "render timeout")).when()
                .post(ENDPOINT).then().statusCode(200).body("status", equalTo("failed"));

        GenerationJob updated = TestFixtures.reload(job.id);
        assertEquals(GenerationStatus.FAILED, updated.status);
        assertEquals("render timeout", updated.errorMessage);
    }

    @Test
    public void testProcessingStatusLeavesJobQueued() {
        GenerationJob job = TestFixtures.createPendingJob("topview", Instant.now());
        TestFixtures.setTopviewTaskId(job.id, "tv_task_3");

        given().contentType(ContentType.JSON).body(Map.of("task_id", "tv_task_3", "status", "processing")).when()
                .post(ENDPOINT).then().statusCode(200).body("status", equalTo("pending"));

        assertEquals(1, TestFixtures.queueEntryCount(job.id));
    }

    @Test
    public void testMissingTaskIdReturns400() {
        given().contentType(ContentType.JSON).body(Map.of("status", "completed")).when().post(ENDPOINT).then()
                .statusCode(400).body("error", equalTo("Missing task_id"));
    }

    @Test
    public void testUnknownTaskReturns404() {
        given().contentType(ContentType.JSON).body(Map.of("task_id", "tv_unknown", "status", "completed")).when()
                .post(ENDPOINT).then().statusCode(404);
    }

    @Test
    public void testHealthCheck() {
        given().when().get(ENDPOINT).then().statusCode(200).body("service", equalTo("TopView Webhook Handler"))
                .body("status", equalTo("active"));
    }
}
