package villagecompute.adstudio.api.rest;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.equalTo;

@QuarkusTest
public class HealthResourceTest {

    @Test
    public void testHealthEndpoint() {
        given().when().get("/api/health").then().statusCode(200).body("status", equalTo("UP"))
                .body("message", equalTo("adstudio generation coordinator is running"));
    }
}
