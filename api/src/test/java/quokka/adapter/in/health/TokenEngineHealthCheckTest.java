package quokka.adapter.in.health;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@QuarkusTest
@DisplayName("Token Engine Health Check Tests")
public class TokenEngineHealthCheckTest {

    @Test
    @DisplayName("should report the engine ready with memory storage and local keys")
    void shouldReportReady() {
        given().when()
                .get("/q/health/ready")
                .then()
                .statusCode(200)
                .body("checks.name", hasItem("token-engine"))
                .body("checks.find { it.name == 'token-engine' }.status", equalTo("UP"))
                .body("checks.find { it.name == 'token-engine' }.data.'storage.provider'", equalTo("memory"));
    }
}
