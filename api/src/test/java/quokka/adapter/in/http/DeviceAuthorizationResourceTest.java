package quokka.adapter.in.http;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.startsWith;

import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.security.TestSecurity;
import io.restassured.http.ContentType;
import io.restassured.path.json.JsonPath;
import io.restassured.response.ValidatableResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@QuarkusTest
@DisplayName("Device Authorization Resource Tests")
public class DeviceAuthorizationResourceTest {

    private static final String DEVICE_PATH = "/connect/deviceauthorization";
    private static final String DEVICE_GRANT = "urn:ietf:params:oauth:grant-type:device_code";

    private static JsonPath start() {
        return given().auth()
                .preemptive()
                .basic("service-app", "service-secret")
                .contentType(ContentType.URLENC)
                .formParam("scope", "openid api.read")
                .when()
                .post(DEVICE_PATH)
                .then()
                .statusCode(200)
                .header("Cache-Control", "no-store")
                .body("device_code", notNullValue())
                .body("user_code", notNullValue())
                .body("verification_uri", startsWith("http"))
                .body("verification_uri_complete", containsString("user_code="))
                .body("expires_in", greaterThan(0))
                .body("interval", greaterThan(0))
                .extract()
                .jsonPath();
    }

    private static ValidatableResponse poll(String deviceCode) {
        return given().auth()
                .preemptive()
                .basic("service-app", "service-secret")
                .contentType(ContentType.URLENC)
                .formParam("grant_type", DEVICE_GRANT)
                .formParam("device_code", deviceCode)
                .when()
                .post("/connect/token")
                .then();
    }

    @Test
    @DisplayName("should report authorization_pending before the user decides")
    void shouldReportPending() {
        final var started = start();

        poll(started.getString("device_code")).statusCode(400).body("error", equalTo("authorization_pending"));
    }

    @Test
    @TestSecurity(
            user = "verifier",
            roles = {"device-approver"})
    @DisplayName("should issue tokens once the user approves")
    void shouldIssueTokensAfterApproval() {
        final var started = start();

        given().contentType(ContentType.JSON)
                .body("{\"subjectId\": \"user-alice\"}")
                .when()
                .post("/admin/device/" + started.getString("user_code") + "/approve")
                .then()
                .statusCode(200)
                .body("status", equalTo("AUTHORIZED"));

        poll(started.getString("device_code"))
                .statusCode(200)
                .body("access_token", notNullValue())
                .body("id_token", notNullValue());

        poll(started.getString("device_code")).statusCode(400).body("error", equalTo("invalid_grant"));
    }

    @Test
    @TestSecurity(
            user = "verifier",
            roles = {"device-approver"})
    @DisplayName("should report access_denied once the user denies")
    void shouldReportDenial() {
        final var started = start();

        given().contentType(ContentType.JSON)
                .when()
                .post("/admin/device/" + started.getString("user_code") + "/deny")
                .then()
                .statusCode(200)
                .body("status", equalTo("DENIED"));

        poll(started.getString("device_code")).statusCode(400).body("error", equalTo("access_denied"));
    }

    @Test
    @TestSecurity(
            user = "verifier",
            roles = {"device-approver"})
    @DisplayName("should answer 404 for an unknown user code")
    void shouldRejectUnknownUserCode() {
        given().contentType(ContentType.JSON)
                .body("{\"subjectId\": \"user-alice\"}")
                .when()
                .post("/admin/device/ZZZZ-ZZZZ/approve")
                .then()
                .statusCode(404);
    }

    @Test
    @DisplayName("should reject clients without the device code grant")
    void shouldRejectUnregisteredClient() {
        given().auth()
                .preemptive()
                .basic("ciba-app", "ciba-secret")
                .contentType(ContentType.URLENC)
                .formParam("scope", "openid")
                .when()
                .post(DEVICE_PATH)
                .then()
                .statusCode(400)
                .body("error", equalTo("unauthorized_client"));
    }

    @Test
    @DisplayName("should reject a scope the client may not request")
    void shouldRejectDisallowedScope() {
        given().auth()
                .preemptive()
                .basic("service-app", "service-secret")
                .contentType(ContentType.URLENC)
                .formParam("scope", "admin.all")
                .when()
                .post(DEVICE_PATH)
                .then()
                .statusCode(400)
                .body("error", equalTo("invalid_scope"));
    }
}
