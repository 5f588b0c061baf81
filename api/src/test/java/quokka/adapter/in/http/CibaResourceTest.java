package quokka.adapter.in.http;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.notNullValue;

import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.security.TestSecurity;
import io.restassured.http.ContentType;
import io.restassured.response.ValidatableResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@QuarkusTest
@DisplayName("CIBA Resource Tests")
public class CibaResourceTest {

    private static final String CIBA_PATH = "/connect/ciba";
    private static final String CIBA_GRANT = "urn:openid:params:grant-type:ciba";

    private static String startRequest() {
        return given().auth()
                .preemptive()
                .basic("ciba-app", "ciba-secret")
                .contentType(ContentType.URLENC)
                .formParam("scope", "openid profile")
                .formParam("login_hint", "alice@example.com")
                .formParam("binding_message", "W4SCT")
                .when()
                .post(CIBA_PATH)
                .then()
                .statusCode(200)
                .header("Cache-Control", "no-store")
                .body("auth_req_id", notNullValue())
                .body("expires_in", greaterThan(0))
                .body("interval", equalTo(5))
                .extract()
                .path("auth_req_id");
    }

    private static ValidatableResponse poll(String authReqId) {
        return given().auth()
                .preemptive()
                .basic("ciba-app", "ciba-secret")
                .contentType(ContentType.URLENC)
                .formParam("grant_type", CIBA_GRANT)
                .formParam("auth_req_id", authReqId)
                .when()
                .post("/connect/token")
                .then();
    }

    @Nested
    @DisplayName("authentication requests")
    class AuthenticationRequestTests {

        @Test
        @DisplayName("should require the openid scope")
        void shouldRequireOpenid() {
            given().auth()
                    .preemptive()
                    .basic("ciba-app", "ciba-secret")
                    .contentType(ContentType.URLENC)
                    .formParam("scope", "profile")
                    .formParam("login_hint", "alice@example.com")
                    .when()
                    .post(CIBA_PATH)
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("invalid_scope"));
        }

        @Test
        @DisplayName("should require exactly one hint")
        void shouldRequireOneHint() {
            given().auth()
                    .preemptive()
                    .basic("ciba-app", "ciba-secret")
                    .contentType(ContentType.URLENC)
                    .formParam("scope", "openid")
                    .when()
                    .post(CIBA_PATH)
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("invalid_request"));
        }

        @Test
        @DisplayName("should reject an unknown user")
        void shouldRejectUnknownUser() {
            given().auth()
                    .preemptive()
                    .basic("ciba-app", "ciba-secret")
                    .contentType(ContentType.URLENC)
                    .formParam("scope", "openid")
                    .formParam("login_hint", "nobody@example.com")
                    .when()
                    .post(CIBA_PATH)
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("unknown_user_id"));
        }

        @Test
        @DisplayName("should reject a non-numeric requested_expiry")
        void shouldRejectBadExpiry() {
            given().auth()
                    .preemptive()
                    .basic("ciba-app", "ciba-secret")
                    .contentType(ContentType.URLENC)
                    .formParam("scope", "openid")
                    .formParam("login_hint", "alice@example.com")
                    .formParam("requested_expiry", "soon")
                    .when()
                    .post(CIBA_PATH)
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("invalid_request"));
        }

        @Test
        @DisplayName("should reject clients not enabled for CIBA")
        void shouldRejectNonCibaClient() {
            given().auth()
                    .preemptive()
                    .basic("service-app", "service-secret")
                    .contentType(ContentType.URLENC)
                    .formParam("scope", "openid")
                    .formParam("login_hint", "alice@example.com")
                    .when()
                    .post(CIBA_PATH)
                    .then()
                    .statusCode(400)
                    .body("error", equalTo("unauthorized_client"));
        }

        @Test
        @DisplayName("should reject a wrong client secret")
        void shouldRejectWrongSecret() {
            given().auth()
                    .preemptive()
                    .basic("ciba-app", "nope")
                    .contentType(ContentType.URLENC)
                    .formParam("scope", "openid")
                    .formParam("login_hint", "alice@example.com")
                    .when()
                    .post(CIBA_PATH)
                    .then()
                    .statusCode(401)
                    .body("error", equalTo("invalid_client"));
        }
    }

    @Nested
    @DisplayName("polling")
    class PollingTests {

        @Test
        @DisplayName("should report pending, then slow_down when polled too fast")
        void shouldReportPendingThenSlowDown() {
            final var authReqId = startRequest();

            poll(authReqId).statusCode(400).body("error", equalTo("authorization_pending"));
            poll(authReqId).statusCode(400).body("error", equalTo("slow_down"));
        }

        @Test
        @TestSecurity(
                user = "approver",
                roles = {"ciba-approver"})
        @DisplayName("should issue tokens once after approval")
        void shouldIssueTokensAfterApproval() {
            final var authReqId = startRequest();

            given().contentType(ContentType.JSON)
                    .body("{\"subjectId\": \"user-alice\"}")
                    .when()
                    .post("/admin/ciba/" + authReqId + "/approve")
                    .then()
                    .statusCode(200)
                    .body("status", equalTo("APPROVED"));

            poll(authReqId)
                    .statusCode(200)
                    .body("access_token", notNullValue())
                    .body("id_token", notNullValue())
                    .body("token_type", equalTo("Bearer"));

            poll(authReqId).statusCode(400);
        }

        @Test
        @TestSecurity(
                user = "approver",
                roles = {"ciba-approver"})
        @DisplayName("should report access_denied after a denial")
        void shouldReportDenial() {
            final var authReqId = startRequest();

            given().contentType(ContentType.JSON)
                    .when()
                    .post("/admin/ciba/" + authReqId + "/deny")
                    .then()
                    .statusCode(200)
                    .body("status", equalTo("DENIED"));

            poll(authReqId).statusCode(400).body("error", equalTo("access_denied"));
            poll(authReqId).statusCode(400).body("error", equalTo("access_denied"));
        }

        @Test
        @DisplayName("should reject unknown auth_req_id values")
        void shouldRejectUnknownRequest() {
            poll("does-not-exist").statusCode(400).body("error", equalTo("expired_token"));
        }
    }
}
