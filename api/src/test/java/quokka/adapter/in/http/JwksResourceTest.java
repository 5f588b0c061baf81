package quokka.adapter.in.http;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.jose4j.jws.JsonWebSignature;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@QuarkusTest
@DisplayName("JWKS Resource Tests")
public class JwksResourceTest {

    private static String issueAccessToken() {
        return given().auth()
                .preemptive()
                .basic("service-app", "service-secret")
                .contentType(ContentType.URLENC)
                .formParam("grant_type", "client_credentials")
                .when()
                .post("/connect/token")
                .then()
                .statusCode(200)
                .extract()
                .path("access_token");
    }

    @Test
    @DisplayName("should publish public keys with a public cache header")
    void shouldPublishPublicKeys() {
        issueAccessToken();

        given().when()
                .get("/.well-known/jwks.json")
                .then()
                .statusCode(200)
                .header("Cache-Control", startsWith("public, max-age="))
                .body("keys", not(empty()))
                .body("keys.kid", everyItem(notNullValue()))
                .body("keys.d", everyItem(nullValue()))
                .body("keys.p", everyItem(nullValue()));
    }

    @Test
    @DisplayName("should list the key that signed an issued token")
    void shouldListSigningKey() throws Exception {
        final var jws = new JsonWebSignature();
        jws.setCompactSerialization(issueAccessToken());
        final var kid = jws.getKeyIdHeaderValue();

        given().when().get("/.well-known/jwks.json").then().statusCode(200).body("keys.kid", hasItem(kid));
    }
}
