package quokka.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for the admin surface.
 *
 * <p>Protocol endpoints answer with the OAuth error shape instead; see
 * {@link quokka.adapter.in.http.OAuthResponses}.
 */
public final class QuokkaProblem {

    private QuokkaProblem() {}

    public static HttpProblem resourceNotFound(String resourceType, String resourceId) {
        return HttpProblem.builder()
                .withTitle("%s Not Found".formatted(resourceType))
                .withStatus(Status.NOT_FOUND)
                .withDetail("%s not found: %s".formatted(resourceType, resourceId))
                .build();
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem conflict(String detail) {
        return HttpProblem.builder()
                .withTitle("Conflict")
                .withStatus(Status.CONFLICT)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem serviceUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }
}
