package com.rolegate.guardedservice.infrastructure.web;

import com.rolegate.observability.CorrelationContextHolder;
import com.rolegate.security.AuthError;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * Maps {@link AuthError} to RFC 7807 problem responses.
 *
 * <table>
 *   <caption>Status mapping</caption>
 *   <tr><td>INVALID_TOKEN, EXPIRED_TOKEN</td><td>401, with {@code WWW-Authenticate: Bearer}</td></tr>
 *   <tr><td>UNAUTHORIZED</td><td>403</td></tr>
 *   <tr><td>PROVIDER_UNAVAILABLE</td><td>503</td></tr>
 * </table>
 *
 * <p>The detail is the error's fixed description: responses never name the role or permission
 * that was required.
 */
public final class AuthProblems {

    private static final String TYPE_PREFIX = "https://rolegate.dev/errors/";

    private AuthProblems() {
        // utility class
    }

    public static HttpStatus status(AuthError error) {
        return switch (error) {
            case INVALID_TOKEN, EXPIRED_TOKEN -> HttpStatus.UNAUTHORIZED;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case PROVIDER_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    public static ProblemDetail problem(AuthError error) {
        HttpStatus status = status(error);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, error.description());
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(TYPE_PREFIX + error.name().toLowerCase(Locale.ROOT).replace('_', '-')));
        problem.setProperty("error", error.name());
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }

    /** Problem response for functional routes. */
    public static ServerResponse serverResponse(AuthError error) {
        ServerResponse.BodyBuilder builder =
                ServerResponse.status(status(error)).contentType(MediaType.APPLICATION_PROBLEM_JSON);
        if (status(error) == HttpStatus.UNAUTHORIZED) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, wwwAuthenticate(error));
        }
        return builder.body(problem(error));
    }

    /** Problem response for annotated controllers. */
    public static ResponseEntity<ProblemDetail> responseEntity(AuthError error) {
        ResponseEntity.BodyBuilder builder =
                ResponseEntity.status(status(error)).contentType(MediaType.APPLICATION_PROBLEM_JSON);
        if (status(error) == HttpStatus.UNAUTHORIZED) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, wwwAuthenticate(error));
        }
        return builder.body(problem(error));
    }

    private static String wwwAuthenticate(AuthError error) {
        return "Bearer error=\"invalid_token\", error_description=\"" + error.description() + "\"";
    }
}
