package acmeca.validation;

import acmeca.config.AppProperties;
import acmeca.jws.Thumbprints;
import acmeca.model.Problem;
import acmeca.model.ProblemType;
import acmeca.validation.HttpChallengeClient.HttpChallengeResponse;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Validates http-01 and dns-01 challenges,
 * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-8.3">RFC 8555 Sec 8.3</a> and
 * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-8.4">Sec 8.4</a>.
 * <p>
 * Every attempt is bounded by a timeout. Failed attempts are retried with exponential backoff, and once the retries
 * are exhausted the last failure becomes the problem of an invalid result. The returned mono never errors.
 */
@Service
@Slf4j
public class ChallengeValidator {

    public static final String HTTP_CHALLENGE_PATH = "/.well-known/acme-challenge/";
    public static final String DNS_CHALLENGE_LABEL = "_acme-challenge.";

    private final HttpChallengeClient httpClient;
    private final TxtRecordResolver txtRecordResolver;
    private final AppProperties appProperties;

    public ChallengeValidator(HttpChallengeClient httpClient,
        TxtRecordResolver txtRecordResolver,
        AppProperties appProperties
    ) {
        this.httpClient = httpClient;
        this.txtRecordResolver = txtRecordResolver;
        this.appProperties = appProperties;
    }

    public Mono<ValidationResult> validate(ValidationTarget target) {
        final AppProperties.Validation validation = appProperties.validation();

        return Mono.defer(() -> attempt(target))
            .timeout(validation.attemptTimeout())
            .onErrorMap(TimeoutException.class, e -> new ChallengeFailedException(
                timeoutProblem(target), "Timed out after " + validation.attemptTimeout().toMillis() + "ms", e))
            .doOnError(e -> log.debug("Validation attempt for challenge={} host={} failed: {}",
                target.challengeId(), target.hostname(), e.getMessage()))
            .retryWhen(Retry.backoff(validation.maxRetries(), validation.firstBackoff())
                .onRetryExhaustedThrow((spec, signal) -> signal.failure())
            )
            .thenReturn(ValidationResult.success())
            .onErrorResume(e -> Mono.just(ValidationResult.failure(toProblem(e))));
    }

    private Mono<Void> attempt(ValidationTarget target) {
        return switch (target.type()) {
            case HTTP_01 -> attemptHttp(target);
            case DNS_01 -> attemptDns(target);
        };
    }

    private Mono<Void> attemptHttp(ValidationTarget target) {
        final URI uri = httpChallengeUri(target.hostname(), target.token());
        return httpClient.fetch(uri)
            .onErrorMap(e -> !(e instanceof ChallengeFailedException) && !(e instanceof TimeoutException),
                e -> new ChallengeFailedException(ProblemType.CONNECTION,
                    "Fetching " + uri + ": " + e.getMessage(), e))
            .switchIfEmpty(Mono.error(() -> new ChallengeFailedException(ProblemType.CONNECTION,
                "No response from " + uri)))
            .flatMap(response -> checkHttpResponse(uri, response, target.keyAuthorization()));
    }

    private Mono<Void> checkHttpResponse(URI uri, HttpChallengeResponse response, String keyAuthorization) {
        if (response.status() < 200 || response.status() > 299) {
            return Mono.error(new ChallengeFailedException(ProblemType.INCORRECT_RESPONSE,
                "Invalid response from " + uri + ": HTTP " + response.status()));
        }
        if (!matchesKeyAuthorization(response.body(), keyAuthorization)) {
            return Mono.error(new ChallengeFailedException(ProblemType.INCORRECT_RESPONSE,
                "The key authorization file from " + uri + " does not match the expected value"));
        }
        return Mono.empty();
    }

    /**
     * Byte-wise comparison of the response body. Trailing whitespace is ignored, as RFC 8555 Sec 8.3 recommends;
     * anything else around the key authorization is a mismatch.
     */
    static boolean matchesKeyAuthorization(byte[] body, String keyAuthorization) {
        if (body == null) {
            return false;
        }
        int length = body.length;
        while (length > 0 && isWhitespace(body[length - 1])) {
            length--;
        }
        final byte[] expected = keyAuthorization.getBytes(StandardCharsets.UTF_8);
        return Arrays.equals(body, 0, length, expected, 0, expected.length);
    }

    private static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\r' || b == '\n';
    }

    private Mono<Void> attemptDns(ValidationTarget target) {
        final String name = DNS_CHALLENGE_LABEL + target.hostname();
        final String expected = Thumbprints.dnsTxtValue(target.keyAuthorization());
        return txtRecordResolver.resolveTxt(name)
            .onErrorMap(e -> !(e instanceof ChallengeFailedException) && !(e instanceof TimeoutException),
                e -> new ChallengeFailedException(ProblemType.DNS, "DNS lookup of TXT " + name + " failed: "
                    + e.getMessage(), e))
            .defaultIfEmpty(List.of())
            .flatMap(values -> {
                if (values.isEmpty()) {
                    return Mono.error(new ChallengeFailedException(ProblemType.INCORRECT_RESPONSE,
                        "No TXT record found at " + name));
                }
                if (values.stream().map(String::strip).noneMatch(expected::equals)) {
                    return Mono.error(new ChallengeFailedException(ProblemType.INCORRECT_RESPONSE,
                        "None of the " + values.size() + " TXT records at " + name + " match the key authorization"));
                }
                return Mono.empty();
            });
    }

    URI httpChallengeUri(String hostname, String token) {
        final int port = appProperties.validation().httpPort();
        return UriComponentsBuilder.newInstance()
            .scheme("http")
            .host(hostname)
            .port(port == 80 ? -1 : port)
            .path(HTTP_CHALLENGE_PATH + token)
            .build()
            .toUri();
    }

    private static ProblemType timeoutProblem(ValidationTarget target) {
        return switch (target.type()) {
            case HTTP_01 -> ProblemType.CONNECTION;
            case DNS_01 -> ProblemType.DNS;
        };
    }

    private static Problem toProblem(Throwable e) {
        if (e instanceof ChallengeFailedException failed) {
            return Problem.of(failed.getType(), failed.getMessage());
        }
        log.warn("Unexpected failure during challenge validation", e);
        return Problem.of(ProblemType.SERVER_INTERNAL, "Validation failed unexpectedly");
    }
}
