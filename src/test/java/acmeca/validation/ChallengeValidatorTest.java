package acmeca.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import acmeca.config.AppProperties;
import acmeca.jws.Thumbprints;
import acmeca.model.ChallengeType;
import acmeca.model.ProblemType;
import acmeca.validation.HttpChallengeClient.HttpChallengeResponse;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class ChallengeValidatorTest {

    private static final String TOKEN = "evaGxfADs6pSRb2LAv9IZf17Dt3juxGJ-PCt92wr-oA";
    private static final String KEY_AUTHORIZATION = TOKEN + ".9jg46WB3rR_AHD-EBXdN7cBkH1WOu0tA3M9fm21mqTI";

    private HttpChallengeClient httpClient;
    private TxtRecordResolver txtRecordResolver;
    private AppProperties appProperties;
    private ChallengeValidator validator;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpChallengeClient.class);
        txtRecordResolver = mock(TxtRecordResolver.class);
        appProperties = mock(AppProperties.class);
        when(appProperties.validation()).thenReturn(
            new AppProperties.Validation(Duration.ofMillis(200), 2, Duration.ofMillis(10), 80, 8192));
        validator = new ChallengeValidator(httpClient, txtRecordResolver, appProperties);
    }

    @Test
    void httpChallengeWithMatchingBody() {
        when(httpClient.fetch(any()))
            .thenReturn(Mono.just(response(200, KEY_AUTHORIZATION + "\n")));

        StepVerifier.create(validator.validate(target(ChallengeType.HTTP_01)))
            .assertNext(result -> assertThat(result.valid()).isTrue())
            .verifyComplete();

        verify(httpClient).fetch(URI.create("http://www.example.test/.well-known/acme-challenge/" + TOKEN));
    }

    @Test
    void httpChallengeWithLeadingWhitespaceIsInvalid() {
        when(httpClient.fetch(any()))
            .thenReturn(Mono.just(response(200, "  \t" + KEY_AUTHORIZATION + " \r\n ")));

        StepVerifier.create(validator.validate(target(ChallengeType.HTTP_01)))
            .assertNext(result -> {
                assertThat(result.valid()).isFalse();
                assertThat(result.problem().type()).isEqualTo(ProblemType.INCORRECT_RESPONSE.urn());
            })
            .verifyComplete();
    }

    @Test
    void keyAuthorizationMatchIsBytewise() {
        final byte[] expected = KEY_AUTHORIZATION.getBytes(StandardCharsets.UTF_8);

        assertThat(ChallengeValidator.matchesKeyAuthorization(expected, KEY_AUTHORIZATION)).isTrue();
        assertThat(ChallengeValidator.matchesKeyAuthorization(
            (KEY_AUTHORIZATION + " \r\n\t").getBytes(StandardCharsets.UTF_8), KEY_AUTHORIZATION)).isTrue();
        assertThat(ChallengeValidator.matchesKeyAuthorization(
            (" " + KEY_AUTHORIZATION).getBytes(StandardCharsets.UTF_8), KEY_AUTHORIZATION)).isFalse();
        assertThat(ChallengeValidator.matchesKeyAuthorization(
            (KEY_AUTHORIZATION + "x").getBytes(StandardCharsets.UTF_8), KEY_AUTHORIZATION)).isFalse();
        assertThat(ChallengeValidator.matchesKeyAuthorization(
            KEY_AUTHORIZATION.getBytes(StandardCharsets.UTF_16BE), KEY_AUTHORIZATION)).isFalse();
        assertThat(ChallengeValidator.matchesKeyAuthorization(new byte[0], KEY_AUTHORIZATION)).isFalse();
        assertThat(ChallengeValidator.matchesKeyAuthorization(null, KEY_AUTHORIZATION)).isFalse();
    }

    @Test
    void httpChallengeWithWrongBodyIsRetriedThenInvalid() {
        when(httpClient.fetch(any()))
            .thenReturn(Mono.just(response(200, "something else")));

        StepVerifier.create(validator.validate(target(ChallengeType.HTTP_01)))
            .assertNext(result -> {
                assertThat(result.valid()).isFalse();
                assertThat(result.problem().type()).isEqualTo(ProblemType.INCORRECT_RESPONSE.urn());
            })
            .verifyComplete();

        verify(httpClient, times(3)).fetch(any());
    }

    @Test
    void httpErrorStatusIsIncorrectResponse() {
        when(httpClient.fetch(any()))
            .thenReturn(Mono.just(response(404, "not found")));

        StepVerifier.create(validator.validate(target(ChallengeType.HTTP_01)))
            .assertNext(result -> assertThat(result.problem().type()).isEqualTo(ProblemType.INCORRECT_RESPONSE.urn()))
            .verifyComplete();
    }

    @Test
    void transientConnectionFailureIsRetried() {
        when(httpClient.fetch(any()))
            .thenReturn(Mono.error(new IOException("connection refused")))
            .thenReturn(Mono.just(response(200, KEY_AUTHORIZATION)));

        StepVerifier.create(validator.validate(target(ChallengeType.HTTP_01)))
            .assertNext(result -> assertThat(result.valid()).isTrue())
            .verifyComplete();

        verify(httpClient, times(2)).fetch(any());
    }

    @Test
    void persistentConnectionFailureIsConnectionProblem() {
        when(httpClient.fetch(any()))
            .thenReturn(Mono.error(new IOException("connection refused")));

        StepVerifier.create(validator.validate(target(ChallengeType.HTTP_01)))
            .assertNext(result -> {
                assertThat(result.valid()).isFalse();
                assertThat(result.problem().type()).isEqualTo(ProblemType.CONNECTION.urn());
                assertThat(result.problem().detail()).contains("connection refused");
            })
            .verifyComplete();
    }

    @Test
    void hangingServerTimesOut() {
        when(httpClient.fetch(any())).thenReturn(Mono.never());

        StepVerifier.create(validator.validate(target(ChallengeType.HTTP_01)))
            .assertNext(result -> assertThat(result.problem().type()).isEqualTo(ProblemType.CONNECTION.urn()))
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void dnsChallengeMatchesDigestAmongRecords() {
        when(txtRecordResolver.resolveTxt(any()))
            .thenReturn(Mono.just(List.of("unrelated", Thumbprints.dnsTxtValue(KEY_AUTHORIZATION))));

        StepVerifier.create(validator.validate(target(ChallengeType.DNS_01)))
            .assertNext(result -> assertThat(result.valid()).isTrue())
            .verifyComplete();

        verify(txtRecordResolver).resolveTxt("_acme-challenge.www.example.test");
    }

    @Test
    void dnsChallengeWithPlainKeyAuthorizationIsIncorrect() {
        when(txtRecordResolver.resolveTxt(any()))
            .thenReturn(Mono.just(List.of(KEY_AUTHORIZATION)));

        StepVerifier.create(validator.validate(target(ChallengeType.DNS_01)))
            .assertNext(result -> assertThat(result.problem().type()).isEqualTo(ProblemType.INCORRECT_RESPONSE.urn()))
            .verifyComplete();
    }

    @Test
    void dnsLookupFailureIsDnsProblem() {
        when(txtRecordResolver.resolveTxt(any()))
            .thenReturn(Mono.error(new IOException("SERVFAIL")));

        StepVerifier.create(validator.validate(target(ChallengeType.DNS_01)))
            .assertNext(result -> assertThat(result.problem().type()).isEqualTo(ProblemType.DNS.urn()))
            .verifyComplete();
    }

    @Test
    void httpChallengeUsesConfiguredPort() {
        when(appProperties.validation()).thenReturn(
            new AppProperties.Validation(Duration.ofMillis(200), 0, Duration.ofMillis(10), 5002, 8192));

        assertThat(validator.httpChallengeUri("www.example.test", TOKEN))
            .isEqualTo(URI.create("http://www.example.test:5002/.well-known/acme-challenge/" + TOKEN));
    }

    private static ValidationTarget target(ChallengeType type) {
        return ValidationTarget.builder()
            .challengeId("challenge-1")
            .authorizationId("authz-1")
            .orderId("order-1")
            .type(type)
            .hostname("www.example.test")
            .token(TOKEN)
            .keyAuthorization(KEY_AUTHORIZATION)
            .build();
    }

    private static HttpChallengeResponse response(int status, String body) {
        return new HttpChallengeResponse(status, body.getBytes(StandardCharsets.UTF_8));
    }
}
