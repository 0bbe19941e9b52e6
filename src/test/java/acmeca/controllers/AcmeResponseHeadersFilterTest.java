package acmeca.controllers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import acmeca.jws.NonceService;
import acmeca.services.AcmeUrls;
import java.net.URI;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.test.StepVerifier;

class AcmeResponseHeadersFilterTest {

    @ParameterizedTest
    @CsvSource({
        "/directory, directory",
        "/order/abc/finalize, order",
        "/cert/0a1b, cert",
        "new-nonce, new-nonce",
        "/, ''",
        "/admin/tasks/cache-crls, admin"
    })
    void firstSegment(String path, String expected) {
        assertThat(AcmeResponseHeadersFilter.firstSegment(path)).isEqualTo(expected);
    }

    @Test
    void link() {
        assertThat(AcmeResponseHeadersFilter.link(URI.create("https://acme.test/acme/directory"), "index"))
            .isEqualTo("<https://acme.test/acme/directory>;rel=\"index\"");
    }

    @Test
    void appendsIndexLinkToReadOnlyLinkValues() {
        final NonceService nonceService = mock(NonceService.class);
        when(nonceService.issue()).thenReturn("nonce-1");
        final AcmeUrls acmeUrls = mock(AcmeUrls.class);
        when(acmeUrls.directory()).thenReturn(URI.create("https://acme.test/acme/directory"));
        final AcmeResponseHeadersFilter filter = new AcmeResponseHeadersFilter(nonceService, acmeUrls);

        final String up = AcmeResponseHeadersFilter.link(URI.create("https://acme.test/acme/authz/a1"), "up");
        final MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/challenge/c1"));

        StepVerifier.create(filter.filter(exchange, filtered -> {
                // mirrors how controller ResponseEntity headers land on the response
                filtered.getResponse().getHeaders().put(HttpHeaders.LINK, List.of(up));
                return filtered.getResponse().setComplete();
            }))
            .verifyComplete();

        final HttpHeaders headers = exchange.getResponse().getHeaders();
        assertThat(headers.get(HttpHeaders.LINK)).containsExactly(
            up, "<https://acme.test/acme/directory>;rel=\"index\"");
        assertThat(headers.getFirst(AcmeResponseHeadersFilter.REPLAY_NONCE)).isEqualTo("nonce-1");
        assertThat(headers.getCacheControl()).isEqualTo("no-store");
    }
}
