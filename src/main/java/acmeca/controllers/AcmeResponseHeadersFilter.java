package acmeca.controllers;

import acmeca.jws.NonceService;
import acmeca.services.AcmeUrls;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Adds the headers every ACME response carries, problem documents included:
 * a fresh {@code Replay-Nonce}, {@code Cache-Control: no-store} and, outside the directory, a link to the directory.
 */
@Component
public class AcmeResponseHeadersFilter implements WebFilter {

    public static final String REPLAY_NONCE = "Replay-Nonce";

    private static final String DIRECTORY = "directory";
    private static final Set<String> ACME_RESOURCES = Set.of(
        DIRECTORY, "new-nonce", "new-account", "account", "new-order", "order", "authz", "challenge", "cert",
        "revoke-cert"
    );

    private final NonceService nonceService;
    private final AcmeUrls acmeUrls;

    public AcmeResponseHeadersFilter(NonceService nonceService, AcmeUrls acmeUrls) {
        this.nonceService = nonceService;
        this.acmeUrls = acmeUrls;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        final String resource = firstSegment(exchange.getRequest().getPath().pathWithinApplication().value());
        if (!ACME_RESOURCES.contains(resource)) {
            return chain.filter(exchange);
        }

        final ServerHttpResponse response = exchange.getResponse();
        response.beforeCommit(() -> Mono.fromCallable(nonceService::issue)
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(nonce -> {
                final HttpHeaders headers = response.getHeaders();
                headers.set(REPLAY_NONCE, nonce);
                headers.setCacheControl(CacheControl.noStore());
                if (!DIRECTORY.equals(resource)) {
                    // values set from a ResponseEntity are read-only
                    final List<String> links = new ArrayList<>(headers.getOrEmpty(HttpHeaders.LINK));
                    links.add(link(acmeUrls.directory(), "index"));
                    headers.put(HttpHeaders.LINK, links);
                }
            })
            .then()
        );
        return chain.filter(exchange);
    }

    public static String link(URI target, String rel) {
        return "<" + target + ">;rel=\"" + rel + "\"";
    }

    static String firstSegment(String path) {
        final int start = path.startsWith("/") ? 1 : 0;
        final int end = path.indexOf('/', start);
        return end < 0 ? path.substring(start) : path.substring(start, end);
    }
}
