package acmeca.validation;

import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Component
@Slf4j
public class WebClientHttpChallengeClient implements HttpChallengeClient {

    private final WebClient webClient;

    public WebClientHttpChallengeClient(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    @Override
    public Mono<HttpChallengeResponse> fetch(URI uri) {
        log.debug("Fetching http-01 resource uri={}", uri);
        return webClient.get()
            .uri(uri)
            .accept(MediaType.ALL)
            .exchangeToMono(response -> response.bodyToMono(byte[].class)
                .defaultIfEmpty(new byte[0])
                .map(body -> new HttpChallengeResponse(response.statusCode().value(), body))
            );
    }
}
