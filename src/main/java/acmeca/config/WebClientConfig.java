package acmeca.config;

import io.netty.channel.ChannelOption;
import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import reactor.netty.http.client.HttpClient;

/**
 * Outbound HTTP used by http-01 validation.
 */
@Configuration
public class WebClientConfig {

    private final AppProperties appProperties;

    public WebClientConfig(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @Bean
    public WebClientCustomizer webClientCustomizer() {
        final AppProperties.Validation validation = appProperties.validation();
        return webClientBuilder -> webClientBuilder
            .clientConnector(
                new ReactorClientHttpConnector(
                    HttpClient.create()
                        .responseTimeout(validation.attemptTimeout())
                        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) validation.attemptTimeout().toMillis())
                        // RFC 8555 Sec 8.3 allows redirects
                        .followRedirect(true)
                )
            )
            .exchangeStrategies(
                ExchangeStrategies.builder()
                    .codecs(clientCodecConfigurer ->
                        clientCodecConfigurer.defaultCodecs().maxInMemorySize(validation.maxResponseSize())
                    )
                    .build()
            );
    }
}
