package acmeca.support;

import acmeca.controllers.AcmeResponseHeadersFilter;
import acmeca.jws.RequestAuthenticator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.jwk.JWK;
import java.net.URI;
import org.springframework.lang.Nullable;
import org.springframework.test.web.reactive.server.WebTestClient;

/**
 * Signs requests against the test application, which is configured with {@link #BASE_URL} and no base path.
 */
public class AcmeTestClient {

    public static final String BASE_URL = "https://acme.test/acme";

    private final WebTestClient webTestClient;
    private final ObjectMapper objectMapper;

    public AcmeTestClient(WebTestClient webTestClient, ObjectMapper objectMapper) {
        this.webTestClient = webTestClient;
        this.objectMapper = objectMapper;
    }

    public String nonce() {
        return webTestClient.head().uri("/new-nonce")
            .exchange()
            .expectStatus().isOk()
            .returnResult(Void.class)
            .getResponseHeaders()
            .getFirst(AcmeResponseHeadersFilter.REPLAY_NONCE);
    }

    /**
     * @param payload serialized as JSON, or null for POST-as-GET
     */
    public WebTestClient.ResponseSpec post(String path, JWK key, @Nullable String kid, @Nullable Object payload) {
        return post(path, key, kid, payload, nonce());
    }

    public WebTestClient.ResponseSpec post(String path, JWK key, @Nullable String kid, @Nullable Object payload,
        String nonce
    ) {
        return postSigned(path, sign(path, key, kid, payload, nonce));
    }

    public WebTestClient.ResponseSpec postSigned(String path, String jws) {
        return webTestClient.post().uri(path)
            .contentType(RequestAuthenticator.JOSE_JSON)
            .bodyValue(jws)
            .exchange();
    }

    public String sign(String path, JWK key, @Nullable String kid, @Nullable Object payload, String nonce) {
        final byte[] payloadBytes;
        try {
            payloadBytes = payload != null ? objectMapper.writeValueAsBytes(payload) : null;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize payload", e);
        }
        return JwsSigner.sign(key, kid, nonce, URI.create(BASE_URL + path), payloadBytes);
    }

    /**
     * @return the path of a resource URL handed out by the server, as routed in the test application
     */
    public static String pathOf(URI url) {
        final String value = url.toString();
        if (!value.startsWith(BASE_URL)) {
            throw new IllegalArgumentException(url + " is not below " + BASE_URL);
        }
        return value.substring(BASE_URL.length());
    }
}
