package acmeca.services;

import acmeca.config.AppProperties;
import java.net.URI;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Builds the absolute resource URLs clients see. All of them hang off the configured base URL since the server runs
 * behind a reverse proxy and never sees the client-facing host itself.
 */
@Component
public class AcmeUrls {

    public static final String ACCOUNT_PATH = "/account/";
    public static final String ORDER_PATH = "/order/";
    public static final String AUTHZ_PATH = "/authz/";
    public static final String CHALLENGE_PATH = "/challenge/";
    public static final String CERT_PATH = "/cert/";

    private final String base;

    public AcmeUrls(AppProperties appProperties) {
        final String configured = appProperties.baseUrl().toString();
        this.base = configured.endsWith("/") ? configured.substring(0, configured.length() - 1) : configured;
    }

    /**
     * @param path request path as routed inside this application, such as {@code /new-order}
     */
    public URI resolve(String path) {
        return URI.create(base + path);
    }

    public URI directory() {
        return resolve("/directory");
    }

    public URI newNonce() {
        return resolve("/new-nonce");
    }

    public URI newAccount() {
        return resolve("/new-account");
    }

    public URI newOrder() {
        return resolve("/new-order");
    }

    public URI revokeCert() {
        return resolve("/revoke-cert");
    }

    public URI account(String accountId) {
        return resolve(ACCOUNT_PATH + accountId);
    }

    public URI accountOrders(String accountId) {
        return resolve(ACCOUNT_PATH + accountId + "/orders");
    }

    public URI order(String orderId) {
        return resolve(ORDER_PATH + orderId);
    }

    public URI finalizeOrder(String orderId) {
        return resolve(ORDER_PATH + orderId + "/finalize");
    }

    public URI authorization(String authorizationId) {
        return resolve(AUTHZ_PATH + authorizationId);
    }

    public URI challenge(String challengeId) {
        return resolve(CHALLENGE_PATH + challengeId);
    }

    public URI certificate(String serial) {
        return resolve(CERT_PATH + serial);
    }

    /**
     * Extracts the account id from a JWS {@code kid}, which is the account URL.
     */
    public Optional<String> accountIdFromKid(String kid) {
        final String prefix = base + ACCOUNT_PATH;
        if (kid == null || !kid.startsWith(prefix)) {
            return Optional.empty();
        }
        final String id = kid.substring(prefix.length());
        return id.isEmpty() || id.contains("/") ? Optional.empty() : Optional.of(id);
    }
}
