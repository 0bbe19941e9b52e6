package acmeca.jws;

import acmeca.config.AppProperties;
import acmeca.repository.NonceRepository;
import acmeca.services.Ids;
import java.time.Clock;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Replay protection nonces of <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-6.5">RFC 8555 Sec 6.5</a>.
 * Nonces live in the datastore so that any instance behind the proxy can consume a nonce issued by another.
 */
@Service
@Slf4j
public class NonceService {

    private static final int NONCE_BYTES = 32;

    private final NonceRepository nonceRepository;
    private final AppProperties appProperties;
    private final Clock clock;

    public NonceService(NonceRepository nonceRepository, AppProperties appProperties, Clock clock) {
        this.nonceRepository = nonceRepository;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    public String issue() {
        final String nonce = Ids.randomBase64Url(NONCE_BYTES);
        nonceRepository.insert(nonce, clock.instant());
        return nonce;
    }

    /**
     * @return true exactly once per issued, unexpired nonce
     */
    public boolean consume(String nonce) {
        if (nonce == null || nonce.isBlank()) {
            return false;
        }
        final Instant notIssuedBefore = clock.instant().minus(appProperties.nonceLifetime());
        final boolean consumed = nonceRepository.consume(nonce, notIssuedBefore);
        if (!consumed) {
            log.debug("Rejected unknown or replayed nonce={}", nonce);
        }
        return consumed;
    }
}
