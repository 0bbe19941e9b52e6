package acmeca.housekeeping;

import acmeca.config.AppProperties;
import acmeca.repository.NonceRepository;
import acmeca.repository.OrderRepository;
import java.time.Instant;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Removes expired protocol state. Authorizations and challenges go with their order; issued certificates are never
 * removed.
 */
@Service
@Slf4j
public class AcmeCleanupService {

    private final NonceRepository nonceRepository;
    private final OrderRepository orderRepository;
    private final AppProperties appProperties;

    public AcmeCleanupService(NonceRepository nonceRepository,
        OrderRepository orderRepository,
        AppProperties appProperties
    ) {
        this.nonceRepository = nonceRepository;
        this.orderRepository = orderRepository;
        this.appProperties = appProperties;
    }

    @Builder
    public record CleanupResult(
        int nonces,
        int orders
    ) {}

    public CleanupResult cleanup(Instant now) {
        final int nonces = nonceRepository.deleteIssuedBefore(now.minus(appProperties.nonceLifetime()));
        final int orders = orderRepository.deleteExpiredBefore(now);
        if (nonces > 0 || orders > 0) {
            log.info("Cleaned up expired nonces={} orders={}", nonces, orders);
        }
        return CleanupResult.builder()
            .nonces(nonces)
            .orders(orders)
            .build();
    }
}
