package acmeca.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * @param jwk        public account key as JSON
 * @param thumbprint RFC 7638 thumbprint of {@code jwk}, unique across accounts
 */
@Builder(toBuilder = true)
public record Account(
    String id,
    String jwk,
    String thumbprint,
    AccountStatus status,
    List<String> contacts,
    boolean termsOfServiceAgreed,
    Instant createdAt
) {

}
