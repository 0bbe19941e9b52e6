package acmeca.model;

import java.time.Instant;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * Everything but the revocation fields is immutable; those are written at most once.
 *
 * @param serial lower-case hex serial number
 * @param pem    leaf certificate only, the chain is appended when served
 */
@Builder(toBuilder = true)
public record IssuedCertificate(
    String serial,
    String accountId,
    String orderId,
    String subject,
    Instant notBefore,
    Instant notAfter,
    String pem,
    @Nullable
    Instant revokedAt,
    @Nullable
    RevocationReason revocationReason
) {

    public boolean isRevoked() {
        return revokedAt != null;
    }
}
