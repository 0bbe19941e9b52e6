package acmeca.model;

import java.time.Instant;
import lombok.Builder;

/**
 * @param fingerprint digest over the revoked entries the CRL was built from
 * @param der         DER encoded CRL
 */
@Builder
public record CrlRecord(
    long crlNumber,
    Instant thisUpdate,
    Instant nextUpdate,
    String fingerprint,
    byte[] der
) {

}
