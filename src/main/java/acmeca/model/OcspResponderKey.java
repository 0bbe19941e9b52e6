package acmeca.model;

import java.time.Instant;
import lombok.Builder;

/**
 * A delegated OCSP signing key and its CA-issued certificate.
 */
@Builder
public record OcspResponderKey(
    long generation,
    String serial,
    Instant notBefore,
    Instant notAfter,
    String certificatePem,
    String privateKeyPem
) {

    public boolean isValidAt(Instant instant) {
        return !notBefore.isAfter(instant) && notAfter.isAfter(instant);
    }
}
