package acmeca.revocation;

import acmeca.issuance.CertificateAuthority;
import acmeca.issuance.Pems;
import acmeca.jws.AuthenticatedRequest;
import acmeca.messages.RevokeRequest;
import acmeca.model.IssuedCertificate;
import acmeca.model.ProblemType;
import acmeca.model.RevocationReason;
import acmeca.repository.CertificateRepository;
import acmeca.services.AcmeProblemException;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.AsymmetricJWK;
import java.io.IOException;
import java.security.PublicKey;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.cert.X509CertificateHolder;
import org.springframework.stereotype.Service;

/**
 * Certificate revocation as requested through
 * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.6">RFC 8555 Sec 7.6</a>.
 * Revocation is recorded exactly once and never undone.
 */
@Service
@Slf4j
public class RevocationService {

    private final CertificateRepository certificateRepository;
    private final CertificateAuthority certificateAuthority;
    private final Clock clock;

    public RevocationService(CertificateRepository certificateRepository,
        CertificateAuthority certificateAuthority,
        Clock clock
    ) {
        this.certificateRepository = certificateRepository;
        this.certificateAuthority = certificateAuthority;
        this.clock = clock;
    }

    /**
     * @param request signed either with the issuing account's key ({@code kid}) or with the certificate's key
     *                ({@code jwk})
     */
    public IssuedCertificate revoke(AuthenticatedRequest request, RevokeRequest payload) {
        final RevocationReason reason = parseReason(payload.reason());
        final X509CertificateHolder submitted = decodeCertificate(payload.certificate());

        if (!submitted.getIssuer().equals(certificateAuthority.subject())) {
            throw AcmeProblemException.malformed("Certificate was not issued by this CA");
        }
        final String serial = submitted.getSerialNumber().toString(16);
        final IssuedCertificate stored = certificateRepository.findBySerial(serial)
            .orElseThrow(() -> AcmeProblemException.malformed("Unknown certificate"));
        final X509Certificate issued = Pems.readCertificate(stored.pem());
        if (!sameEncoding(submitted, issued)) {
            log.warn("Revocation request for serial={} carried a certificate that differs from the issued one", serial);
            throw AcmeProblemException.malformed("Unknown certificate");
        }

        if (request.account() != null) {
            if (!request.account().id().equals(stored.accountId())) {
                log.warn("Account={} tried to revoke certificate serial={} of another account",
                    request.account().id(), serial);
                throw AcmeProblemException.unauthorized("Certificate was not issued to this account");
            }
        }
        else if (!signedWithCertificateKey(request, issued)) {
            throw AcmeProblemException.unauthorized("Request is not signed with the certificate's key");
        }

        if (stored.isRevoked()) {
            throw new AcmeProblemException(ProblemType.ALREADY_REVOKED, "Certificate is already revoked");
        }
        final Instant now = clock.instant();
        if (!certificateRepository.revoke(serial, now, reason)) {
            throw new AcmeProblemException(ProblemType.ALREADY_REVOKED, "Certificate is already revoked");
        }
        log.info("Revoked certificate serial={} reason={}", serial, reason);
        return stored.toBuilder()
            .revokedAt(now)
            .revocationReason(reason)
            .build();
    }

    static RevocationReason parseReason(Integer code) {
        if (code == null) {
            return RevocationReason.UNSPECIFIED;
        }
        try {
            return RevocationReason.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new AcmeProblemException(ProblemType.BAD_REVOCATION_REASON, "Unsupported revocation reason " + code, e);
        }
    }

    private static X509CertificateHolder decodeCertificate(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw AcmeProblemException.malformed("No certificate was provided");
        }
        try {
            return new X509CertificateHolder(Base64.getUrlDecoder().decode(encoded.trim()));
        } catch (IOException | IllegalArgumentException e) {
            throw new AcmeProblemException(ProblemType.MALFORMED, "Unable to parse certificate", e);
        }
    }

    private static boolean sameEncoding(X509CertificateHolder submitted, X509Certificate issued) {
        try {
            return Arrays.equals(submitted.getEncoded(), issued.getEncoded());
        } catch (IOException | CertificateEncodingException e) {
            log.debug("Unable to encode certificate for comparison", e);
            return false;
        }
    }

    private static boolean signedWithCertificateKey(AuthenticatedRequest request, X509Certificate certificate) {
        if (!(request.jwk() instanceof AsymmetricJWK asymmetric)) {
            return false;
        }
        try {
            final PublicKey publicKey = asymmetric.toPublicKey();
            return Arrays.equals(publicKey.getEncoded(), certificate.getPublicKey().getEncoded());
        } catch (JOSEException e) {
            log.debug("Unable to compare request key with certificate key", e);
            return false;
        }
    }
}
