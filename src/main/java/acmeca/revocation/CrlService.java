package acmeca.revocation;

import acmeca.config.AppProperties;
import acmeca.issuance.CertificateAuthority;
import acmeca.model.CrlRecord;
import acmeca.model.IssuedCertificate;
import acmeca.repository.CertificateRepository;
import acmeca.repository.CrlRepository;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.cert.CertificateEncodingException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.x509.CRLNumber;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.cert.X509CRLHolder;
import org.bouncycastle.cert.X509v2CRLBuilder;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Maintains the CA's certificate revocation list.
 * <p>
 * A new CRL is only signed when the set of revoked, unexpired certificates changed or the current one approaches its
 * nextUpdate. Otherwise the stored CRL is kept, so repeated runs publish identical bytes.
 */
@Service
@Slf4j
public class CrlService {

    private final CrlRepository crlRepository;
    private final CertificateRepository certificateRepository;
    private final CertificateAuthority certificateAuthority;
    private final AppProperties appProperties;
    private final Clock clock;

    public CrlService(CrlRepository crlRepository,
        CertificateRepository certificateRepository,
        CertificateAuthority certificateAuthority,
        AppProperties appProperties,
        Clock clock
    ) {
        this.crlRepository = crlRepository;
        this.certificateRepository = certificateRepository;
        this.certificateAuthority = certificateAuthority;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    /**
     * @return the CRL in effect after this run
     */
    public CrlRecord cacheCrl(Instant now) {
        final AppProperties.Revocation revocation = appProperties.revocation();
        final Optional<CrlRecord> latest = crlRepository.findLatest();
        final List<IssuedCertificate> revoked = certificateRepository.findRevokedNotExpired(now);
        final String fingerprint = fingerprint(revoked);

        if (latest.isPresent()
            && latest.get().fingerprint().equals(fingerprint)
            && latest.get().nextUpdate().minus(revocation.crlRefreshBefore()).isAfter(now)) {
            log.debug("CRL number={} is current with {} entries", latest.get().crlNumber(), revoked.size());
            return latest.get();
        }

        final long crlNumber = latest.map(crl -> crl.crlNumber() + 1).orElse(1L);
        final Instant thisUpdate = now.truncatedTo(ChronoUnit.SECONDS);
        final Instant nextUpdate = thisUpdate.plus(revocation.crlValidity());
        final CrlRecord crl = CrlRecord.builder()
            .crlNumber(crlNumber)
            .thisUpdate(thisUpdate)
            .nextUpdate(nextUpdate)
            .fingerprint(fingerprint)
            .der(sign(crlNumber, thisUpdate, nextUpdate, revoked))
            .build();

        try {
            crlRepository.insert(crl);
        } catch (DuplicateKeyException e) {
            log.debug("CRL number={} was generated concurrently", crlNumber);
            return crlRepository.findLatest()
                .orElseThrow(() -> new IllegalStateException("CRL vanished after duplicate insert", e));
        }
        final int pruned = crlRepository.deleteOlderThan(crlNumber);
        log.info("Generated CRL number={} with {} entries, pruned {} older CRLs", crlNumber, revoked.size(), pruned);
        return crl;
    }

    /**
     * The CRL to publish, generating the first one when none exists yet.
     */
    public CrlRecord currentCrl() {
        return crlRepository.findLatest()
            .orElseGet(() -> cacheCrl(clock.instant()));
    }

    private byte[] sign(long crlNumber, Instant thisUpdate, Instant nextUpdate, List<IssuedCertificate> revoked) {
        final X509v2CRLBuilder builder = new X509v2CRLBuilder(certificateAuthority.subject(), Date.from(thisUpdate));
        builder.setNextUpdate(Date.from(nextUpdate));
        for (IssuedCertificate certificate : revoked) {
            builder.addCRLEntry(new BigInteger(certificate.serial(), 16),
                Date.from(certificate.revokedAt()),
                certificate.revocationReason().code());
        }
        try {
            builder.addExtension(Extension.cRLNumber, false, new CRLNumber(BigInteger.valueOf(crlNumber)));
            builder.addExtension(Extension.authorityKeyIdentifier, false,
                CertificateAuthority.extensionUtils().createAuthorityKeyIdentifier(certificateAuthority.certificate()));
            final X509CRLHolder crl = builder.build(certificateAuthority.signer());
            return crl.getEncoded();
        } catch (IOException | CertificateEncodingException e) {
            throw new IllegalStateException("Failed to generate CRL number " + crlNumber, e);
        }
    }

    /**
     * Digest over the revoked entries in serial order.
     */
    static String fingerprint(List<IssuedCertificate> revoked) {
        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
        revoked.stream()
            .map(certificate -> certificate.serial() + ":" + certificate.revokedAt().getEpochSecond() + ":"
                + certificate.revocationReason().code() + "\n")
            .sorted()
            .forEach(entry -> digest.update(entry.getBytes(StandardCharsets.UTF_8)));
        return HexFormat.of().formatHex(digest.digest());
    }
}
