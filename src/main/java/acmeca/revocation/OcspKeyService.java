package acmeca.revocation;

import acmeca.config.AppProperties;
import acmeca.issuance.CertificateAuthority;
import acmeca.issuance.Pems;
import acmeca.model.OcspResponderKey;
import acmeca.repository.OcspResponderKeyRepository;
import java.math.BigInteger;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.ocsp.OCSPObjectIdentifiers;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Rotates the delegated OCSP responder keys. A new key is generated ahead of the expiry of the newest one, and older
 * keys stay usable until their own expiry.
 */
@Service
@Slf4j
public class OcspKeyService {

    private static final int RESPONDER_KEY_SIZE = 2048;

    private final OcspResponderKeyRepository keyRepository;
    private final CertificateAuthority certificateAuthority;
    private final AppProperties appProperties;
    private final SecureRandom random = new SecureRandom();

    public OcspKeyService(OcspResponderKeyRepository keyRepository,
        CertificateAuthority certificateAuthority,
        AppProperties appProperties
    ) {
        this.keyRepository = keyRepository;
        this.certificateAuthority = certificateAuthority;
        this.appProperties = appProperties;
    }

    /**
     * @return the newly generated key, or empty when a key valid beyond the renewal window exists already
     */
    public Optional<OcspResponderKey> generateKeys(Instant now) {
        final AppProperties.Revocation revocation = appProperties.revocation();
        final Instant renewAt = now.plus(revocation.ocspKeyRenewBefore());

        final boolean current = keyRepository.findValidAt(now).stream()
            .anyMatch(key -> key.notAfter().isAfter(renewAt));
        if (current) {
            log.debug("OCSP responder key is current, nothing to generate");
            return Optional.empty();
        }

        final long generation = keyRepository.findLatest()
            .map(key -> key.generation() + 1)
            .orElse(1L);
        final Instant notBefore = now.truncatedTo(ChronoUnit.SECONDS);
        Instant notAfter = notBefore.plus(revocation.ocspKeyValidity());
        if (notAfter.isAfter(certificateAuthority.notAfter())) {
            notAfter = certificateAuthority.notAfter();
        }

        final KeyPair keyPair = CertificateAuthority.generateRsaKeyPair(RESPONDER_KEY_SIZE);
        final BigInteger serial = new BigInteger(159, random);
        final X509Certificate certificate = signResponderCertificate(keyPair, serial, generation, notBefore, notAfter);

        final OcspResponderKey key = OcspResponderKey.builder()
            .generation(generation)
            .serial(serial.toString(16))
            .notBefore(notBefore)
            .notAfter(notAfter)
            .certificatePem(Pems.write(certificate))
            .privateKeyPem(Pems.write(keyPair.getPrivate()))
            .build();
        try {
            keyRepository.insert(key);
        } catch (DuplicateKeyException e) {
            log.debug("OCSP responder key generation={} was created concurrently", generation);
            return Optional.empty();
        }

        final int pruned = keyRepository.deleteExpiredBefore(now);
        log.info("Generated OCSP responder key generation={} notAfter={}, pruned {} expired keys",
            generation, notAfter, pruned);
        return Optional.of(key);
    }

    /**
     * The newest responder key usable at {@code now}.
     */
    public Optional<ResponderKey> responderKey(Instant now) {
        return keyRepository.findValidAt(now).stream()
            .findFirst()
            .map(key -> new ResponderKey(
                Pems.readCertificate(key.certificatePem()),
                Pems.readPrivateKey(key.privateKeyPem())
            ));
    }

    public record ResponderKey(
        X509Certificate certificate,
        PrivateKey privateKey
    ) {}

    private X509Certificate signResponderCertificate(KeyPair keyPair, BigInteger serial, long generation,
        Instant notBefore, Instant notAfter
    ) {
        final X500Name subject = new X500NameBuilder(BCStyle.INSTANCE)
            .addRDN(BCStyle.CN, "OCSP Responder " + generation)
            .build();
        final X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
            certificateAuthority.subject(),
            serial,
            Date.from(notBefore),
            Date.from(notAfter),
            subject,
            keyPair.getPublic()
        );
        try {
            final JcaX509ExtensionUtils extensionUtils = CertificateAuthority.extensionUtils();
            builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
            builder.addExtension(Extension.keyUsage, true, new KeyUsage(KeyUsage.digitalSignature));
            builder.addExtension(Extension.extendedKeyUsage, false, new ExtendedKeyUsage(KeyPurposeId.id_kp_OCSPSigning));
            // responders are not checked for revocation themselves, RFC 6960 Sec 4.2.2.2.1
            builder.addExtension(OCSPObjectIdentifiers.id_pkix_ocsp_nocheck, false, DERNull.INSTANCE);
            builder.addExtension(Extension.subjectKeyIdentifier, false,
                extensionUtils.createSubjectKeyIdentifier(keyPair.getPublic()));
            builder.addExtension(Extension.authorityKeyIdentifier, false,
                extensionUtils.createAuthorityKeyIdentifier(certificateAuthority.certificate()));
        } catch (CertIOException | CertificateEncodingException e) {
            throw new IllegalStateException("Failed to build OCSP responder certificate extensions", e);
        }
        return Pems.toCertificate(builder.build(certificateAuthority.signer()));
    }
}
