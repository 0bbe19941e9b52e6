package acmeca.issuance;

import acmeca.config.AppProperties;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.security.interfaces.RSAPrivateKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Signing key and certificate of the CA that issues certificates, CRLs and OCSP responder certificates.
 */
@Component
@Slf4j
public class CertificateAuthority {

    private static final Duration GENERATED_CA_VALIDITY = Duration.ofDays(3650);

    private final X509Certificate certificate;
    private final PrivateKey privateKey;
    private final String certificatePem;

    public CertificateAuthority(AppProperties appProperties, Clock clock) {
        final AppProperties.Ca ca = appProperties.ca();
        if (ca.certificate() != null && ca.privateKey() != null) {
            this.certificate = loadCertificate(ca.certificate());
            this.privateKey = loadPrivateKey(ca.privateKey());
            log.info("Loaded CA certificate subject={}", certificate.getSubjectX500Principal().getName());
        }
        else if (ca.certificate() != null || ca.privateKey() != null) {
            throw new IllegalStateException("Both acme.ca.certificate and acme.ca.private-key must be configured");
        }
        else {
            final KeyPair keyPair = generateRsaKeyPair(2048);
            this.privateKey = keyPair.getPrivate();
            this.certificate = selfSign(keyPair, new X500Name(ca.generatedSubject()), clock.instant());
            log.warn("No CA key material configured, generated a self-signed CA with subject={}. "
                + "Certificates issued by it will not survive a restart.", ca.generatedSubject());
        }
        this.certificatePem = Pems.write(certificate);
    }

    public X509Certificate certificate() {
        return certificate;
    }

    public X509CertificateHolder certificateHolder() {
        try {
            return new JcaX509CertificateHolder(certificate);
        } catch (CertificateEncodingException e) {
            throw new IllegalStateException("Unable to encode CA certificate", e);
        }
    }

    public String certificatePem() {
        return certificatePem;
    }

    public X500Name subject() {
        return X500Name.getInstance(certificate.getSubjectX500Principal().getEncoded());
    }

    public Instant notAfter() {
        return certificate.getNotAfter().toInstant();
    }

    public String signatureAlgorithm() {
        return privateKey instanceof RSAPrivateKey ? "SHA256withRSA" : "SHA256withECDSA";
    }

    public ContentSigner signer() {
        try {
            return new JcaContentSignerBuilder(signatureAlgorithm()).build(privateKey);
        } catch (OperatorCreationException e) {
            throw new IllegalStateException("Trying to create CA signer", e);
        }
    }

    public static JcaX509ExtensionUtils extensionUtils() {
        try {
            return new JcaX509ExtensionUtils();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to find SHA-1 for key identifiers", e);
        }
    }

    public static KeyPair generateRsaKeyPair(int keySize) {
        final KeyPairGenerator keyPairGenerator;
        try {
            keyPairGenerator = KeyPairGenerator.getInstance("RSA");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to find RSA key pair algorithm", e);
        }
        keyPairGenerator.initialize(keySize);
        return keyPairGenerator.generateKeyPair();
    }

    private static X509Certificate selfSign(KeyPair keyPair, X500Name subject, Instant now) {
        final X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
            subject,
            BigInteger.valueOf(now.toEpochMilli()),
            Date.from(now.minus(Duration.ofMinutes(5))),
            Date.from(now.plus(GENERATED_CA_VALIDITY)),
            subject,
            keyPair.getPublic()
        );
        try {
            final JcaX509ExtensionUtils extensionUtils = extensionUtils();
            builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(true));
            builder.addExtension(Extension.keyUsage, true,
                new KeyUsage(KeyUsage.keyCertSign | KeyUsage.cRLSign | KeyUsage.digitalSignature));
            builder.addExtension(Extension.subjectKeyIdentifier, false,
                extensionUtils.createSubjectKeyIdentifier(keyPair.getPublic()));
            final ContentSigner signer = new JcaContentSignerBuilder("SHA256withRSA").build(keyPair.getPrivate());
            return Pems.toCertificate(builder.build(signer));
        } catch (CertIOException | OperatorCreationException e) {
            throw new IllegalStateException("Failed to generate self-signed CA certificate", e);
        }
    }

    private static X509Certificate loadCertificate(Resource resource) {
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            return Pems.readCertificate(reader);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read CA certificate from " + resource, e);
        }
    }

    private static PrivateKey loadPrivateKey(Resource resource) {
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            return Pems.readPrivateKey(reader);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read CA private key from " + resource, e);
        }
    }
}
