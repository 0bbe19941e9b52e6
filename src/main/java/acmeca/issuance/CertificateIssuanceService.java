package acmeca.issuance;

import acmeca.config.AppProperties;
import acmeca.model.IssuedCertificate;
import acmeca.model.Order;
import acmeca.model.ProblemType;
import acmeca.repository.CertificateRepository;
import acmeca.services.AcmeProblemException;
import java.io.IOException;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.AccessDescription;
import org.bouncycastle.asn1.x509.AuthorityInformationAccess;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.CRLDistPoint;
import org.bouncycastle.asn1.x509.DistributionPoint;
import org.bouncycastle.asn1.x509.DistributionPointName;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.springframework.stereotype.Service;

/**
 * Turns a finalized order and its CSR into a signed, persisted certificate.
 */
@Service
@Slf4j
public class CertificateIssuanceService {

    private static final int SERIAL_BYTES = 20;
    private static final int MAX_SERIAL_ATTEMPTS = 5;
    private static final int MAX_CN_LENGTH = 64;

    private final CertificateAuthority certificateAuthority;
    private final CertificateRepository certificateRepository;
    private final AppProperties appProperties;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public CertificateIssuanceService(CertificateAuthority certificateAuthority,
        CertificateRepository certificateRepository,
        AppProperties appProperties,
        Clock clock
    ) {
        this.certificateAuthority = certificateAuthority;
        this.certificateRepository = certificateRepository;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    /**
     * Checks the CSR without touching any state, so that the client can fix an unusable CSR and finalize again.
     */
    public void checkRequest(PKCS10CertificationRequest csr) {
        CertificateRequests.verifySignature(csr);
        CertificateRequests.checkKey(csr, appProperties.issuance().minRsaKeySize());
    }

    /**
     * @param order       order in processing state
     * @param identifiers DNS names authorized for the order, as requested
     * @throws AcmeProblemException with {@code badCSR} when the CSR does not match the order
     */
    public IssuedCertificate issue(Order order, List<String> identifiers, PKCS10CertificationRequest csr) {
        checkRequest(csr);

        final Set<String> requested = CertificateRequests.requestedNames(csr);
        final Set<String> authorized = new TreeSet<>(identifiers);
        if (!requested.equals(authorized)) {
            final Set<String> unexpected = new TreeSet<>(requested);
            unexpected.removeAll(authorized);
            final Set<String> missing = new TreeSet<>(authorized);
            missing.removeAll(requested);
            throw new AcmeProblemException(ProblemType.BAD_CSR,
                "CSR names do not match the order, unexpected=" + unexpected + " missing=" + missing);
        }

        final Instant now = clock.instant();
        final Instant notBefore = order.notBefore() != null ? order.notBefore() : now;
        Instant notAfter = order.notAfter() != null ? order.notAfter()
            : now.plus(appProperties.issuance().defaultValidity());
        if (notAfter.isAfter(certificateAuthority.notAfter())) {
            notAfter = certificateAuthority.notAfter();
        }

        final BigInteger serial = nextSerial();
        final List<String> names = List.copyOf(authorized);
        final X509Certificate certificate = sign(serial, names, csr.getSubjectPublicKeyInfo(), notBefore, notAfter);

        final IssuedCertificate issued = IssuedCertificate.builder()
            .serial(serial.toString(16))
            .accountId(order.accountId())
            .orderId(order.id())
            .subject(certificate.getSubjectX500Principal().getName())
            .notBefore(notBefore)
            .notAfter(notAfter)
            .pem(Pems.write(certificate))
            .build();
        certificateRepository.insert(issued);
        log.info("Issued certificate serial={} for order={} names={} notAfter={}",
            issued.serial(), order.id(), names, notAfter);
        return issued;
    }

    /**
     * @param serial hex serial as used in certificate URLs
     */
    public IssuedCertificate findCertificate(String serial) {
        return certificateRepository.findBySerial(serial.toLowerCase(Locale.ROOT))
            .orElseThrow(() -> AcmeProblemException.notFound("No certificate with serial " + serial));
    }

    /**
     * @return the leaf certificate followed by the CA certificate
     */
    public String certificateChain(IssuedCertificate certificate) {
        return certificate.pem() + certificateAuthority.certificatePem();
    }

    BigInteger nextSerial() {
        for (int attempt = 0; attempt < MAX_SERIAL_ATTEMPTS; attempt++) {
            final byte[] bytes = new byte[SERIAL_BYTES];
            random.nextBytes(bytes);
            // keep the DER encoding within 20 octets
            bytes[0] &= 0x7f;
            final BigInteger serial = new BigInteger(1, bytes);
            if (serial.signum() > 0 && !certificateRepository.existsBySerial(serial.toString(16))) {
                return serial;
            }
        }
        throw new IllegalStateException("Unable to find an unused serial number");
    }

    private X509Certificate sign(BigInteger serial, List<String> names, SubjectPublicKeyInfo publicKey,
        Instant notBefore, Instant notAfter
    ) {
        final String commonName = names.stream()
            .filter(name -> name.length() <= MAX_CN_LENGTH)
            .findFirst()
            .orElse(null);
        final X500Name subject = commonName != null ?
            new X500NameBuilder(BCStyle.INSTANCE).addRDN(BCStyle.CN, commonName).build()
            : new X500Name(new RDN[0]);

        final X509v3CertificateBuilder builder = new X509v3CertificateBuilder(
            certificateAuthority.subject(),
            serial,
            Date.from(notBefore),
            Date.from(notAfter),
            subject,
            publicKey
        );

        try {
            final JcaX509ExtensionUtils extensionUtils = CertificateAuthority.extensionUtils();
            final boolean rsa = PKCSObjectIdentifiers.rsaEncryption.equals(publicKey.getAlgorithm().getAlgorithm());

            // without a subject the SAN extension has to be critical, RFC 5280 Sec 4.2.1.6
            builder.addExtension(Extension.subjectAlternativeName, commonName == null, new GeneralNames(
                names.stream()
                    .map(name -> new GeneralName(GeneralName.dNSName, name))
                    .toArray(GeneralName[]::new)
            ));
            builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
            builder.addExtension(Extension.keyUsage, true,
                new KeyUsage(rsa ? KeyUsage.digitalSignature | KeyUsage.keyEncipherment : KeyUsage.digitalSignature));
            builder.addExtension(Extension.extendedKeyUsage, false, new ExtendedKeyUsage(KeyPurposeId.id_kp_serverAuth));
            builder.addExtension(Extension.subjectKeyIdentifier, false,
                extensionUtils.createSubjectKeyIdentifier(publicKey));
            builder.addExtension(Extension.authorityKeyIdentifier, false,
                extensionUtils.createAuthorityKeyIdentifier(certificateAuthority.certificate()));

            if (appProperties.revocation().crlUrl() != null) {
                final GeneralNames crlNames = new GeneralNames(
                    new GeneralName(GeneralName.uniformResourceIdentifier, appProperties.revocation().crlUrl().toString()));
                builder.addExtension(Extension.cRLDistributionPoints, false, new CRLDistPoint(new DistributionPoint[]{
                    new DistributionPoint(new DistributionPointName(crlNames), null, null)
                }));
            }
            if (appProperties.revocation().ocspUrl() != null) {
                builder.addExtension(Extension.authorityInfoAccess, false, new AuthorityInformationAccess(
                    AccessDescription.id_ad_ocsp,
                    new GeneralName(GeneralName.uniformResourceIdentifier, appProperties.revocation().ocspUrl().toString())
                ));
            }
        } catch (IOException | CertificateEncodingException e) {
            throw new IllegalStateException("Failed to build certificate extensions", e);
        }

        final X509CertificateHolder holder = builder.build(certificateAuthority.signer());
        return Pems.toCertificate(holder);
    }
}
