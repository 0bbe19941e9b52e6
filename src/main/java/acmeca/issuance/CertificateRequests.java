package acmeca.issuance;

import acmeca.model.ProblemType;
import acmeca.services.AcmeProblemException;
import java.io.IOException;
import java.util.Base64;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.pkcs.Attribute;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.RSAPublicKey;
import org.bouncycastle.asn1.sec.SECObjectIdentifiers;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.Extensions;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.asn1.x9.X9ObjectIdentifiers;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentVerifierProviderBuilder;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.PKCSException;

/**
 * Parsing and policy checks of PKCS#10 certificate signing requests submitted on finalize.
 */
public final class CertificateRequests {

    private static final Set<ASN1ObjectIdentifier> ALLOWED_CURVES = Set.of(
        SECObjectIdentifiers.secp256r1,
        SECObjectIdentifiers.secp384r1
    );

    private CertificateRequests() {}

    /**
     * @param encoded base64url DER as carried in the finalize payload
     */
    public static PKCS10CertificationRequest decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new AcmeProblemException(ProblemType.BAD_CSR, "No CSR was provided");
        }
        final byte[] der;
        try {
            der = Base64.getUrlDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new AcmeProblemException(ProblemType.BAD_CSR, "CSR is not base64url encoded", e);
        }
        try {
            return new PKCS10CertificationRequest(der);
        } catch (IOException | RuntimeException e) {
            throw new AcmeProblemException(ProblemType.BAD_CSR, "Unable to parse CSR", e);
        }
    }

    public static void verifySignature(PKCS10CertificationRequest csr) {
        final boolean valid;
        try {
            valid = csr.isSignatureValid(new JcaContentVerifierProviderBuilder().build(csr.getSubjectPublicKeyInfo()));
        } catch (OperatorCreationException | PKCSException e) {
            throw new AcmeProblemException(ProblemType.BAD_CSR, "Unable to verify CSR signature", e);
        }
        if (!valid) {
            throw new AcmeProblemException(ProblemType.BAD_CSR, "CSR signature is invalid");
        }
    }

    /**
     * RSA keys need at least {@code minRsaKeySize} bits, EC keys must be on P-256 or P-384.
     */
    public static void checkKey(PKCS10CertificationRequest csr, int minRsaKeySize) {
        final SubjectPublicKeyInfo keyInfo = csr.getSubjectPublicKeyInfo();
        final ASN1ObjectIdentifier algorithm = keyInfo.getAlgorithm().getAlgorithm();

        if (PKCSObjectIdentifiers.rsaEncryption.equals(algorithm)) {
            final int bits;
            try {
                bits = RSAPublicKey.getInstance(keyInfo.parsePublicKey()).getModulus().bitLength();
            } catch (IOException | RuntimeException e) {
                throw new AcmeProblemException(ProblemType.BAD_CSR, "Unable to read RSA public key", e);
            }
            if (bits < minRsaKeySize) {
                throw new AcmeProblemException(ProblemType.BAD_CSR,
                    "RSA key of " + bits + " bits is too small, at least " + minRsaKeySize + " bits are required");
            }
        }
        else if (X9ObjectIdentifiers.id_ecPublicKey.equals(algorithm)) {
            final ASN1Encodable parameters = keyInfo.getAlgorithm().getParameters();
            if (!(parameters instanceof ASN1ObjectIdentifier curve) || !ALLOWED_CURVES.contains(curve)) {
                throw new AcmeProblemException(ProblemType.BAD_CSR, "EC keys must use the P-256 or P-384 curve");
            }
        }
        else {
            throw new AcmeProblemException(ProblemType.BAD_CSR, "Unsupported key algorithm " + algorithm.getId());
        }
    }

    /**
     * @return the lower-cased common name and DNS subject alternative names
     */
    public static Set<String> requestedNames(PKCS10CertificationRequest csr) {
        final Set<String> names = new TreeSet<>();

        for (RDN rdn : csr.getSubject().getRDNs(BCStyle.CN)) {
            names.add(IETFUtils.valueToString(rdn.getFirst().getValue()).toLowerCase(Locale.ROOT));
        }

        for (Attribute attribute : csr.getAttributes(PKCSObjectIdentifiers.pkcs_9_at_extensionRequest)) {
            for (ASN1Encodable value : attribute.getAttributeValues()) {
                final Extensions extensions = Extensions.getInstance(value);
                final GeneralNames sans = GeneralNames.fromExtensions(extensions, Extension.subjectAlternativeName);
                if (sans == null) {
                    continue;
                }
                for (GeneralName name : sans.getNames()) {
                    if (name.getTagNo() != GeneralName.dNSName) {
                        throw new AcmeProblemException(ProblemType.BAD_CSR,
                            "Only DNS names are allowed as subject alternative names");
                    }
                    names.add(((ASN1String) name.getName()).getString().toLowerCase(Locale.ROOT));
                }
            }
        }
        return names;
    }
}
