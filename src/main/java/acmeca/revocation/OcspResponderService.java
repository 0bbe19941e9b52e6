package acmeca.revocation;

import acmeca.config.AppProperties;
import acmeca.issuance.CertificateAuthority;
import acmeca.model.IssuedCertificate;
import acmeca.repository.CertificateRepository;
import acmeca.revocation.OcspKeyService.ResponderKey;
import java.io.IOException;
import java.security.cert.CertificateEncodingException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.ocsp.OCSPObjectIdentifiers;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.Extensions;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateHolder;
import org.bouncycastle.cert.ocsp.BasicOCSPResp;
import org.bouncycastle.cert.ocsp.BasicOCSPRespBuilder;
import org.bouncycastle.cert.ocsp.CertificateID;
import org.bouncycastle.cert.ocsp.CertificateStatus;
import org.bouncycastle.cert.ocsp.OCSPException;
import org.bouncycastle.cert.ocsp.OCSPReq;
import org.bouncycastle.cert.ocsp.OCSPRespBuilder;
import org.bouncycastle.cert.ocsp.Req;
import org.bouncycastle.cert.ocsp.RespID;
import org.bouncycastle.cert.ocsp.RevokedStatus;
import org.bouncycastle.cert.ocsp.UnknownStatus;
import org.bouncycastle.cert.ocsp.jcajce.JcaBasicOCSPRespBuilder;
import org.bouncycastle.operator.DigestCalculatorProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.operator.jcajce.JcaDigestCalculatorProviderBuilder;
import org.springframework.stereotype.Service;

/**
 * Answers OCSP requests (RFC 6960) for certificates of this CA, signed by the current delegated responder key.
 */
@Service
@Slf4j
public class OcspResponderService {

    private final OcspKeyService keyService;
    private final CertificateRepository certificateRepository;
    private final CertificateAuthority certificateAuthority;
    private final AppProperties appProperties;
    private final Clock clock;

    public OcspResponderService(OcspKeyService keyService,
        CertificateRepository certificateRepository,
        CertificateAuthority certificateAuthority,
        AppProperties appProperties,
        Clock clock
    ) {
        this.keyService = keyService;
        this.certificateRepository = certificateRepository;
        this.certificateAuthority = certificateAuthority;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    /**
     * @param requestDer DER encoded OCSPRequest
     * @return DER encoded OCSPResponse, which carries an error status rather than failing
     */
    public byte[] respond(byte[] requestDer) {
        final OCSPReq request;
        try {
            request = new OCSPReq(requestDer);
        } catch (IOException | RuntimeException e) {
            log.debug("Unparseable OCSP request", e);
            return errorResponse(OCSPRespBuilder.MALFORMED_REQUEST);
        }

        final Instant now = clock.instant();
        final Optional<ResponderKey> responderKey = keyService.responderKey(now);
        if (responderKey.isEmpty()) {
            log.warn("No valid OCSP responder key, answering tryLater");
            return errorResponse(OCSPRespBuilder.TRY_LATER);
        }

        try {
            final DigestCalculatorProvider digestProvider = new JcaDigestCalculatorProviderBuilder().build();
            final X509CertificateHolder issuer = certificateAuthority.certificateHolder();
            final BasicOCSPRespBuilder builder = new JcaBasicOCSPRespBuilder(
                responderKey.get().certificate().getPublicKey(), digestProvider.get(RespID.HASH_SHA1));

            final Date thisUpdate = Date.from(now.truncatedTo(ChronoUnit.SECONDS));
            final Date nextUpdate = Date.from(now.truncatedTo(ChronoUnit.SECONDS)
                .plus(appProperties.revocation().ocspResponseValidity()));
            for (Req req : request.getRequestList()) {
                final CertificateID id = req.getCertID();
                builder.addResponse(id, statusOf(id, issuer, digestProvider), thisUpdate, nextUpdate, null);
            }

            final Extension nonce = request.getExtension(OCSPObjectIdentifiers.id_pkix_ocsp_nonce);
            if (nonce != null) {
                builder.setResponseExtensions(new Extensions(nonce));
            }

            final BasicOCSPResp basicResponse = builder.build(
                new JcaContentSignerBuilder("SHA256withRSA").build(responderKey.get().privateKey()),
                new X509CertificateHolder[]{new JcaX509CertificateHolder(responderKey.get().certificate())},
                thisUpdate
            );
            return new OCSPRespBuilder().build(OCSPRespBuilder.SUCCESSFUL, basicResponse).getEncoded();
        } catch (OCSPException | OperatorCreationException | CertificateEncodingException | IOException e) {
            log.error("Failed to build OCSP response", e);
            return errorResponse(OCSPRespBuilder.INTERNAL_ERROR);
        }
    }

    private CertificateStatus statusOf(CertificateID id, X509CertificateHolder issuer,
        DigestCalculatorProvider digestProvider
    ) throws OCSPException {
        if (!id.matchesIssuer(issuer, digestProvider)) {
            return new UnknownStatus();
        }
        final Optional<IssuedCertificate> certificate =
            certificateRepository.findBySerial(id.getSerialNumber().toString(16));
        if (certificate.isEmpty()) {
            log.debug("OCSP request for unknown serial={}", id.getSerialNumber().toString(16));
            return new UnknownStatus();
        }
        if (certificate.get().isRevoked()) {
            return new RevokedStatus(Date.from(certificate.get().revokedAt()),
                certificate.get().revocationReason().code());
        }
        return CertificateStatus.GOOD;
    }

    private static byte[] errorResponse(int status) {
        try {
            return new OCSPRespBuilder().build(status, null).getEncoded();
        } catch (OCSPException | IOException e) {
            throw new IllegalStateException("Failed to encode OCSP error response", e);
        }
    }
}
