package acmeca.revocation;

import static org.assertj.core.api.Assertions.assertThat;

import acmeca.config.AppProperties;
import acmeca.issuance.CertificateAuthority;
import acmeca.issuance.CertificateIssuanceService;
import acmeca.model.CrlRecord;
import acmeca.model.IssuedCertificate;
import acmeca.model.RevocationReason;
import acmeca.repository.CertificateRepository;
import acmeca.repository.CrlRepository;
import acmeca.support.TestCertificates;
import acmeca.support.TestKeys;
import java.math.BigInteger;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.cert.X509CRLEntryHolder;
import org.bouncycastle.cert.X509CRLHolder;
import org.bouncycastle.operator.jcajce.JcaContentVerifierProviderBuilder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:crl-service;DB_CLOSE_DELAY=-1")
class CrlServiceTest {

    @Autowired
    CrlService crlService;

    @Autowired
    CrlRepository crlRepository;

    @Autowired
    CertificateIssuanceService issuanceService;

    @Autowired
    CertificateRepository certificateRepository;

    @Autowired
    CertificateAuthority certificateAuthority;

    @Autowired
    AppProperties appProperties;

    @Test
    void rerunWithoutChangesKeepsStoredCrl() {
        final Instant now = Instant.now();
        final CrlRecord first = crlService.cacheCrl(now);

        final CrlRecord second = crlService.cacheCrl(now.plus(1, ChronoUnit.MINUTES));

        assertThat(second.crlNumber()).isEqualTo(first.crlNumber());
        assertThat(second.der()).isEqualTo(first.der());
        assertThat(crlService.currentCrl().der()).isEqualTo(first.der());
    }

    @Test
    void revocationProducesNextCrlNumber() throws Exception {
        final Instant now = Instant.now();
        final CrlRecord before = crlService.cacheCrl(now);
        final IssuedCertificate issued = TestCertificates.issue(issuanceService, "crl-owner",
            TestKeys.rsaKeyPair(2048), "crl.example.test");
        certificateRepository.revoke(issued.serial(), now, RevocationReason.SUPERSEDED);

        final CrlRecord after = crlService.cacheCrl(now.plusSeconds(1));

        assertThat(after.crlNumber()).isEqualTo(before.crlNumber() + 1);
        assertThat(after.fingerprint()).isNotEqualTo(before.fingerprint());
        assertThat(crlRepository.findLatest()).get()
            .extracting(CrlRecord::crlNumber).isEqualTo(after.crlNumber());

        final X509CRLHolder crl = new X509CRLHolder(after.der());
        assertThat(crl.isSignatureValid(new JcaContentVerifierProviderBuilder().build(certificateAuthority.certificate())))
            .isTrue();
        assertThat(crl.getIssuer()).isEqualTo(certificateAuthority.subject());
        final X509CRLEntryHolder entry = crl.getRevokedCertificate(new BigInteger(issued.serial(), 16));
        assertThat(entry).isNotNull();
        assertThat(entry.getExtensions().getExtension(Extension.reasonCode)).isNotNull();
        assertThat(crl.getExtension(Extension.cRLNumber)).isNotNull();
    }

    @Test
    void unchangedCrlIsRefreshedBeforeNextUpdate() {
        final CrlRecord current = crlService.cacheCrl(Instant.now());
        final AppProperties.Revocation revocation = appProperties.revocation();

        final Instant dueAt = current.nextUpdate().minus(revocation.crlRefreshBefore()).plusSeconds(1);
        final CrlRecord refreshed = crlService.cacheCrl(dueAt);

        assertThat(refreshed.crlNumber()).isEqualTo(current.crlNumber() + 1);
        assertThat(refreshed.fingerprint()).isEqualTo(current.fingerprint());
        assertThat(refreshed.nextUpdate()).isAfter(current.nextUpdate());
    }

    @Test
    void fingerprintIgnoresEntryOrder() {
        final IssuedCertificate first = revoked("0a", RevocationReason.KEY_COMPROMISE);
        final IssuedCertificate second = revoked("0b", RevocationReason.UNSPECIFIED);

        assertThat(CrlService.fingerprint(List.of(first, second)))
            .isEqualTo(CrlService.fingerprint(List.of(second, first)))
            .isNotEqualTo(CrlService.fingerprint(List.of(first)))
            .isNotEqualTo(CrlService.fingerprint(List.of(first, revoked("0b", RevocationReason.SUPERSEDED))));
    }

    private static IssuedCertificate revoked(String serial, RevocationReason reason) {
        return IssuedCertificate.builder()
            .serial(serial)
            .revokedAt(Instant.ofEpochSecond(1_700_000_000L))
            .revocationReason(reason)
            .build();
    }
}
