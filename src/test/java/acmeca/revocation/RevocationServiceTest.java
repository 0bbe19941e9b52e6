package acmeca.revocation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import acmeca.issuance.CertificateAuthority;
import acmeca.issuance.CertificateIssuanceService;
import acmeca.issuance.Pems;
import acmeca.jws.AuthenticatedRequest;
import acmeca.messages.RevokeRequest;
import acmeca.model.Account;
import acmeca.model.IssuedCertificate;
import acmeca.model.ProblemType;
import acmeca.model.RevocationReason;
import acmeca.repository.CertificateRepository;
import acmeca.services.AcmeProblemException;
import acmeca.support.TestCertificates;
import acmeca.support.TestKeys;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.RSAKey;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.cert.CertificateEncodingException;
import java.security.interfaces.RSAPublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class RevocationServiceTest {

    private static final byte[] PAYLOAD = "{}".getBytes(StandardCharsets.UTF_8);

    @Autowired
    RevocationService revocationService;

    @Autowired
    CertificateIssuanceService issuanceService;

    @Autowired
    CertificateRepository certificateRepository;

    @Autowired
    CertificateAuthority certificateAuthority;

    @Test
    void accountRevokesItsCertificateOnce() {
        final Account account = account("owner-1");
        final IssuedCertificate issued = TestCertificates.issue(issuanceService, account.id(),
            TestKeys.rsaKeyPair(2048), "revoke-once.example.test");

        final IssuedCertificate revoked = revocationService.revoke(byAccount(account), request(issued, 1));

        assertThat(revoked.revocationReason()).isEqualTo(RevocationReason.KEY_COMPROMISE);
        final IssuedCertificate stored = certificateRepository.findBySerial(issued.serial()).orElseThrow();
        assertThat(stored.isRevoked()).isTrue();
        assertThat(stored.revocationReason()).isEqualTo(RevocationReason.KEY_COMPROMISE);

        assertThatThrownBy(() -> revocationService.revoke(byAccount(account), request(issued, 4)))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.ALREADY_REVOKED);
        assertThat(certificateRepository.findBySerial(issued.serial()).orElseThrow().revocationReason())
            .isEqualTo(RevocationReason.KEY_COMPROMISE);
    }

    @Test
    void otherAccountsCannotRevoke() {
        final IssuedCertificate issued = TestCertificates.issue(issuanceService, "owner-2",
            TestKeys.rsaKeyPair(2048), "foreign.example.test");

        assertThatThrownBy(() -> revocationService.revoke(byAccount(account("intruder")), request(issued, null)))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.UNAUTHORIZED);
        assertThat(certificateRepository.findBySerial(issued.serial()).orElseThrow().isRevoked()).isFalse();
    }

    @Test
    void certificateKeyCanRevoke() {
        final KeyPair keyPair = TestKeys.rsaKeyPair(2048);
        final IssuedCertificate issued = TestCertificates.issue(issuanceService, "owner-3", keyPair,
            "key-holder.example.test");
        final JWK certificateKey = new RSAKey.Builder((RSAPublicKey) keyPair.getPublic()).build();

        final IssuedCertificate revoked = revocationService.revoke(byKey(certificateKey), request(issued, null));

        assertThat(revoked.revocationReason()).isEqualTo(RevocationReason.UNSPECIFIED);
    }

    @Test
    void unrelatedKeyCannotRevoke() {
        final IssuedCertificate issued = TestCertificates.issue(issuanceService, "owner-4",
            TestKeys.rsaKeyPair(2048), "unrelated.example.test");

        assertThatThrownBy(() -> revocationService.revoke(byKey(TestKeys.rsaAccountKey().toPublicJWK()),
            request(issued, null)))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.UNAUTHORIZED);
    }

    @Test
    void forgedCertificateWithIssuedSerialCannotRevoke() throws Exception {
        final IssuedCertificate issued = TestCertificates.issue(issuanceService, "owner-6",
            TestKeys.rsaKeyPair(2048), "victim.example.test");
        final KeyPair attackerKeys = TestKeys.rsaKeyPair(2048);
        final Instant now = Instant.now();
        final X509CertificateHolder forged = new JcaX509v3CertificateBuilder(
            certificateAuthority.subject(),
            new BigInteger(issued.serial(), 16),
            Date.from(now.minus(Duration.ofHours(1))),
            Date.from(now.plus(Duration.ofDays(1))),
            new X500Name("CN=victim.example.test"),
            attackerKeys.getPublic()
        ).build(new JcaContentSignerBuilder("SHA256withRSA").build(attackerKeys.getPrivate()));
        final JWK attackerKey = new RSAKey.Builder((RSAPublicKey) attackerKeys.getPublic()).build();
        final RevokeRequest forgedRequest = new RevokeRequest(
            Base64.getUrlEncoder().withoutPadding().encodeToString(forged.getEncoded()), null);

        assertThatThrownBy(() -> revocationService.revoke(byKey(attackerKey), forgedRequest))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.MALFORMED);
        assertThat(certificateRepository.findBySerial(issued.serial()).orElseThrow().isRevoked()).isFalse();
    }

    @Test
    void garbageCertificateIsMalformed() {
        assertThatThrownBy(() -> revocationService.revoke(byAccount(account("owner-5")),
            new RevokeRequest("bm90LWEtY2VydA", null)))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.MALFORMED);
    }

    @ParameterizedTest
    @ValueSource(ints = {7, 11, -1})
    void rejectsUndefinedReasons(int code) {
        assertThatThrownBy(() -> RevocationService.parseReason(code))
            .isInstanceOf(AcmeProblemException.class)
            .extracting("type").isEqualTo(ProblemType.BAD_REVOCATION_REASON);
    }

    @Test
    void missingReasonIsUnspecified() {
        assertThat(RevocationService.parseReason(null)).isEqualTo(RevocationReason.UNSPECIFIED);
        assertThat(RevocationService.parseReason(10)).isEqualTo(RevocationReason.AA_COMPROMISE);
    }

    private static Account account(String id) {
        return Account.builder().id(id).build();
    }

    private static AuthenticatedRequest byAccount(Account account) {
        return AuthenticatedRequest.builder()
            .account(account)
            .jwk(TestKeys.ecAccountKey().toPublicJWK())
            .payload(PAYLOAD)
            .build();
    }

    private static AuthenticatedRequest byKey(JWK key) {
        return AuthenticatedRequest.builder()
            .jwk(key)
            .payload(PAYLOAD)
            .build();
    }

    private static RevokeRequest request(IssuedCertificate issued, Integer reason) {
        try {
            final byte[] der = Pems.readCertificate(issued.pem()).getEncoded();
            return new RevokeRequest(Base64.getUrlEncoder().withoutPadding().encodeToString(der), reason);
        } catch (CertificateEncodingException e) {
            throw new IllegalStateException(e);
        }
    }
}
