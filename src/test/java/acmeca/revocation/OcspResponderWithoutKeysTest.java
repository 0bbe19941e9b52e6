package acmeca.revocation;

import static org.assertj.core.api.Assertions.assertThat;

import acmeca.issuance.CertificateAuthority;
import java.math.BigInteger;
import org.bouncycastle.cert.ocsp.CertificateID;
import org.bouncycastle.cert.ocsp.OCSPReqBuilder;
import org.bouncycastle.cert.ocsp.OCSPResp;
import org.bouncycastle.operator.jcajce.JcaDigestCalculatorProviderBuilder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:ocsp-no-keys;DB_CLOSE_DELAY=-1")
class OcspResponderWithoutKeysTest {

    @Autowired
    OcspResponderService responderService;

    @Autowired
    CertificateAuthority certificateAuthority;

    @Test
    void answersTryLaterUntilKeysAreGenerated() throws Exception {
        final CertificateID id = new CertificateID(
            new JcaDigestCalculatorProviderBuilder().build().get(CertificateID.HASH_SHA1),
            certificateAuthority.certificateHolder(),
            BigInteger.TEN);
        final byte[] request = new OCSPReqBuilder().addRequest(id).build().getEncoded();

        final OCSPResp response = new OCSPResp(responderService.respond(request));

        assertThat(response.getStatus()).isEqualTo(OCSPResp.TRY_LATER);
    }
}
