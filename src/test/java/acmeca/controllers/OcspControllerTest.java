package acmeca.controllers;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Base64;
import org.junit.jupiter.api.Test;

class OcspControllerTest {

    // 0xfb 0xff encodes to "+/8=" in standard base64
    private static final byte[] REQUEST = {0x30, (byte) 0xfb, (byte) 0xff};

    @Test
    void decodesStandardBase64WithSlashes() {
        final String encoded = Base64.getEncoder().encodeToString(REQUEST);
        assertThat(encoded).contains("/");

        assertThat(OcspController.decode("/" + encoded)).isEqualTo(REQUEST);
    }

    @Test
    void decodesUrlSafeBase64() {
        assertThat(OcspController.decode(Base64.getUrlEncoder().encodeToString(REQUEST))).isEqualTo(REQUEST);
    }

    @Test
    void invalidBase64GivesEmptyRequest() {
        assertThat(OcspController.decode("/not*base64")).isEmpty();
    }
}
