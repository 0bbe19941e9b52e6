package acmeca.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.skyscreamer.jsonassert.JSONCompareMode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.JsonTest;
import org.springframework.boot.test.json.JacksonTester;

@JsonTest
class IdentifierTest {

    @Autowired
    private JacksonTester<Identifier> json;

    @Test
    void serializesOnlyTypeAndValue() throws IOException {
        final Identifier identifier = Identifier.dns("*.example.com");

        assertThat(identifier.isWildcard()).isTrue();
        assertThat(json.write(identifier))
            .isEqualToJson("{\"type\":\"dns\",\"value\":\"*.example.com\"}", JSONCompareMode.STRICT);
    }

    @Test
    void normalizedLowerCasesValue() {
        assertThat(Identifier.dns("WWW.Example.COM").normalized()).isEqualTo(Identifier.dns("www.example.com"));
        assertThat(Identifier.dns("www.example.com").isWildcard()).isFalse();
    }
}
