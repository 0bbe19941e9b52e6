package acmeca.messages;

import static org.assertj.core.api.Assertions.assertThat;

import acmeca.model.Identifier;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.skyscreamer.jsonassert.JSONCompareMode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.JsonTest;
import org.springframework.boot.test.json.JacksonTester;

@JsonTest
class OrderRequestTest {

    @Autowired
    private JacksonTester<OrderRequest> json;

    @Test
    void deserializeWithTimeframe() throws IOException {
        final OrderRequest request = json.parseObject("""
            {
                "identifiers": [{"type":"dns","value":"example.com"}],
                "notBefore": "2022-06-11T00:45:27Z",
                "notAfter": "2022-06-12T00:45:27Z"
            }
            """);

        assertThat(request.identifiers()).containsExactly(Identifier.dns("example.com"));
        assertThat(request.notBefore()).isEqualTo(Instant.ofEpochSecond(1654908327));
        assertThat(request.notAfter()).isEqualTo(Instant.ofEpochSecond(1654994727));
    }

    @Test
    void serializeWithoutTimeframe() throws IOException {
        final OrderRequest request = OrderRequest.builder()
            .identifiers(List.of(
                Identifier.builder()
                    .type("dns")
                    .value("example.com")
                    .build()
            ))
            .build();

        assertThat(json.write(request))
            .isEqualToJson("""
                {
                    "identifiers": [{"type":"dns","value":"example.com"}]
                }
                """, JSONCompareMode.STRICT);
    }
}
