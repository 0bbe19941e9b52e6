package acmeca.jws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Flattened JSON serialization of a JWS as sent by ACME clients.
 * {@code header} and {@code signatures} are only captured to reject them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JwsEnvelope(
    @JsonProperty("protected")
    String protectedHeader,
    String payload,
    String signature,
    Map<String, Object> header,
    List<Object> signatures
) {

    public String toCompact() {
        return protectedHeader + "." + payload + "." + signature;
    }
}
