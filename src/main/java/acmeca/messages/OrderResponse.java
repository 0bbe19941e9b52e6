package acmeca.messages;

import acmeca.model.Identifier;
import acmeca.model.Problem;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 *
 * @param status pending, ready, processing, valid, invalid <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.1.6">See</a>
 * @param error present once the order is invalid
 * @param finalizeUri
 * @param certificate present once the order is valid
 */
@Builder
@JsonInclude(Include.NON_NULL)
public record OrderResponse(
    String status,
    Instant expires,
    List<Identifier> identifiers,
    Instant notBefore,
    Instant notAfter,
    Problem error,
    List<URI> authorizations,
    @JsonProperty("finalize")
    URI finalizeUri,
    URI certificate
) {

}
