package acmeca.messages;

import acmeca.model.Identifier;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 *
 * @param status pending, valid, invalid, revoked, deactivated, expired <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.1.6">See</a>
 * @param wildcard only present, as true, for authorizations of a wildcard identifier
 */
@Builder
@JsonInclude(Include.NON_NULL)
public record AuthzResponse(
    Identifier identifier,
    String status,
    Instant expires,
    List<ChallengeResponse> challenges,
    Boolean wildcard
) {

}
