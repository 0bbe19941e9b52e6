package acmeca.validation;

import acmeca.model.ChallengeType;
import lombok.Builder;

/**
 * Everything a validation attempt needs, captured when the client responded to the challenge.
 *
 * @param hostname         identifier value without any wildcard prefix
 * @param keyAuthorization token and account key thumbprint as defined in RFC 8555 Sec 8.1
 */
@Builder
public record ValidationTarget(
    String challengeId,
    String authorizationId,
    String orderId,
    ChallengeType type,
    String hostname,
    String token,
    String keyAuthorization
) {

}
