package acmeca.model;

import java.time.Instant;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * @param status pending, processing, valid, invalid <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.1.6">RFC</a>
 * @param validated time the server validated the challenge
 * @param error reason of a failed validation
 */
@Builder(toBuilder = true)
public record Challenge(
    String id,
    String authorizationId,
    ChallengeType type,
    String token,
    ChallengeStatus status,
    @Nullable
    Instant validated,
    @Nullable
    Problem error
) {

}
