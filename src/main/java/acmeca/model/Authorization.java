package acmeca.model;

import java.time.Instant;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * @param identifier          the identifier without any wildcard prefix
 * @param selectedChallengeId the one challenge the client chose to respond to
 */
@Builder(toBuilder = true)
public record Authorization(
    String id,
    String orderId,
    Identifier identifier,
    boolean wildcard,
    AuthorizationStatus status,
    Instant expires,
    @Nullable
    String selectedChallengeId
) {

    public boolean isExpired(Instant now) {
        return !expires.isAfter(now);
    }
}
