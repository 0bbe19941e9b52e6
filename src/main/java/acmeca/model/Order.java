package acmeca.model;

import java.time.Instant;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * @param certificateSerial hex serial of the issued certificate once the order is valid
 * @param error             reason the order became invalid
 */
@Builder(toBuilder = true)
public record Order(
    String id,
    String accountId,
    OrderStatus status,
    Instant expires,
    @Nullable
    Instant notBefore,
    @Nullable
    Instant notAfter,
    @Nullable
    String certificateSerial,
    @Nullable
    Problem error,
    Instant createdAt
) {

    public boolean isExpired(Instant now) {
        return !expires.isAfter(now);
    }
}
