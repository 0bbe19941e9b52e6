package acmeca.jws;

import acmeca.model.Account;
import com.nimbusds.jose.jwk.JWK;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * @param account the requesting account when the request was signed with a {@code kid}
 * @param jwk     key that verified the signature
 * @param payload decoded JWS payload, empty for POST-as-GET
 */
@Builder
public record AuthenticatedRequest(
    @Nullable
    Account account,
    JWK jwk,
    byte[] payload
) {

    /**
     * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-6.3">RFC 8555 6.3</a>
     */
    public boolean isPostAsGet() {
        return payload.length == 0;
    }
}
