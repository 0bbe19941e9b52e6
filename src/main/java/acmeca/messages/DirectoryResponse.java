package acmeca.messages;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.net.URI;
import java.util.List;
import lombok.Builder;

/**
 * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.1.1">Directory</a>
 */
@Builder
@JsonInclude(Include.NON_NULL)
public record DirectoryResponse(
    URI newNonce,
    URI newAccount,
    URI newOrder,
    URI revokeCert,
    Meta meta
) {

    @Builder
    @JsonInclude(Include.NON_EMPTY)
    public record Meta(
        URI termsOfService,
        URI website,
        List<String> caaIdentities,
        boolean externalAccountRequired
    ) {

    }
}
