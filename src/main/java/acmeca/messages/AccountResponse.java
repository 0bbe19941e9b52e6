package acmeca.messages;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.net.URI;
import java.util.List;
import lombok.Builder;

/**
 *
 * @param status valid, deactivated, revoked
 * @param contact
 * @param orders
 */
@Builder
@JsonInclude(Include.NON_NULL)
public record AccountResponse(
    String status,
    List<String> contact,
    Boolean termsOfServiceAgreed,
    URI orders
) { }
