package acmeca.messages;

import java.util.List;
import lombok.Builder;

/**
 * Payload of new-account and account update requests.
 *
 * @param status only {@code deactivated} is accepted on updates
 */
@Builder
public record AccountRequest(
    List<String> contact,
    boolean termsOfServiceAgreed,
    boolean onlyReturnExisting,
    String status
) {

}
