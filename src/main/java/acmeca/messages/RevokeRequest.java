package acmeca.messages;

import lombok.Builder;

/**
 * @param certificate base64url DER of the certificate to revoke
 * @param reason      RFC 5280 reason code, unspecified when absent
 */
@Builder
public record RevokeRequest(
    String certificate,
    Integer reason
) {

}
