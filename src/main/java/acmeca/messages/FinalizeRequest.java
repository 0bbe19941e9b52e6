package acmeca.messages;

/**
 * @param csr Base64url encoding of CSR in DER (not PEM) format
 */
public record FinalizeRequest(
    String csr
) {

}
