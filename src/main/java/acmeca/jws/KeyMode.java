package acmeca.jws;

/**
 * Which key reference a request must carry in its protected header.
 */
public enum KeyMode {
    /**
     * Embedded {@code jwk}, used before an account exists.
     */
    JWK,
    /**
     * {@code kid} pointing at an existing account.
     */
    KID,
    /**
     * Either one, as accepted by revoke-cert.
     */
    ANY
}
