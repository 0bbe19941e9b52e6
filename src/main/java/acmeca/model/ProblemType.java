package acmeca.model;

import org.springframework.http.HttpStatus;

/**
 * Error types of <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-6.7">RFC 8555 Sec 6.7</a> used by this
 * server, each with the HTTP status it is served with.
 */
public enum ProblemType {
    ACCOUNT_DOES_NOT_EXIST("accountDoesNotExist", HttpStatus.BAD_REQUEST),
    ALREADY_REVOKED("alreadyRevoked", HttpStatus.BAD_REQUEST),
    BAD_CSR("badCSR", HttpStatus.BAD_REQUEST),
    BAD_NONCE("badNonce", HttpStatus.BAD_REQUEST),
    BAD_REVOCATION_REASON("badRevocationReason", HttpStatus.BAD_REQUEST),
    BAD_SIGNATURE_ALGORITHM("badSignatureAlgorithm", HttpStatus.BAD_REQUEST),
    CONNECTION("connection", HttpStatus.BAD_REQUEST),
    DNS("dns", HttpStatus.BAD_REQUEST),
    INCORRECT_RESPONSE("incorrectResponse", HttpStatus.FORBIDDEN),
    INVALID_CONTACT("invalidContact", HttpStatus.BAD_REQUEST),
    MALFORMED("malformed", HttpStatus.BAD_REQUEST),
    ORDER_NOT_READY("orderNotReady", HttpStatus.FORBIDDEN),
    RATE_LIMITED("rateLimited", HttpStatus.TOO_MANY_REQUESTS),
    REJECTED_IDENTIFIER("rejectedIdentifier", HttpStatus.BAD_REQUEST),
    SERVER_INTERNAL("serverInternal", HttpStatus.INTERNAL_SERVER_ERROR),
    UNAUTHORIZED("unauthorized", HttpStatus.FORBIDDEN),
    UNSUPPORTED_CONTACT("unsupportedContact", HttpStatus.BAD_REQUEST);

    public static final String URN_PREFIX = "urn:ietf:params:acme:error:";

    private final String code;
    private final HttpStatus status;

    ProblemType(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public String urn() {
        return URN_PREFIX + code;
    }

    public HttpStatus status() {
        return status;
    }

    public static ProblemType fromUrn(String urn) {
        for (ProblemType type : values()) {
            if (type.urn().equals(urn)) {
                return type;
            }
        }
        return SERVER_INTERNAL;
    }
}
