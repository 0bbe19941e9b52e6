package acmeca.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.1.6">RFC 8555 Sec 7.1.6</a>
 */
public enum AccountStatus {
    VALID("valid"),
    DEACTIVATED("deactivated"),
    REVOKED("revoked");

    private final String value;

    AccountStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static AccountStatus of(String value) {
        for (AccountStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown account status " + value);
    }
}
