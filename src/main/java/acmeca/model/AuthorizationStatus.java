package acmeca.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuthorizationStatus {
    PENDING("pending"),
    VALID("valid"),
    INVALID("invalid"),
    DEACTIVATED("deactivated"),
    EXPIRED("expired"),
    REVOKED("revoked");

    private final String value;

    AuthorizationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Any of these makes the owning order permanently invalid.
     */
    public boolean isFailed() {
        return this == INVALID || this == DEACTIVATED || this == EXPIRED || this == REVOKED;
    }

    public static AuthorizationStatus of(String value) {
        for (AuthorizationStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown authorization status " + value);
    }
}
