package acmeca.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChallengeStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    VALID("valid"),
    INVALID("invalid");

    private final String value;

    ChallengeStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static ChallengeStatus of(String value) {
        for (ChallengeStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown challenge status " + value);
    }
}
