package acmeca.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChallengeType {
    HTTP_01("http-01"),
    DNS_01("dns-01");

    private final String value;

    ChallengeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static ChallengeType of(String value) {
        for (ChallengeType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown challenge type " + value);
    }
}
