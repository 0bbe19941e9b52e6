package acmeca.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Locale;
import lombok.Builder;

@Builder
public record Identifier(
    String type,
    String value
) {

    public static final String TYPE_DNS = "dns";

    public static Identifier dns(String host) {
        return new Identifier(TYPE_DNS, host);
    }

    /**
     * Identifiers are compared case-insensitively, so they are stored lower-cased.
     */
    public Identifier normalized() {
        return new Identifier(type, value == null ? null : value.toLowerCase(Locale.ROOT));
    }

    @JsonIgnore
    public boolean isWildcard() {
        return value != null && value.startsWith("*.");
    }
}
