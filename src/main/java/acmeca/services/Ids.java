package acmeca.services;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Random URL-safe identifiers for resources, challenge tokens and nonces.
 */
public final class Ids {

    private static final SecureRandom RANDOM = new SecureRandom();

    private Ids() {}

    public static String newId() {
        return randomBase64Url(16);
    }

    /**
     * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-8.1">RFC 8555 8.1</a> requires at least 128 bits of
     * entropy for challenge tokens.
     */
    public static String newToken() {
        return randomBase64Url(32);
    }

    public static String randomBase64Url(int numBytes) {
        final byte[] bytes = new byte[numBytes];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
