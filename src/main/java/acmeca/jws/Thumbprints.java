package acmeca.jws;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.JWK;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

public final class Thumbprints {

    private Thumbprints() {}

    /**
     * RFC 7638 SHA-256 thumbprint, base64url encoded without padding.
     */
    public static String thumbprint(JWK jwk) {
        try {
            return jwk.computeThumbprint().toString();
        } catch (JOSEException e) {
            throw new IllegalStateException("Trying to compute jwk thumbprint", e);
        }
    }

    /**
     * @see <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-8.1">RFC 8555 8.1</a>
     */
    public static String keyAuthorization(String token, JWK accountKey) {
        return token + "." + thumbprint(accountKey);
    }

    /**
     * TXT record value expected for dns-01, see
     * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-8.4">RFC 8555 8.4</a>
     */
    public static String dnsTxtValue(String keyAuthorization) {
        try {
            final byte[] digest = MessageDigest.getInstance("SHA-256")
                .digest(keyAuthorization.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
