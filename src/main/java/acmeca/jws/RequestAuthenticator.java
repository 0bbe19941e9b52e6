package acmeca.jws;

import acmeca.config.AppProperties;
import acmeca.model.Account;
import acmeca.model.AccountStatus;
import acmeca.model.ProblemType;
import acmeca.repository.AccountRepository;
import acmeca.services.AcmeProblemException;
import acmeca.services.AcmeUrls;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSObject;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.ECDSAVerifier;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.util.Base64URL;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

/**
 * Verifies the JWS envelope of every ACME POST as laid out in
 * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-6.2">RFC 8555 Sec 6.2</a>:
 * algorithm allow-list, key reference, signature, nonce and request URL, in that order.
 */
@Service
@Slf4j
public class RequestAuthenticator {

    public static final MediaType JOSE_JSON = MediaType.parseMediaType("application/jose+json");
    public static final String JOSE_JSON_VALUE = "application/jose+json";

    /**
     * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-6.5">Replay Protection</a>
     */
    public static final String NONCE_HEADER = "nonce";
    /**
     * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-6.4">Request URL Integrity</a>
     */
    public static final String URL_HEADER = "url";

    private static final int MIN_ACCOUNT_RSA_KEY_SIZE = 2048;

    private final NonceService nonceService;
    private final AccountRepository accountRepository;
    private final AcmeUrls acmeUrls;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    public RequestAuthenticator(NonceService nonceService,
        AccountRepository accountRepository,
        AcmeUrls acmeUrls,
        AppProperties appProperties,
        ObjectMapper objectMapper
    ) {
        this.nonceService = nonceService;
        this.accountRepository = accountRepository;
        this.acmeUrls = acmeUrls;
        this.appProperties = appProperties;
        this.objectMapper = objectMapper;
    }

    /**
     * @param body        raw request body, a flattened JWS
     * @param requestPath path of the request inside this application, compared against the {@code url} header
     * @param keyMode     which key reference the endpoint requires
     */
    public AuthenticatedRequest authenticate(byte[] body, String requestPath, KeyMode keyMode) {
        final JwsEnvelope envelope = readEnvelope(body);
        final Map<String, Object> rawHeader = readProtectedHeader(envelope.protectedHeader());

        final Object alg = rawHeader.get("alg");
        if (!(alg instanceof String algName) || !appProperties.allowedAlgorithms().contains(algName)) {
            throw new AcmeProblemException(ProblemType.BAD_SIGNATURE_ALGORITHM,
                "Signature algorithm " + alg + " is not accepted, use one of " + appProperties.allowedAlgorithms());
        }

        final JWSObject jwsObject;
        try {
            jwsObject = JWSObject.parse(envelope.toCompact());
        } catch (ParseException e) {
            throw new AcmeProblemException(ProblemType.MALFORMED, "Invalid JWS: " + e.getMessage(), e);
        }
        final JWSHeader header = jwsObject.getHeader();

        final boolean hasJwk = header.getJWK() != null;
        final boolean hasKid = header.getKeyID() != null;
        if (hasJwk == hasKid) {
            throw AcmeProblemException.malformed("Exactly one of jwk and kid must be present in the protected header");
        }
        if (keyMode == KeyMode.JWK && !hasJwk) {
            throw AcmeProblemException.malformed("This resource requires a jwk in the protected header");
        }
        if (keyMode == KeyMode.KID && !hasKid) {
            throw AcmeProblemException.malformed("This resource requires a kid in the protected header");
        }

        final Account account;
        final JWK jwk;
        if (hasKid) {
            account = resolveAccount(header.getKeyID());
            jwk = parseStoredKey(account);
        }
        else {
            account = null;
            jwk = header.getJWK();
            if (jwk.isPrivate()) {
                throw AcmeProblemException.malformed("The embedded jwk must be a public key");
            }
        }

        // a bad signature on a known account is an authorization failure, on an embedded key a malformed request
        verifySignature(jwsObject, jwk, hasKid ? ProblemType.UNAUTHORIZED : ProblemType.MALFORMED);

        final Object nonce = header.getCustomParam(NONCE_HEADER);
        if (!(nonce instanceof String nonceValue) || !nonceService.consume(nonceValue)) {
            throw new AcmeProblemException(ProblemType.BAD_NONCE, "Missing, unknown or already used nonce");
        }

        final URI expectedUrl = acmeUrls.resolve(requestPath);
        final Object url = header.getCustomParam(URL_HEADER);
        if (!(url instanceof String urlValue) || !expectedUrl.toString().equals(urlValue)) {
            log.debug("Rejecting request url={} expected={}", url, expectedUrl);
            throw AcmeProblemException.unauthorized("The url header does not match the request URL " + expectedUrl);
        }

        final Base64URL payloadPart = jwsObject.getParsedParts()[1];
        final byte[] payload = payloadPart.toString().isEmpty() ? new byte[0] : payloadPart.decode();

        return AuthenticatedRequest.builder()
            .account(account)
            .jwk(jwk.toPublicJWK())
            .payload(payload)
            .build();
    }

    /**
     * Binds the payload of an authenticated request to the given message type.
     */
    public <T> T readPayload(AuthenticatedRequest request, Class<T> type) {
        if (request.isPostAsGet()) {
            throw AcmeProblemException.malformed("Request payload must not be empty");
        }
        try {
            return objectMapper.readValue(request.payload(), type);
        } catch (IOException e) {
            throw new AcmeProblemException(ProblemType.MALFORMED, "Unable to parse request payload: " + e.getMessage(), e);
        }
    }

    private JwsEnvelope readEnvelope(byte[] body) {
        if (body == null || body.length == 0) {
            throw AcmeProblemException.malformed("Request body must be a JWS");
        }
        final JwsEnvelope envelope;
        try {
            envelope = objectMapper.readValue(body, JwsEnvelope.class);
        } catch (IOException e) {
            throw new AcmeProblemException(ProblemType.MALFORMED, "Request body is not a flattened JWS", e);
        }
        if (envelope.signatures() != null) {
            throw AcmeProblemException.malformed("Only the flattened JWS serialization with a single signature is supported");
        }
        if (envelope.header() != null) {
            throw AcmeProblemException.malformed("Unprotected JWS header parameters are not allowed");
        }
        if (envelope.protectedHeader() == null || envelope.payload() == null || envelope.signature() == null) {
            throw AcmeProblemException.malformed("JWS must carry protected, payload and signature members");
        }
        return envelope;
    }

    private Map<String, Object> readProtectedHeader(String encoded) {
        try {
            final String json = new String(new Base64URL(encoded).decode(), StandardCharsets.UTF_8);
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException | RuntimeException e) {
            throw new AcmeProblemException(ProblemType.MALFORMED, "Unable to decode the protected header", e);
        }
    }

    private Account resolveAccount(String kid) {
        final Account account = acmeUrls.accountIdFromKid(kid)
            .flatMap(accountRepository::findById)
            .orElseThrow(() -> new AcmeProblemException(ProblemType.ACCOUNT_DOES_NOT_EXIST,
                "No account exists for kid " + kid));
        if (account.status() != AccountStatus.VALID) {
            throw AcmeProblemException.unauthorized("Account is " + account.status().value());
        }
        return account;
    }

    private JWK parseStoredKey(Account account) {
        try {
            return JWK.parse(account.jwk());
        } catch (ParseException e) {
            throw new IllegalStateException("Stored key of account " + account.id() + " is unreadable", e);
        }
    }

    private void verifySignature(JWSObject jwsObject, JWK jwk, ProblemType invalidSignature) {
        final JWSVerifier verifier;
        try {
            if (jwk instanceof RSAKey rsaKey) {
                if (rsaKey.size() < MIN_ACCOUNT_RSA_KEY_SIZE) {
                    throw AcmeProblemException.malformed("RSA account keys must be at least "
                        + MIN_ACCOUNT_RSA_KEY_SIZE + " bits");
                }
                verifier = new RSASSAVerifier(rsaKey);
            }
            else if (jwk instanceof ECKey ecKey) {
                verifier = new ECDSAVerifier(ecKey);
            }
            else {
                throw new AcmeProblemException(ProblemType.BAD_SIGNATURE_ALGORITHM,
                    "Unsupported key type " + jwk.getKeyType());
            }
        } catch (JOSEException e) {
            throw new AcmeProblemException(ProblemType.MALFORMED, "Unusable key: " + e.getMessage(), e);
        }

        if (!verifier.supportedJWSAlgorithms().contains(jwsObject.getHeader().getAlgorithm())) {
            throw new AcmeProblemException(ProblemType.BAD_SIGNATURE_ALGORITHM,
                "Algorithm " + jwsObject.getHeader().getAlgorithm() + " does not match the key type " + jwk.getKeyType());
        }

        try {
            if (!jwsObject.verify(verifier)) {
                throw new AcmeProblemException(invalidSignature, "JWS signature is invalid");
            }
        } catch (JOSEException e) {
            throw new AcmeProblemException(ProblemType.MALFORMED, "Unable to verify JWS signature", e);
        }
    }
}
