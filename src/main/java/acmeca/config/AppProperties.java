package acmeca.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.core.io.Resource;
import org.springframework.validation.annotation.Validated;

/**
 * @param baseUrl             external URL of the ACME endpoint as seen by clients through the reverse proxy. Request URLs
 *                            embedded in JWS headers are compared against this base plus the request path.
 * @param orderValidity       how long orders and their authorizations stay usable, see
 *                            <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.1.3">RFC 8555 Sec 7.1.3</a>
 * @param nonceLifetime       nonces older than this are rejected and removed by the cleanup job
 * @param requireContact      reject new accounts without at least one contact URL
 * @param termsOfService      when set, advertised in the directory and new accounts must agree to it
 * @param website             advertised in the directory meta object
 * @param caaIdentities       advertised in the directory meta object
 * @param maxPendingOrders    per account limit of orders that are not yet valid or invalid
 * @param blockedDomains      identifiers equal to or below one of these domains are rejected
 * @param allowedAlgorithms   JWS algorithms accepted on client requests
 * @param ca                  signing key material
 * @param issuance            certificate profile
 * @param validation          challenge validation policy
 * @param revocation          CRL and OCSP settings
 * @param housekeeping        in-process scheduling of the periodic jobs
 */
@ConfigurationProperties("acme")
@Validated
public record AppProperties(
    @NotNull
    URI baseUrl,

    @DefaultValue("1h") @NotNull
    Duration orderValidity,

    @DefaultValue("1h") @NotNull
    Duration nonceLifetime,

    boolean requireContact,

    URI termsOfService,

    URI website,

    @DefaultValue
    List<String> caaIdentities,

    @DefaultValue("50") @Min(1)
    int maxPendingOrders,

    @DefaultValue
    Set<String> blockedDomains,

    @DefaultValue({"RS256", "RS384", "RS512", "PS256", "PS384", "PS512", "ES256", "ES384", "ES512"}) @NotEmpty
    Set<String> allowedAlgorithms,

    @DefaultValue @Valid
    Ca ca,

    @DefaultValue @Valid
    Issuance issuance,

    @DefaultValue @Valid
    Validation validation,

    @DefaultValue @Valid
    Revocation revocation,

    @DefaultValue @Valid
    Housekeeping housekeeping
) {

    /**
     * @param certificate  PEM encoded CA certificate. When absent together with {@code privateKey}, a self-signed CA is
     *                     generated at startup, which is only suitable for development.
     * @param privateKey   PEM encoded CA private key
     * @param generatedSubject subject of a generated CA
     */
    public record Ca(
        Resource certificate,

        Resource privateKey,

        @DefaultValue("CN=ACME Development CA") @NotNull
        String generatedSubject
    ) {

    }

    /**
     * @param defaultValidity  certificate lifetime when the order did not request a notAfter
     * @param maxValidity      upper bound of a requested notAfter
     * @param minRsaKeySize    smallest RSA modulus accepted in a CSR
     */
    public record Issuance(
        @DefaultValue("90d") @NotNull
        Duration defaultValidity,

        @DefaultValue("365d") @NotNull
        Duration maxValidity,

        @DefaultValue("2048") @Min(1024)
        int minRsaKeySize
    ) {

    }

    /**
     * Retry policy of challenge validation. RFC 8555 leaves this to the server.
     *
     * @param attemptTimeout  timeout of a single HTTP fetch or DNS query
     * @param maxRetries      retries after the first failed attempt before the challenge becomes invalid
     * @param firstBackoff    delay before the first retry, doubled on each further retry
     * @param httpPort        port used for http-01 validation requests
     * @param maxResponseSize largest accepted http-01 response body in bytes
     */
    public record Validation(
        @DefaultValue("5s") @NotNull
        Duration attemptTimeout,

        @DefaultValue("3") @Min(0)
        int maxRetries,

        @DefaultValue("2s") @NotNull
        Duration firstBackoff,

        @DefaultValue("80") @Min(1)
        int httpPort,

        @DefaultValue("8192") @Min(128)
        int maxResponseSize
    ) {

        /**
         * Upper bound of all attempts and backoffs together.
         */
        public Duration overallTimeout() {
            Duration total = attemptTimeout.multipliedBy(maxRetries + 1L);
            Duration backoff = firstBackoff;
            for (int i = 0; i < maxRetries; i++) {
                total = total.plus(backoff);
                backoff = backoff.multipliedBy(2);
            }
            // allow for jitter
            return total.plus(total.dividedBy(2));
        }
    }

    /**
     * @param crlValidity           nextUpdate distance of generated CRLs
     * @param crlRefreshBefore      an unchanged CRL is still regenerated when its nextUpdate is closer than this
     * @param crlUrl                published CRL distribution point, also embedded in issued certificates
     * @param ocspUrl               OCSP responder URL embedded in issued certificates
     * @param ocspKeyValidity       lifetime of OCSP responder certificates
     * @param ocspKeyRenewBefore    a new responder key is generated when the newest one expires sooner than this
     * @param ocspResponseValidity  nextUpdate distance of OCSP responses
     */
    public record Revocation(
        @DefaultValue("1d") @NotNull
        Duration crlValidity,

        @DefaultValue("12h") @NotNull
        Duration crlRefreshBefore,

        URI crlUrl,

        URI ocspUrl,

        @DefaultValue("3d") @NotNull
        Duration ocspKeyValidity,

        @DefaultValue("1d") @NotNull
        Duration ocspKeyRenewBefore,

        @DefaultValue("1h") @NotNull
        Duration ocspResponseValidity
    ) {

    }

    /**
     * @param enabled            run the jobs on in-process timers. Deployments with an external scheduler leave this off
     *                           and call the admin endpoint instead.
     * @param adminEndpoint      expose {@code POST /admin/tasks/{name}}
     * @param crlInterval        delay between cache-crls runs
     * @param ocspKeyInterval    delay between generate-ocsp-keys runs
     * @param cleanupInterval    delay between acme-cleanup runs
     */
    public record Housekeeping(
        boolean enabled,

        @DefaultValue("true")
        boolean adminEndpoint,

        @DefaultValue("1h") @NotNull
        Duration crlInterval,

        @DefaultValue("1h") @NotNull
        Duration ocspKeyInterval,

        @DefaultValue("1h") @NotNull
        Duration cleanupInterval
    ) {

    }
}
