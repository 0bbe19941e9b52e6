package acmeca.controllers;

import acmeca.issuance.CertificateIssuanceService;
import acmeca.jws.KeyMode;
import acmeca.jws.RequestAuthenticator;
import acmeca.model.IssuedCertificate;
import acmeca.services.AcmeProblemException;
import acmeca.services.AcmeUrls;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.4.2">Downloading the Certificate</a>
 */
@RestController
public class CertificateController extends AcmeControllerSupport {

    private static final MediaType PEM_CHAIN_TYPE = MediaType.parseMediaType(PEM_CERTIFICATE_CHAIN);

    private final CertificateIssuanceService issuanceService;

    public CertificateController(RequestAuthenticator authenticator, CertificateIssuanceService issuanceService) {
        super(authenticator);
        this.issuanceService = issuanceService;
    }

    @GetMapping(AcmeUrls.CERT_PATH + "{serial}")
    public Mono<ResponseEntity<String>> certificate(@PathVariable String serial) {
        return blocking(() -> chain(issuanceService.findCertificate(serial)));
    }

    @PostMapping(value = AcmeUrls.CERT_PATH + "{serial}", consumes = RequestAuthenticator.JOSE_JSON_VALUE)
    public Mono<ResponseEntity<String>> certificate(ServerHttpRequest request, @RequestBody byte[] body,
        @PathVariable String serial
    ) {
        return authenticated(request, body, KeyMode.KID, authenticated -> {
            final IssuedCertificate certificate = issuanceService.findCertificate(serial);
            if (!certificate.accountId().equals(authenticated.account().id())) {
                throw AcmeProblemException.unauthorized("Certificate was issued to a different account");
            }
            return chain(certificate);
        });
    }

    private ResponseEntity<String> chain(IssuedCertificate certificate) {
        return ResponseEntity.ok()
            .contentType(PEM_CHAIN_TYPE)
            .body(issuanceService.certificateChain(certificate));
    }
}
