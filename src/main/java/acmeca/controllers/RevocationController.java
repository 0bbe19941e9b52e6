package acmeca.controllers;

import acmeca.jws.KeyMode;
import acmeca.jws.RequestAuthenticator;
import acmeca.messages.RevokeRequest;
import acmeca.model.IssuedCertificate;
import acmeca.revocation.RevocationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@Slf4j
public class RevocationController extends AcmeControllerSupport {

    private final RevocationService revocationService;

    public RevocationController(RequestAuthenticator authenticator, RevocationService revocationService) {
        super(authenticator);
        this.revocationService = revocationService;
    }

    /**
     * Signed either by the account that holds the certificate or by the certificate key itself.
     */
    @PostMapping(value = "/revoke-cert", consumes = RequestAuthenticator.JOSE_JSON_VALUE)
    public Mono<ResponseEntity<Void>> revoke(ServerHttpRequest request, @RequestBody byte[] body) {
        return authenticated(request, body, KeyMode.ANY, authenticated -> {
            final RevokeRequest payload = authenticator.readPayload(authenticated, RevokeRequest.class);
            final IssuedCertificate revoked = revocationService.revoke(authenticated, payload);
            log.debug("Revocation of serial={} completed", revoked.serial());
            return ResponseEntity.ok().build();
        });
    }
}
