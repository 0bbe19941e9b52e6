package acmeca.controllers;

import acmeca.jws.KeyMode;
import acmeca.jws.RequestAuthenticator;
import acmeca.messages.AuthzRequest;
import acmeca.messages.AuthzResponse;
import acmeca.model.AuthorizationStatus;
import acmeca.services.AcmeProblemException;
import acmeca.services.AcmeUrls;
import acmeca.services.AuthorizationService;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class AuthorizationController extends AcmeControllerSupport {

    private final AuthorizationService authorizationService;
    private final AcmeResponses acmeResponses;

    public AuthorizationController(RequestAuthenticator authenticator, AuthorizationService authorizationService,
        AcmeResponses acmeResponses
    ) {
        super(authenticator);
        this.authorizationService = authorizationService;
        this.acmeResponses = acmeResponses;
    }

    @PostMapping(value = AcmeUrls.AUTHZ_PATH + "{authorizationId}", consumes = RequestAuthenticator.JOSE_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AuthzResponse> authorization(ServerHttpRequest request, @RequestBody byte[] body,
        @PathVariable String authorizationId
    ) {
        return authenticated(request, body, KeyMode.KID, authenticated -> {
            if (authenticated.isPostAsGet()) {
                return acmeResponses.authorization(
                    authorizationService.findOwned(authenticated.account(), authorizationId));
            }

            final AuthzRequest payload = authenticator.readPayload(authenticated, AuthzRequest.class);
            if (!AuthorizationStatus.DEACTIVATED.value().equals(payload.status())) {
                throw AcmeProblemException.malformed("Authorizations can only be updated to status deactivated");
            }
            return acmeResponses.authorization(
                authorizationService.deactivate(authenticated.account(), authorizationId));
        });
    }
}
