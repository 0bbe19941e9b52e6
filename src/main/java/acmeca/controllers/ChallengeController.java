package acmeca.controllers;

import acmeca.jws.KeyMode;
import acmeca.jws.RequestAuthenticator;
import acmeca.messages.ChallengeResponse;
import acmeca.services.AcmeUrls;
import acmeca.services.ChallengeService;
import acmeca.services.ChallengeService.ChallengeDetails;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@Slf4j
public class ChallengeController extends AcmeControllerSupport {

    private final ChallengeService challengeService;
    private final AcmeResponses acmeResponses;
    private final AcmeUrls acmeUrls;

    public ChallengeController(RequestAuthenticator authenticator, ChallengeService challengeService,
        AcmeResponses acmeResponses, AcmeUrls acmeUrls
    ) {
        super(authenticator);
        this.challengeService = challengeService;
        this.acmeResponses = acmeResponses;
        this.acmeUrls = acmeUrls;
    }

    /**
     * POST-as-GET returns the challenge, any JSON object payload (normally {@code {}}) asks the server to validate it.
     */
    @PostMapping(value = AcmeUrls.CHALLENGE_PATH + "{challengeId}", consumes = RequestAuthenticator.JOSE_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ChallengeResponse>> challenge(ServerHttpRequest request, @RequestBody byte[] body,
        @PathVariable String challengeId
    ) {
        return authenticated(request, body, KeyMode.KID, authenticated -> {
            final ChallengeDetails details;
            if (authenticated.isPostAsGet()) {
                details = challengeService.find(authenticated.account(), challengeId);
            }
            else {
                log.debug("Client is ready for challenge id={}", challengeId);
                details = challengeService.respond(authenticated.account(), challengeId);
            }
            return ResponseEntity.ok()
                .header(HttpHeaders.LINK, AcmeResponseHeadersFilter.link(
                    acmeUrls.authorization(details.authorization().id()), "up"))
                .body(acmeResponses.challenge(details.challenge()));
        });
    }
}
