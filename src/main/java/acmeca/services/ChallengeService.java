package acmeca.services;

import acmeca.jws.Thumbprints;
import acmeca.model.Account;
import acmeca.model.Authorization;
import acmeca.model.AuthorizationStatus;
import acmeca.model.Challenge;
import acmeca.model.ChallengeStatus;
import acmeca.repository.AuthorizationRepository;
import acmeca.repository.ChallengeRepository;
import acmeca.validation.ChallengeValidationService;
import acmeca.validation.ValidationTarget;
import com.nimbusds.jose.jwk.JWK;
import java.text.ParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Handles a client's response to a challenge, see
 * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.5.1">RFC 8555 Sec 7.5.1</a>
 */
@Service
@Slf4j
public class ChallengeService {

    private final ChallengeRepository challengeRepository;
    private final AuthorizationRepository authorizationRepository;
    private final AuthorizationService authorizationService;
    private final OrderStateMachine stateMachine;
    private final ChallengeValidationService validationService;

    public ChallengeService(ChallengeRepository challengeRepository,
        AuthorizationRepository authorizationRepository,
        AuthorizationService authorizationService,
        OrderStateMachine stateMachine,
        ChallengeValidationService validationService
    ) {
        this.challengeRepository = challengeRepository;
        this.authorizationRepository = authorizationRepository;
        this.authorizationService = authorizationService;
        this.stateMachine = stateMachine;
        this.validationService = validationService;
    }

    public record ChallengeDetails(
        Challenge challenge,
        Authorization authorization
    ) {}

    /**
     * Returns the challenge as it currently is. Used for POST-as-GET polling.
     */
    public ChallengeDetails find(Account account, String challengeId) {
        final Challenge challenge = loadChallenge(challengeId);
        final Authorization authorization = stateMachine.refresh(
            authorizationService.loadOwned(account, challenge.authorizationId()));
        return new ChallengeDetails(challenge, authorization);
    }

    /**
     * Selects the challenge for its authorization and starts validating it. The validation result is written back
     * asynchronously, so the challenge is returned while still processing.
     */
    public ChallengeDetails respond(Account account, String challengeId) {
        final Challenge challenge = loadChallenge(challengeId);
        final Authorization authorization = stateMachine.refresh(
            authorizationService.loadOwned(account, challenge.authorizationId()));

        if (challenge.status() != ChallengeStatus.PENDING) {
            log.debug("Challenge={} is already {}, nothing to do", challengeId, challenge.status().value());
            return new ChallengeDetails(challenge, authorization);
        }
        if (authorization.status() != AuthorizationStatus.PENDING) {
            throw AcmeProblemException.malformed("Authorization is " + authorization.status().value()
                + " and can no longer be validated");
        }

        if (authorization.selectedChallengeId() == null) {
            authorizationRepository.selectChallenge(authorization.id(), challenge.id());
        }
        final String selected = authorizationRepository.findById(authorization.id())
            .map(Authorization::selectedChallengeId)
            .orElse(null);
        if (!challenge.id().equals(selected)) {
            throw AcmeProblemException.malformed("Another challenge of this authorization was already selected");
        }

        if (challengeRepository.compareAndSetStatus(challenge.id(), ChallengeStatus.PENDING, ChallengeStatus.PROCESSING)) {
            validationService.submit(ValidationTarget.builder()
                .challengeId(challenge.id())
                .authorizationId(authorization.id())
                .orderId(authorization.orderId())
                .type(challenge.type())
                .hostname(authorization.identifier().value())
                .token(challenge.token())
                .keyAuthorization(Thumbprints.keyAuthorization(challenge.token(), accountKey(account)))
                .build());
        }
        else {
            log.debug("Challenge={} was started concurrently", challenge.id());
        }

        return new ChallengeDetails(loadChallenge(challengeId), authorization);
    }

    private Challenge loadChallenge(String challengeId) {
        return challengeRepository.findById(challengeId)
            .orElseThrow(() -> AcmeProblemException.notFound("Challenge " + challengeId + " does not exist"));
    }

    private static JWK accountKey(Account account) {
        try {
            return JWK.parse(account.jwk());
        } catch (ParseException e) {
            throw new IllegalStateException("Stored key of account " + account.id() + " is unreadable", e);
        }
    }
}
