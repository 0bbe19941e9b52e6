package acmeca.validation;

import acmeca.config.AppProperties;
import acmeca.model.Problem;
import acmeca.model.ProblemType;
import acmeca.services.OrderStateMachine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs challenge validation decoupled from the request that triggered it and writes the outcome back.
 */
@Service
@Slf4j
public class ChallengeValidationService {

    private final ChallengeValidator challengeValidator;
    private final OrderStateMachine stateMachine;
    private final AppProperties appProperties;

    public ChallengeValidationService(ChallengeValidator challengeValidator,
        OrderStateMachine stateMachine,
        AppProperties appProperties
    ) {
        this.challengeValidator = challengeValidator;
        this.stateMachine = stateMachine;
        this.appProperties = appProperties;
    }

    public Disposable submit(ValidationTarget target) {
        log.debug("Submitting {} validation of challenge={} host={}",
            target.type().value(), target.challengeId(), target.hostname());
        return validateAndRecord(target)
            .subscribe(
                result -> log.debug("Recorded validation of challenge={} valid={}", target.challengeId(), result.valid()),
                e -> log.error("Failed to record validation of challenge={}", target.challengeId(), e)
            );
    }

    Mono<ValidationResult> validateAndRecord(ValidationTarget target) {
        final ValidationResult timedOut = ValidationResult.failure(
            Problem.of(ProblemType.CONNECTION, "Validation did not complete in time"));

        return challengeValidator.validate(target)
            .timeout(appProperties.validation().overallTimeout(), Mono.just(timedOut))
            // recording is blocking JDBC work
            .publishOn(Schedulers.boundedElastic())
            .doOnNext(result -> stateMachine.recordValidation(target, result));
    }
}
