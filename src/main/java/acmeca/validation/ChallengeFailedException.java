package acmeca.validation;

import acmeca.model.ProblemType;
import lombok.Getter;

/**
 * A single failed validation attempt. Drives the retry cycle and, once retries are exhausted, becomes the problem
 * recorded on the challenge.
 */
@Getter
public class ChallengeFailedException extends RuntimeException {

    private final ProblemType type;

    public ChallengeFailedException(ProblemType type, String detail) {
        super(detail);
        this.type = type;
    }

    public ChallengeFailedException(ProblemType type, String detail, Throwable cause) {
        super(detail, cause);
        this.type = type;
    }
}
