package acmeca.validation;

import acmeca.model.Problem;
import org.springframework.lang.Nullable;

/**
 * Outcome of validating one challenge, after all retries.
 */
public record ValidationResult(
    boolean valid,
    @Nullable
    Problem problem
) {

    public static ValidationResult success() {
        return new ValidationResult(true, null);
    }

    public static ValidationResult failure(Problem problem) {
        return new ValidationResult(false, problem);
    }
}
