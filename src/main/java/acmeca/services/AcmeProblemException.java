package acmeca.services;

import acmeca.model.Problem;
import acmeca.model.ProblemType;
import lombok.Getter;
import lombok.ToString;
import org.springframework.http.HttpStatus;

/**
 * Client-visible failure of an ACME request, rendered as a problem document.
 */
@Getter
@ToString
public class AcmeProblemException extends RuntimeException {

    private final ProblemType type;
    private final HttpStatus status;

    public AcmeProblemException(ProblemType type, String detail) {
        this(type, type.status(), detail, null);
    }

    public AcmeProblemException(ProblemType type, String detail, Throwable cause) {
        this(type, type.status(), detail, cause);
    }

    private AcmeProblemException(ProblemType type, HttpStatus status, String detail, Throwable cause) {
        super(detail, cause);
        this.type = type;
        this.status = status;
    }

    public Problem toProblem() {
        return new Problem(type.urn(), getMessage(), status.value(), null);
    }

    public static AcmeProblemException malformed(String detail) {
        return new AcmeProblemException(ProblemType.MALFORMED, detail);
    }

    public static AcmeProblemException unauthorized(String detail) {
        return new AcmeProblemException(ProblemType.UNAUTHORIZED, detail);
    }

    /**
     * ACME has no dedicated error type for unknown resources, so they are malformed requests served with a 404.
     */
    public static AcmeProblemException notFound(String detail) {
        return new AcmeProblemException(ProblemType.MALFORMED, HttpStatus.NOT_FOUND, detail, null);
    }
}
