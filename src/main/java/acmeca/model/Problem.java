package acmeca.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;

/**
 * Problem document as described in
 * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-6.7">RFC 8555 Sec 6.7</a>
 */
@JsonInclude(Include.NON_EMPTY)
public record Problem(
    String type,
    String detail,
    Integer status,
    List<Subproblem> subproblems
) {

    public static Problem of(ProblemType type, String detail) {
        return new Problem(type.urn(), detail, type.status().value(), null);
    }
}
