package acmeca.controllers;

import acmeca.model.Problem;
import acmeca.model.ProblemType;
import acmeca.services.AcmeProblemException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import org.springframework.web.server.UnsupportedMediaTypeStatusException;

/**
 * Renders every failure as an RFC 7807 problem document with the ACME error types.
 */
@RestControllerAdvice
@Slf4j
public class AcmeExceptionHandler {

    @ExceptionHandler(AcmeProblemException.class)
    public ResponseEntity<Problem> handleProblem(AcmeProblemException e) {
        log.debug("Request failed with type={} detail={}", e.getType().code(), e.getMessage());
        return problem(e.getStatus(), e.toProblem());
    }

    @ExceptionHandler(UnsupportedMediaTypeStatusException.class)
    public ResponseEntity<Problem> handleUnsupportedMediaType(UnsupportedMediaTypeStatusException e) {
        return malformed(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported content type " + e.getContentType());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Problem> handleInput(ServerWebInputException e) {
        return malformed(HttpStatus.BAD_REQUEST, e.getReason());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Problem> handleStatus(ResponseStatusException e) {
        return malformed(e.getStatusCode(), e.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Problem> handleUnexpected(Exception e) {
        log.error("Unexpected failure while handling request", e);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
            Problem.of(ProblemType.SERVER_INTERNAL, "Internal server error"));
    }

    private static ResponseEntity<Problem> malformed(HttpStatusCode status, String detail) {
        return problem(status, new Problem(ProblemType.MALFORMED.urn(), detail, status.value(), null));
    }

    private static ResponseEntity<Problem> problem(HttpStatusCode status, Problem problem) {
        return ResponseEntity.status(status)
            .contentType(MediaType.APPLICATION_PROBLEM_JSON)
            .body(problem);
    }
}
