package io.fieldledger.api;

import io.fieldledger.core.ChainIntegrityException;
import io.fieldledger.core.ConflictUnresolvedException;
import io.fieldledger.core.LedgerException;
import io.fieldledger.core.SchemaVersionMismatchException;
import io.fieldledger.core.SyncTransportException;
import io.fieldledger.core.ValidationException;
import io.fieldledger.core.conflict.ConflictQueueFullException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Ledger errors as RFC 7807 problem responses. */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> invalid(ValidationException ex) {
        var problem = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid intent", ex);
        problem.setProperty("field", ex.field());
        return respond(problem);
    }

    @ExceptionHandler(SchemaVersionMismatchException.class)
    public ResponseEntity<ProblemDetail> unsupportedVersion(SchemaVersionMismatchException ex) {
        var problem = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Unsupported schema version", ex);
        problem.setProperty("found", ex.found());
        problem.setProperty("expected", ex.expected());
        return respond(problem);
    }

    @ExceptionHandler(ChainIntegrityException.class)
    public ResponseEntity<ProblemDetail> chainBroken(ChainIntegrityException ex, HttpServletRequest request) {
        log.error("Chain integrity failure on {}: {}", request.getRequestURI(), ex.getMessage());
        var problem = problem(HttpStatus.CONFLICT, "Chain integrity violated", ex);
        problem.setProperty("operationId", ex.operationId());
        problem.setProperty("position", ex.position());
        return respond(problem);
    }

    @ExceptionHandler(ConflictUnresolvedException.class)
    public ResponseEntity<ProblemDetail> unknownConflict(ConflictUnresolvedException ex) {
        var problem = problem(HttpStatus.NOT_FOUND, "Conflict not resolvable", ex);
        problem.setProperty("conflictId", ex.conflictId());
        return respond(problem);
    }

    @ExceptionHandler({ConflictQueueFullException.class, SyncTransportException.class})
    public ResponseEntity<ProblemDetail> unavailable(LedgerException ex) {
        log.warn("Service unavailable: {}", ex.getMessage());
        return respond(problem(HttpStatus.SERVICE_UNAVAILABLE, "Temporarily unavailable", ex));
    }

    private static ProblemDetail problem(HttpStatus status, String title, Exception ex) {
        var problem = ProblemDetail.forStatus(status);
        problem.setTitle(title);
        problem.setDetail(ex.getMessage());
        return problem;
    }

    private static ResponseEntity<ProblemDetail> respond(ProblemDetail problem) {
        return ResponseEntity.status(problem.getStatus()).body(problem);
    }
}
