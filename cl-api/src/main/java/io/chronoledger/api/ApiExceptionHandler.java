package io.chronoledger.api;

import io.chronoledger.core.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(EntityNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(EntityNotFoundException e) {
        return body("NOT_FOUND", e);
    }

    @ExceptionHandler({UnknownEntityTypeException.class, CompositeIntegrityException.class, IllegalArgumentException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(RuntimeException e) {
        return body("BAD_REQUEST", e);
    }

    @ExceptionHandler({UnscopedMutationException.class, ActivityRequiredException.class})
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleRejected(TemporalException e) {
        log.warn("Rejected change: {}", e.getMessage());
        return body("REJECTED", e);
    }

    @ExceptionHandler({ConcurrentEntityModificationException.class, DuplicateActivityException.class,
            OutOfOrderException.class, TemporalDeleteException.class})
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleConflict(TemporalException e) {
        log.warn("Conflict: {}", e.getMessage());
        return body("CONFLICT", e);
    }

    private static Map<String, Object> body(String error, Exception e) {
        return Map.of(
                "error", error,
                "message", String.valueOf(e.getMessage())
        );
    }
}
