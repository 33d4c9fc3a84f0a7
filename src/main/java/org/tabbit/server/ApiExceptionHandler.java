package org.tabbit.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.tabbit.compute.ConfigurationException;
import org.tabbit.compute.DataIntegrityException;
import org.tabbit.compute.InfeasibleException;
import org.tabbit.runner.RoundStateException;
import org.tabbit.store.TournamentNotFoundException;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TournamentNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(TournamentNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ApiErrorResponse("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(DataIntegrityException.class)
    public ResponseEntity<ApiErrorResponse> handleDataIntegrity(DataIntegrityException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ApiErrorResponse("DATA_INTEGRITY", ex.getMessage()));
    }

    @ExceptionHandler(InfeasibleException.class)
    public ResponseEntity<ApiErrorResponse> handleInfeasible(InfeasibleException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("constraint", ex.constraint());
        details.put("roomRank", ex.roomRank());
        details.put("teamIds", ex.teamIds());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ApiErrorResponse("INFEASIBLE", ex.getMessage(), details));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ApiErrorResponse> handleConfiguration(ConfigurationException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ApiErrorResponse("CONFIGURATION", ex.getMessage(),
                Map.<String, Object>of("problems", ex.problems())));
    }

    @ExceptionHandler(RoundStateException.class)
    public ResponseEntity<ApiErrorResponse> handleRoundState(RoundStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ApiErrorResponse("ROUND_STATE", ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, Object> fields = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
            .forEach(error -> fields.put(error.getField(), error.getDefaultMessage()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ApiErrorResponse("VALIDATION", "request validation failed", fields));
    }

    /**
     * Out-of-range paging parameters.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ApiErrorResponse("VALIDATION", ex.getMessage()));
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<ApiErrorResponse> handleStorage(UncheckedIOException ex) {
        log.error("Storage failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiErrorResponse("STORAGE", ex.getMessage()));
    }
}
