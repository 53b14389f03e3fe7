package dao.gaszero.relayer.controller;

import dao.gaszero.relayer.chain.ChainClientException;
import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.service.RelayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps failures raised outside the relay engine (binding, mapping, deposits, sponsorship) to
 * {@code {success:false, error, kind}}.
 */
@Slf4j
@RestControllerAdvice
public class RelayExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .orElse("Validation failed");
        return RelayResponses.error(RelayErrorKind.VALIDATION_ERROR, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return RelayResponses.error(RelayErrorKind.VALIDATION_ERROR, "Malformed request body");
    }

    @ExceptionHandler(RelayException.class)
    public ResponseEntity<Map<String, Object>> handleRelay(RelayException ex) {
        return RelayResponses.error(ex.getKind(), ex.getMessage());
    }

    @ExceptionHandler(ChainClientException.class)
    public ResponseEntity<Map<String, Object>> handleChain(ChainClientException ex) {
        log.warn("Chain call failed: {}", ex.getMessage());
        return RelayResponses.error(RelayErrorKind.CHAIN_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return RelayResponses.error(RelayErrorKind.INTERNAL_ERROR, "Internal error");
    }
}
