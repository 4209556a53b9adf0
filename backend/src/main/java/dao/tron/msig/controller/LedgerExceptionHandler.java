package dao.tron.msig.controller;

import dao.tron.msig.ledger.LedgerError;
import dao.tron.msig.ledger.LedgerException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class LedgerExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Map<String, Object>> handleLedgerException(LedgerException ex, HttpServletRequest request) {
        HttpStatus status = statusOf(ex.getError());
        if (ex.getError() == LedgerError.TRANSFER_FAILED) {
            log.error("Ledger operation failed [{}]: {}", request.getRequestURI(), ex.getMessage());
        } else {
            log.warn("Ledger operation rejected [{}]: {} {}", request.getRequestURI(), ex.getError(), ex.getMessage());
        }
        return error(status, ex.getError().name(), ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex,
                                                                HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message, request);
    }

    @ExceptionHandler({MissingRequestHeaderException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), request);
    }

    static HttpStatus statusOf(LedgerError error) {
        switch (error) {
            case NOT_OWNER:
                return HttpStatus.FORBIDDEN;
            case TX_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case ALREADY_CONFIRMED:
            case NOT_CONFIRMED:
            case ALREADY_EXECUTED:
            case INSUFFICIENT_CONFIRMATIONS:
            case TRANSFER_PENDING:
                return HttpStatus.CONFLICT;
            case TRANSFER_FAILED:
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message,
                                                             HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        body.put("path", request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
