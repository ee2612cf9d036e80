package com.whodunit.api;

import com.whodunit.contract.ConfigurationException;
import com.whodunit.engine.EngineFaultException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps game generation failures onto {@code {error_code, message, timestamp}}
 * bodies.
 *
 * A rejected configuration is the caller's fault (400, CONFIGURATION_ERROR).
 * An engine fault means the game itself broke, e.g. the knowledge base ran
 * out of suspects or no convergence within the attempt bound; it is a 500
 * and names the {@link com.whodunit.engine.FaultKind} in {@code fault_kind}
 * so batch clients can tell an exhausted seed from a solver failure.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConfigurationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleConfiguration(ConfigurationException ex) {
        log.warn("Configuration rejected: {}", ex.getMessage());
        return errorResponse("CONFIGURATION_ERROR", ex.getMessage());
    }

    @ExceptionHandler(EngineFaultException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleEngineFault(EngineFaultException ex) {
        log.error("Engine fault {}: {}", ex.getKind(), ex.getMessage());
        Map<String, Object> body = errorResponse("ENGINE_FAULT", ex.getMessage());
        body.put("fault_kind", ex.getKind().name());
        return body;
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
