package com.taxengine.api;

import com.taxengine.audit.CalculationError;
import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.ErrorType;
import com.taxengine.contract.RuleEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Unified error responses.
 *
 * Admin and ingestion errors use:
 * {
 *   "error_code": "CONTRACT_VIOLATION",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 *
 * Calculation failures use the error taxonomy:
 * {
 *   "errorType": "variable_missing",
 *   "message": "...",
 *   "failedStep": "resolving_variables",
 *   "executionId": "..."
 * }
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ContractViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleContractViolation(ContractViolationException ex) {
        log.warn("Contract violation: {}", ex.getMessage());
        return errorResponse("CONTRACT_VIOLATION", ex.getMessage());
    }

    @ExceptionHandler(DuplicateEvidenceException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleDuplicateEvidence(DuplicateEvidenceException ex) {
        log.warn("Duplicate evidence: {}", ex.getMessage());
        return errorResponse("DUPLICATE_EVIDENCE", ex.getMessage());
    }

    @ExceptionHandler(AggregationInProgressException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleAggregationInProgress(AggregationInProgressException ex) {
        Map<String, Object> body = errorResponse("AGGREGATION_IN_PROGRESS", ex.getMessage());
        body.put("active_run_id", ex.getActiveRunId());
        return body;
    }

    @ExceptionHandler(NoSuchElementException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NoSuchElementException ex) {
        return errorResponse("NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(CalculationFailedException.class)
    public ResponseEntity<Map<String, Object>> handleCalculationFailed(CalculationFailedException ex) {
        CalculationError error = ex.getError();
        return ResponseEntity.status(statusFor(error.errorType()))
            .body(calculationError(error.errorType(), error.message(), error.failedStep(), error.executionId()));
    }

    @ExceptionHandler(RuleEngineException.class)
    public ResponseEntity<Map<String, Object>> handleRuleEngine(RuleEngineException ex) {
        return ResponseEntity.status(statusFor(ex.getErrorType()))
            .body(calculationError(ex.getErrorType(), ex.getMessage(), ex.getFailedStep(), null));
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

    private static HttpStatus statusFor(ErrorType errorType) {
        if (errorType == ErrorType.DATABASE_ERROR) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (errorType == null || errorType == ErrorType.UNKNOWN_ERROR) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }

    private Map<String, Object> calculationError(ErrorType errorType, String message, String failedStep,
                                                 String executionId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("errorType", errorType != null ? errorType.getValue() : ErrorType.UNKNOWN_ERROR.getValue());
        body.put("message", message);
        body.put("failedStep", failedStep);
        body.put("executionId", executionId);
        return body;
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
