package com.taxengine.api;

import com.taxengine.audit.CalculationError;

/**
 * Thrown when a calculation ends in a recorded {@link CalculationError}.
 */
public class CalculationFailedException extends RuntimeException {

    private final CalculationError error;

    public CalculationFailedException(CalculationError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public CalculationError getError() {
        return error;
    }
}
