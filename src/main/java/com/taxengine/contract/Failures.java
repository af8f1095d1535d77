package com.taxengine.contract;

import org.springframework.dao.DataAccessException;

/**
 * Maps any failure onto the error taxonomy.
 */
public final class Failures {

    private Failures() {
    }

    public static ErrorType classify(Throwable failure) {
        if (failure instanceof RuleEngineException engine) {
            return engine.getErrorType();
        }
        if (failure instanceof DataAccessException) {
            return ErrorType.DATABASE_ERROR;
        }
        return ErrorType.UNKNOWN_ERROR;
    }
}
