package com.taxengine.api;

/**
 * Thrown when aggregation is requested for a (tax type, target date) that already
 * has a queued or running aggregation.
 */
public class AggregationInProgressException extends RuntimeException {

    private final String activeRunId;

    public AggregationInProgressException(String key, String activeRunId) {
        super("aggregation already in progress for " + key + " (run " + activeRunId + ")");
        this.activeRunId = activeRunId;
    }

    public String getActiveRunId() {
        return activeRunId;
    }
}
