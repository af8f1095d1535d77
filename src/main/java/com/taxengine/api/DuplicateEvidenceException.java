package com.taxengine.api;

/**
 * Thrown when an evidence rule is submitted with an id that is already stored.
 */
public class DuplicateEvidenceException extends RuntimeException {

    public DuplicateEvidenceException(String evidenceId) {
        super("evidence id already exists: " + evidenceId);
    }
}
