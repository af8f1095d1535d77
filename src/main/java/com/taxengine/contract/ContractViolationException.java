package com.taxengine.contract;

/**
 * Thrown when a request or an ingested record breaks the data contract.
 */
public class ContractViolationException extends RuntimeException {

    public ContractViolationException(String message) {
        super(message);
    }
}
