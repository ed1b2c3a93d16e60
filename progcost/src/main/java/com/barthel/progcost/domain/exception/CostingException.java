package com.barthel.progcost.domain.exception;

/**
 * Root of all failures raised while costing a programme.
 */
public class CostingException extends RuntimeException {

    public CostingException(String message) {
        super(message);
    }

    public CostingException(String message, Throwable cause) {
        super(message, cause);
    }
}
