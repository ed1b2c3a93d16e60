package com.barthel.progcost.domain.exception;

/**
 * A lookup against the reference snapshot could not be satisfied.
 */
public abstract class ReferenceDataException extends CostingException {

    protected ReferenceDataException(String message) {
        super(message);
    }
}
