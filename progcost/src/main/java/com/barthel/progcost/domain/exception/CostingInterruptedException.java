package com.barthel.progcost.domain.exception;

/**
 * The calling thread was interrupted while a run was in progress.
 */
public class CostingInterruptedException extends CostingException {

    public CostingInterruptedException(int year) {
        super("Costing interrupted before year " + year);
    }
}
