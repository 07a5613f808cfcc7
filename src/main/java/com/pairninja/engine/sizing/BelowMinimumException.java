package com.pairninja.engine.sizing;

/**
 * Quantity or notional below the instrument minimum under the SKIP policy.
 */
public class BelowMinimumException extends SizingException {

    public BelowMinimumException(String message) {
        super(message);
    }
}
