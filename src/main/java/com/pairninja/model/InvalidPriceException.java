package com.pairninja.model;

/**
 * A price that cannot be used: missing, non-positive or not finite.
 */
public class InvalidPriceException extends IllegalArgumentException {

    public InvalidPriceException(String message) {
        super(message);
    }
}
