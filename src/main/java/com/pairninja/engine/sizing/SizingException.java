package com.pairninja.engine.sizing;

/**
 * A trade could not be sized. The entry is abandoned for the bar.
 */
public class SizingException extends Exception {

    public SizingException(String message) {
        super(message);
    }
}
