package com.pairninja.infra;

/**
 * Price or funding data could not be fetched or is inconsistent.
 */
public class MarketDataException extends Exception {

    public MarketDataException(String message) {
        super(message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
