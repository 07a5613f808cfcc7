package com.pairninja.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Periodic funding observation for one perpetual.
 */
public final class FundingRate {

    private final Instrument symbol;
    private final double rate;
    private final Instant timestamp;
    private final int intervalHours;

    public FundingRate(Instrument symbol, double rate, Instant timestamp, int intervalHours) {
        if (intervalHours <= 0) {
            throw new IllegalArgumentException("Funding interval must be > 0 hours, got " + intervalHours);
        }
        if (Double.isNaN(rate) || Double.isInfinite(rate)) {
            throw new IllegalArgumentException("Funding rate must be finite, got " + rate);
        }
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.rate = rate;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.intervalHours = intervalHours;
    }

    public Instrument getSymbol() {
        return symbol;
    }

    public double getRate() {
        return rate;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public int getIntervalHours() {
        return intervalHours;
    }

    @Override
    public String toString() {
        return "FundingRate{" + symbol + " " + rate + " / " + intervalHours + "h @ " + timestamp + "}";
    }
}
