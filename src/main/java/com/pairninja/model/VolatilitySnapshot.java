package com.pairninja.model;

/**
 * Realized volatility per leg; a leg is null until its return window is full.
 */
public final class VolatilitySnapshot {

    private final Double volEth;
    private final Double volBtc;

    public VolatilitySnapshot(Double volEth, Double volBtc) {
        if ((volEth != null && volEth < 0) || (volBtc != null && volBtc < 0)) {
            throw new IllegalArgumentException("Volatility must be >= 0");
        }
        this.volEth = volEth;
        this.volBtc = volBtc;
    }

    public boolean isReady() {
        return volEth != null && volBtc != null;
    }

    public Double getVolEth() {
        return volEth;
    }

    public Double getVolBtc() {
        return volBtc;
    }
}
