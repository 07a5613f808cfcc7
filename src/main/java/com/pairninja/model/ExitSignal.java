package com.pairninja.model;

/**
 * A detected exit. The z-score is null when the exit was decided without one
 * (time stop while indicators are cold).
 */
public final class ExitSignal {

    private final ExitReason reason;
    private final Double zscore;

    public ExitSignal(ExitReason reason, Double zscore) {
        this.reason = reason;
        this.zscore = zscore;
    }

    public ExitReason getReason() {
        return reason;
    }

    public Double getZscore() {
        return zscore;
    }

    @Override
    public String toString() {
        return "ExitSignal{" + reason + ", z=" + zscore + "}";
    }
}
