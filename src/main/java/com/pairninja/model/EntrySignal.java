package com.pairninja.model;

public final class EntrySignal {

    private final TradeDirection direction;
    private final double zscore;

    public EntrySignal(TradeDirection direction, double zscore) {
        this.direction = direction;
        this.zscore = zscore;
    }

    public TradeDirection getDirection() {
        return direction;
    }

    public double getZscore() {
        return zscore;
    }

    @Override
    public String toString() {
        return "EntrySignal{" + direction + ", z=" + zscore + "}";
    }
}
