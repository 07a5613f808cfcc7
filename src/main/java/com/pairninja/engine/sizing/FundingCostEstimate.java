package com.pairninja.engine.sizing;

/**
 * Estimated funding paid over a holding horizon.
 */
public final class FundingCostEstimate {

    private final double cost;
    private final double normalizedCost;
    private final int intervals;

    public FundingCostEstimate(double cost, double normalizedCost, int intervals) {
        this.cost = cost;
        this.normalizedCost = normalizedCost;
        this.intervals = intervals;
    }

    /**
     * Funding paid in quote currency, never negative (received funding counts as zero).
     */
    public double getCost() {
        return cost;
    }

    /**
     * Cost as a fraction of total pair notional.
     */
    public double getNormalizedCost() {
        return normalizedCost;
    }

    public int getIntervals() {
        return intervals;
    }

    @Override
    public String toString() {
        return "FundingCostEstimate{cost=" + cost + ", normalized=" + normalizedCost + ", intervals=" + intervals + "}";
    }
}
