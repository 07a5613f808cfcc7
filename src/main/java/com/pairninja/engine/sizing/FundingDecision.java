package com.pairninja.engine.sizing;

/**
 * Result of the funding controls for one candidate entry.
 */
public final class FundingDecision {

    private final boolean veto;
    private final double effectiveEntryZ;
    private final double capital;
    private final FundingCostEstimate estimate;

    public FundingDecision(boolean veto, double effectiveEntryZ, double capital, FundingCostEstimate estimate) {
        this.veto = veto;
        this.effectiveEntryZ = effectiveEntryZ;
        this.capital = capital;
        this.estimate = estimate;
    }

    /**
     * No funding data: nothing is adjusted.
     */
    public static FundingDecision unadjusted(double entryZ, double capital) {
        return new FundingDecision(false, entryZ, capital, null);
    }

    public boolean isVeto() {
        return veto;
    }

    public double getEffectiveEntryZ() {
        return effectiveEntryZ;
    }

    public double getCapital() {
        return capital;
    }

    /**
     * @return the estimate the decision was based on, or null without funding data
     */
    public FundingCostEstimate getEstimate() {
        return estimate;
    }
}
