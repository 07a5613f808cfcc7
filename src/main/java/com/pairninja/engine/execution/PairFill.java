package com.pairninja.engine.execution;

/**
 * Filled quantities of a completed two-leg operation, in submission order.
 */
public final class PairFill {

    private final double firstFilled;
    private final double secondFilled;

    public PairFill(double firstFilled, double secondFilled) {
        this.firstFilled = firstFilled;
        this.secondFilled = secondFilled;
    }

    public double getFirstFilled() {
        return firstFilled;
    }

    public double getSecondFilled() {
        return secondFilled;
    }
}
