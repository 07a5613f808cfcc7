package com.pairninja.model;

import java.util.Objects;

/**
 * One side of the pair. Quantity is signed: long > 0, short < 0.
 */
public final class PositionLeg {

    private static final PositionLeg FLAT = new PositionLeg(0.0, 0.0, 0.0);

    private final double quantity;
    private final double avgPrice;
    private final double notional;

    public PositionLeg(double quantity, double avgPrice, double notional) {
        this.quantity = quantity;
        this.avgPrice = avgPrice;
        this.notional = notional;
    }

    public static PositionLeg flat() {
        return FLAT;
    }

    public boolean isFlat() {
        return quantity == 0.0;
    }

    public double getQuantity() {
        return quantity;
    }

    public double getAvgPrice() {
        return avgPrice;
    }

    public double getNotional() {
        return notional;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PositionLeg)) {
            return false;
        }
        PositionLeg other = (PositionLeg) o;
        return Double.compare(quantity, other.quantity) == 0
                && Double.compare(avgPrice, other.avgPrice) == 0
                && Double.compare(notional, other.notional) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(quantity, avgPrice, notional);
    }

    @Override
    public String toString() {
        return "Leg{qty=" + quantity + ", avg=" + avgPrice + ", notional=" + notional + "}";
    }
}
