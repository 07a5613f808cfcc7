package com.pairninja.model;

public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * Side that flattens a signed position quantity.
     */
    public static OrderSide closing(double signedQty) {
        return signedQty > 0 ? SELL : BUY;
    }

    /**
     * +1 for BUY, -1 for SELL.
     */
    public double sign() {
        return this == BUY ? 1.0 : -1.0;
    }
}
