package com.pairninja.config;

/**
 * Exchange trading rules for one instrument.
 */
public class InstrumentConstraints {

    public double minQty = 0.01;
    public double minNotional = 10.0;
    public double stepSize = 0.001;
    public double tickSize = 0.1;
    public int qtyPrecision = 3;
    public int pricePrecision = 1;
    public QtyRoundingMode roundingMode = QtyRoundingMode.FLOOR;

    public InstrumentConstraints copy() {
        InstrumentConstraints copy = new InstrumentConstraints();
        copy.minQty = minQty;
        copy.minNotional = minNotional;
        copy.stepSize = stepSize;
        copy.tickSize = tickSize;
        copy.qtyPrecision = qtyPrecision;
        copy.pricePrecision = pricePrecision;
        copy.roundingMode = roundingMode;
        return copy;
    }

    @Override
    public String toString() {
        return "InstrumentConstraints{minQty=" + minQty + ", minNotional=" + minNotional + ", step=" + stepSize
                + ", tick=" + tickSize + ", qtyPrecision=" + qtyPrecision + ", rounding=" + roundingMode + "}";
    }
}
