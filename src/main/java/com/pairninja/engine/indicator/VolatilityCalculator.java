package com.pairninja.engine.indicator;

import com.pairninja.model.VolatilitySnapshot;

/**
 * Per-leg realized volatility: sample std of the last n log returns.
 */
public class VolatilityCalculator {

    private final RollingWindow ethReturns;
    private final RollingWindow btcReturns;
    private Double lastEth;
    private Double lastBtc;

    public VolatilityCalculator(int windowSize) {
        this.ethReturns = new RollingWindow(windowSize);
        this.btcReturns = new RollingWindow(windowSize);
    }

    public VolatilitySnapshot update(double ethPrice, double btcPrice) {
        if (lastEth != null) {
            ethReturns.push(IndicatorMath.logReturn(lastEth, ethPrice));
        }
        if (lastBtc != null) {
            btcReturns.push(IndicatorMath.logReturn(lastBtc, btcPrice));
        }
        lastEth = ethPrice;
        lastBtc = btcPrice;
        return new VolatilitySnapshot(volatility(ethReturns), volatility(btcReturns));
    }

    private static Double volatility(RollingWindow returns) {
        if (!returns.isFull()) {
            return null;
        }
        return returns.sampleStd().isPresent() ? returns.sampleStd().getAsDouble() : null;
    }
}
