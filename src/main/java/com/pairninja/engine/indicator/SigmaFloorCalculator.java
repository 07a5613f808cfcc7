package com.pairninja.engine.indicator;

import com.pairninja.config.SigmaFloorMode;
import com.pairninja.config.StrategyConfig;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Lower bound for the rolling sigma.
 *
 * - CONST: a fixed value
 * - QUANTILE: the p-quantile of recent sigmas, once the sigma history is full
 * - EWMA_MIX: max of the quantile floor and the EWMA std of the r window,
 *   available once the quantile floor is
 */
public class SigmaFloorCalculator {

    public static final int BARS_PER_DAY = 96;

    private final SigmaFloorMode mode;
    private final double constValue;
    private final double quantileP;
    private final double ewmaHalfLife;
    private final RollingWindow sigmaHistory;

    public SigmaFloorCalculator(StrategyConfig.SigmaFloorParams params) {
        this.mode = params.mode;
        this.constValue = params.constValue;
        this.quantileP = params.quantileP;
        this.ewmaHalfLife = params.ewmaHalfLife;
        this.sigmaHistory = new RollingWindow(params.quantileWindowDays * BARS_PER_DAY);
    }

    /**
     * Record the latest raw sigma and return the floor for this bar.
     *
     * @param sigma   raw sample std of the r window
     * @param rValues r window contents, oldest first
     * @return the floor, or empty while the quantile history is filling up
     */
    public OptionalDouble update(double sigma, List<Double> rValues) {
        sigmaHistory.push(sigma);
        switch (mode) {
            case CONST:
                return OptionalDouble.of(constValue);
            case QUANTILE:
                return quantileFloor();
            case EWMA_MIX: {
                OptionalDouble quantile = quantileFloor();
                OptionalDouble ewma = IndicatorMath.ewmaStd(rValues, ewmaHalfLife);
                if (quantile.isEmpty() || ewma.isEmpty()) {
                    return OptionalDouble.empty();
                }
                return OptionalDouble.of(Math.max(quantile.getAsDouble(), ewma.getAsDouble()));
            }
            default:
                throw new IllegalStateException("Unknown sigma floor mode " + mode);
        }
    }

    private OptionalDouble quantileFloor() {
        if (!sigmaHistory.isFull()) {
            return OptionalDouble.empty();
        }
        return sigmaHistory.quantile(quantileP);
    }

    public SigmaFloorMode getMode() {
        return mode;
    }
}
