package com.pairninja.engine.indicator;

import com.pairninja.model.InvalidPriceException;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Price transforms and the exponentially weighted standard deviation.
 */
public final class IndicatorMath {

    private IndicatorMath() {
    }

    /**
     * r = ln(eth) - ln(btc)
     */
    public static double relativePrice(double ethPrice, double btcPrice) {
        requirePositive("eth", ethPrice);
        requirePositive("btc", btcPrice);
        return Math.log(ethPrice) - Math.log(btcPrice);
    }

    public static double logReturn(double previous, double current) {
        requirePositive("previous", previous);
        requirePositive("current", current);
        return Math.log(current / previous);
    }

    /**
     * EWMA standard deviation with decay 0.5^(1/halfLife). Empty for fewer than
     * two values.
     */
    public static OptionalDouble ewmaStd(List<Double> values, double halfLife) {
        if (!(halfLife > 0)) {
            throw new IllegalArgumentException("Half-life must be > 0, got " + halfLife);
        }
        if (values.size() < 2) {
            return OptionalDouble.empty();
        }
        double decay = Math.pow(0.5, 1.0 / halfLife);
        double alpha = 1.0 - decay;
        double mean = values.get(0);
        double variance = 0.0;
        for (int i = 1; i < values.size(); i++) {
            double value = values.get(i);
            double delta = value - mean;
            mean += alpha * delta;
            double diff = value - mean;
            variance = alpha * diff * diff + (1.0 - alpha) * variance;
        }
        return OptionalDouble.of(Math.sqrt(variance));
    }

    private static void requirePositive(String label, double price) {
        if (!(price > 0) || Double.isInfinite(price)) {
            throw new InvalidPriceException(label + " price must be > 0, got " + price);
        }
    }
}
