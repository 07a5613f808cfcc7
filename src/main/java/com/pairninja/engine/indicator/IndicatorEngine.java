package com.pairninja.engine.indicator;

import com.pairninja.config.StrategyConfig;
import com.pairninja.model.VolatilitySnapshot;
import com.pairninja.model.ZScoreSnapshot;

/**
 * Indicator state for one strategy instance: the relative-price z-score and
 * the per-leg volatility, updated together once per bar.
 */
public class IndicatorEngine {

    private final ZScoreCalculator zScoreCalculator;
    private final VolatilityCalculator volatilityCalculator;

    public IndicatorEngine(StrategyConfig config) {
        this.zScoreCalculator = new ZScoreCalculator(config.strategy.zWindow, config.sigmaFloor);
        this.volatilityCalculator = new VolatilityCalculator(config.position.volWindow);
    }

    public Reading update(double ethPrice, double btcPrice) {
        double r = IndicatorMath.relativePrice(ethPrice, btcPrice);
        ZScoreSnapshot zscore = zScoreCalculator.update(r);
        VolatilitySnapshot volatility = volatilityCalculator.update(ethPrice, btcPrice);
        return new Reading(zscore, volatility);
    }

    public static final class Reading {
        private final ZScoreSnapshot zscore;
        private final VolatilitySnapshot volatility;

        Reading(ZScoreSnapshot zscore, VolatilitySnapshot volatility) {
            this.zscore = zscore;
            this.volatility = volatility;
        }

        public ZScoreSnapshot getZscore() {
            return zscore;
        }

        public VolatilitySnapshot getVolatility() {
            return volatility;
        }
    }
}
