package com.pairninja.engine.sizing;

import com.pairninja.config.CapitalMode;
import com.pairninja.config.ConfigException;
import com.pairninja.config.StrategyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Risk-parity allocation of pair capital between the two legs.
 *
 * Features:
 * - Inverse-volatility weights, equal weights when a volatility is missing or zero
 * - FIXED_NOTIONAL or EQUITY_RATIO capital, capped by an optional max notional
 */
public class PositionSizer {
    private static final Logger logger = LoggerFactory.getLogger(PositionSizer.class);

    private final StrategyConfig.PositionParams params;

    public PositionSizer(StrategyConfig.PositionParams params) {
        this.params = params;
    }

    /**
     * w_eth = (1/vol_eth) / (1/vol_eth + 1/vol_btc), w_btc = 1 - w_eth.
     */
    public static Weights riskParityWeights(Double volEth, Double volBtc) {
        if (volEth == null || volBtc == null || !(volEth > 0) || !(volBtc > 0)) {
            return Weights.EQUAL;
        }
        double invEth = 1.0 / volEth;
        double invBtc = 1.0 / volBtc;
        double wEth = invEth / (invEth + invBtc);
        return new Weights(wEth, 1.0 - wEth);
    }

    /**
     * Capital allocated to one pair trade.
     *
     * @param equity current account equity, required for EQUITY_RATIO, ignored otherwise
     * @throws SizingException when the capital is not positive or exceeds the max notional
     */
    public double computeCapital(Double equity) throws SizingException {
        double capital;
        if (params.capitalMode == CapitalMode.FIXED_NOTIONAL) {
            if (params.capitalValue == null) {
                throw new ConfigException("position.capital.value", "required for FIXED_NOTIONAL");
            }
            capital = params.capitalValue;
        } else {
            if (params.equityRatioK == null) {
                throw new ConfigException("position.equity.ratio.k", "required for EQUITY_RATIO");
            }
            if (equity == null) {
                throw new SizingException("Account equity is required for EQUITY_RATIO sizing");
            }
            capital = equity * params.equityRatioK;
        }
        if (!(capital > 0)) {
            throw new SizingException("Capital must be > 0, got " + capital);
        }
        if (params.maxNotional != null && capital > params.maxNotional) {
            logger.warn("⚠️ Capital {} exceeds max notional {}", capital, params.maxNotional);
            throw new SizingException("Capital " + capital + " exceeds max notional " + params.maxNotional);
        }
        return capital;
    }

    public static final class Weights {
        static final Weights EQUAL = new Weights(0.5, 0.5);

        private final double eth;
        private final double btc;

        public Weights(double eth, double btc) {
            this.eth = eth;
            this.btc = btc;
        }

        public double getEth() {
            return eth;
        }

        public double getBtc() {
            return btc;
        }

        @Override
        public String toString() {
            return String.format("Weights{eth=%.4f, btc=%.4f}", eth, btc);
        }
    }
}
