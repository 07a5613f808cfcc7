package com.pairninja.engine.sizing;

import com.pairninja.config.CapitalMode;
import com.pairninja.config.StrategyConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PositionSizerTest {

    @Test
    public void testRiskParityWeightsFavorCalmerLeg() {
        // ETH twice as volatile as BTC -> ETH gets a third
        PositionSizer.Weights weights = PositionSizer.riskParityWeights(0.02, 0.01);
        assertEquals(1.0 / 3.0, weights.getEth(), 1e-12);
        assertEquals(2.0 / 3.0, weights.getBtc(), 1e-12);
        assertEquals(1.0, weights.getEth() + weights.getBtc(), 1e-12);
    }

    @Test
    public void testEqualWeightsWhenVolatilityMissingOrZero() {
        assertEquals(0.5, PositionSizer.riskParityWeights(null, 0.01).getEth());
        assertEquals(0.5, PositionSizer.riskParityWeights(0.0, 0.01).getEth());
        assertEquals(0.5, PositionSizer.riskParityWeights(0.01, Double.NaN).getBtc());
    }

    @Test
    public void testFixedNotionalCapital() throws SizingException {
        StrategyConfig.PositionParams params = new StrategyConfig.PositionParams();
        params.capitalMode = CapitalMode.FIXED_NOTIONAL;
        params.capitalValue = 50_000.0;
        assertEquals(50_000.0, new PositionSizer(params).computeCapital(null));
    }

    @Test
    public void testEquityRatioCapital() throws SizingException {
        StrategyConfig.PositionParams params = new StrategyConfig.PositionParams();
        params.capitalMode = CapitalMode.EQUITY_RATIO;
        params.equityRatioK = 0.25;
        PositionSizer sizer = new PositionSizer(params);

        assertEquals(25_000.0, sizer.computeCapital(100_000.0), 1e-9);
        assertThrows(SizingException.class, () -> sizer.computeCapital(null));
        assertThrows(SizingException.class, () -> sizer.computeCapital(0.0));
    }

    @Test
    public void testMaxNotionalIsAHardCap() {
        StrategyConfig.PositionParams params = new StrategyConfig.PositionParams();
        params.capitalMode = CapitalMode.FIXED_NOTIONAL;
        params.capitalValue = 50_000.0;
        params.maxNotional = 40_000.0;
        assertThrows(SizingException.class, () -> new PositionSizer(params).computeCapital(null));
    }
}
