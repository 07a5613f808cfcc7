package com.pairninja.engine.sizing;

import com.pairninja.config.FundingMode;
import com.pairninja.config.StrategyConfig;
import com.pairninja.model.FundingRate;
import com.pairninja.model.FundingSnapshot;
import com.pairninja.model.Instrument;
import com.pairninja.model.TradeDirection;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FundingControllerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T00:00:00Z");

    private static FundingSnapshot funding(double ethRate, double btcRate) {
        return new FundingSnapshot(new FundingRate(Instrument.ETH_PERP, ethRate, NOW, 8),
                new FundingRate(Instrument.BTC_PERP, btcRate, NOW, 8));
    }

    private static StrategyConfig.FundingParams params(FundingMode... modes) {
        StrategyConfig.FundingParams params = new StrategyConfig.FundingParams();
        params.modes = new ArrayList<>(List.of(modes));
        params.costThreshold = 10.0;
        params.thresholdK = 100.0;
        params.sizeAlpha = 500.0;
        params.minSizeRatio = 0.3;
        return params;
    }

    @Test
    public void testLongEthPaysPositiveEthFundingAndShortBtcPaysNegative() {
        FundingSnapshot f = funding(0.0001, -0.0001);
        FundingCostEstimate estimate = FundingController.estimateCost(TradeDirection.LONG_ETH_SHORT_BTC,
                25_000.0, 25_000.0, f.getEth(), f.getBtc(), 48);
        // (2.5 + 2.5) per interval * 6 intervals
        assertEquals(6, estimate.getIntervals());
        assertEquals(30.0, estimate.getCost(), 1e-9);
        assertEquals(30.0 / 50_000.0, estimate.getNormalizedCost(), 1e-12);
    }

    @Test
    public void testReceivedFundingCountsAsZeroCost() {
        FundingSnapshot f = funding(0.0001, -0.0001);
        FundingCostEstimate estimate = FundingController.estimateCost(TradeDirection.SHORT_ETH_LONG_BTC,
                25_000.0, 25_000.0, f.getEth(), f.getBtc(), 48);
        assertEquals(0.0, estimate.getCost());
    }

    @Test
    public void testPartialIntervalRoundsUp() {
        FundingSnapshot f = funding(0.0001, 0.0);
        FundingCostEstimate estimate = FundingController.estimateCost(TradeDirection.LONG_ETH_SHORT_BTC,
                10_000.0, 10_000.0, f.getEth(), f.getBtc(), 9);
        assertEquals(2, estimate.getIntervals());
    }

    @Test
    public void testFilterVetoesExpensiveEntry() {
        FundingController controller = new FundingController(params(FundingMode.FILTER), 48);
        FundingDecision decision = controller.apply(TradeDirection.LONG_ETH_SHORT_BTC, 50_000.0, 1.5,
                25_000.0, 25_000.0, funding(0.0001, -0.0001));
        assertTrue(decision.isVeto());
        assertEquals(1.5, decision.getEffectiveEntryZ());
        assertEquals(50_000.0, decision.getCapital());
    }

    @Test
    public void testThresholdRaisesEntryZ() {
        FundingController controller = new FundingController(params(FundingMode.THRESHOLD), 48);
        FundingDecision decision = controller.apply(TradeDirection.LONG_ETH_SHORT_BTC, 50_000.0, 1.5,
                25_000.0, 25_000.0, funding(0.0001, -0.0001));
        assertFalse(decision.isVeto());
        assertEquals(1.5 + 100.0 * 0.0006, decision.getEffectiveEntryZ(), 1e-12);
    }

    @Test
    public void testSizeScalesCapitalWithFloor() {
        FundingController controller = new FundingController(params(FundingMode.SIZE), 48);
        FundingDecision decision = controller.apply(TradeDirection.LONG_ETH_SHORT_BTC, 50_000.0, 1.5,
                25_000.0, 25_000.0, funding(0.0001, -0.0001));
        // 1 - 500 * 0.0006 = 0.7
        assertEquals(35_000.0, decision.getCapital(), 1e-6);

        FundingDecision clamped = controller.apply(TradeDirection.LONG_ETH_SHORT_BTC, 50_000.0, 1.5,
                25_000.0, 25_000.0, funding(0.001, -0.001));
        assertEquals(50_000.0 * 0.3, clamped.getCapital(), 1e-6);
    }

    @Test
    public void testModesComposeRegardlessOfOrder() {
        FundingController a = new FundingController(params(FundingMode.SIZE, FundingMode.THRESHOLD), 48);
        FundingController b = new FundingController(params(FundingMode.THRESHOLD, FundingMode.SIZE), 48);
        FundingDecision da = a.apply(TradeDirection.LONG_ETH_SHORT_BTC, 50_000.0, 1.5, 25_000.0, 25_000.0,
                funding(0.0001, -0.0001));
        FundingDecision db = b.apply(TradeDirection.LONG_ETH_SHORT_BTC, 50_000.0, 1.5, 25_000.0, 25_000.0,
                funding(0.0001, -0.0001));
        assertEquals(da.getEffectiveEntryZ(), db.getEffectiveEntryZ());
        assertEquals(da.getCapital(), db.getCapital());
    }

    @Test
    public void testNoFundingDataLeavesEntryUnadjusted() {
        FundingController controller = new FundingController(
                params(FundingMode.FILTER, FundingMode.THRESHOLD, FundingMode.SIZE), 48);
        FundingDecision decision = controller.apply(TradeDirection.LONG_ETH_SHORT_BTC, 50_000.0, 1.5,
                25_000.0, 25_000.0, null);
        assertFalse(decision.isVeto());
        assertEquals(1.5, decision.getEffectiveEntryZ());
        assertEquals(50_000.0, decision.getCapital());
        assertNull(decision.getEstimate());
    }

    @Test
    public void testMismatchedIntervalsRejected() {
        FundingRate eth = new FundingRate(Instrument.ETH_PERP, 0.0001, NOW, 8);
        FundingRate btc = new FundingRate(Instrument.BTC_PERP, 0.0001, NOW, 4);
        assertThrows(IllegalArgumentException.class, () -> FundingController.estimateCost(
                TradeDirection.LONG_ETH_SHORT_BTC, 1.0, 1.0, eth, btc, 8));
    }
}
