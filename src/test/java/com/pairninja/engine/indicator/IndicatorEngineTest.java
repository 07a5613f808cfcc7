package com.pairninja.engine.indicator;

import com.pairninja.config.StrategyConfig;
import com.pairninja.model.InvalidPriceException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IndicatorEngineTest {

    private static StrategyConfig smallConfig() {
        StrategyConfig config = new StrategyConfig();
        config.strategy.zWindow = 5;
        config.position.volWindow = 4;
        return config.validate();
    }

    @Test
    public void testVolatilityReadyAfterWindowPlusOneBars() {
        IndicatorEngine engine = new IndicatorEngine(smallConfig());
        IndicatorEngine.Reading reading = null;
        for (int i = 0; i < 4; i++) {
            reading = engine.update(3000.0 + i * 10, 60000.0 - i * 50);
            assertFalse(reading.getVolatility().isReady(), "vol ready at bar " + i);
        }
        reading = engine.update(3050.0, 59700.0);
        assertTrue(reading.getVolatility().isReady());
        assertTrue(reading.getZscore().isReady());
    }

    @Test
    public void testRelativePriceReported() {
        IndicatorEngine engine = new IndicatorEngine(smallConfig());
        IndicatorEngine.Reading reading = engine.update(3000.0, 60000.0);
        assertEquals(Math.log(3000.0) - Math.log(60000.0), reading.getZscore().getR(), 1e-12);
    }

    @Test
    public void testRejectsBadPrice() {
        IndicatorEngine engine = new IndicatorEngine(smallConfig());
        assertThrows(InvalidPriceException.class, () -> engine.update(0.0, 60000.0));
    }

    @Test
    public void testVolatilityCalculatorMatchesSampleStdOfReturns() {
        VolatilityCalculator calculator = new VolatilityCalculator(2);
        calculator.update(100.0, 100.0);
        calculator.update(110.0, 100.0);
        double volEth = calculator.update(99.0, 100.0).getVolEth();

        double r1 = Math.log(1.1);
        double r2 = Math.log(0.9);
        double mean = (r1 + r2) / 2;
        double expected = Math.sqrt(((r1 - mean) * (r1 - mean) + (r2 - mean) * (r2 - mean)) / 1);
        assertEquals(expected, volEth, 1e-12);
    }
}
