package com.pairninja.engine.indicator;

import com.pairninja.config.SigmaFloorMode;
import com.pairninja.config.StrategyConfig;
import com.pairninja.model.ZScoreSnapshot;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ZScoreCalculatorTest {

    private static StrategyConfig.SigmaFloorParams constFloor(double value) {
        StrategyConfig.SigmaFloorParams params = new StrategyConfig.SigmaFloorParams();
        params.mode = SigmaFloorMode.CONST;
        params.constValue = value;
        return params;
    }

    @Test
    public void testWarmingUpUntilWindowFull() {
        ZScoreCalculator calculator = new ZScoreCalculator(3, constFloor(1e-6));
        assertFalse(calculator.update(0.1).isReady());
        assertFalse(calculator.update(0.2).isReady());
        ZScoreSnapshot snapshot = calculator.update(0.3);
        assertTrue(snapshot.isReady());
        assertTrue(calculator.isWarm());
    }

    @Test
    public void testZScoreUsesSampleStd() {
        ZScoreCalculator calculator = new ZScoreCalculator(3, constFloor(1e-6));
        calculator.update(0.1);
        calculator.update(0.2);
        ZScoreSnapshot snapshot = calculator.update(0.3);

        // mean 0.2, sample std 0.1
        assertEquals(0.2, snapshot.getMean(), 1e-12);
        assertEquals(0.1, snapshot.getSigma(), 1e-12);
        assertEquals(0.1, snapshot.getSigmaEff(), 1e-12);
        assertEquals(1.0, snapshot.getZscore(), 1e-9);
    }

    @Test
    public void testFloorCapsScoreInQuietRegime() {
        ZScoreCalculator calculator = new ZScoreCalculator(3, constFloor(0.5));
        calculator.update(0.1);
        calculator.update(0.2);
        ZScoreSnapshot snapshot = calculator.update(0.3);

        assertEquals(0.5, snapshot.getSigmaEff(), 1e-12);
        assertEquals(0.2, snapshot.getZscore(), 1e-9);
    }

    @Test
    public void testFlatSeriesDoesNotDivideByZero() {
        StrategyConfig.SigmaFloorParams params = constFloor(1e-6);
        ZScoreCalculator calculator = new ZScoreCalculator(4, params);
        ZScoreSnapshot snapshot = null;
        for (int i = 0; i < 4; i++) {
            snapshot = calculator.update(0.05);
        }
        assertEquals(0.0, snapshot.getZscore(), 1e-6);
        assertFalse(Double.isNaN(snapshot.getZscore()));
    }
}
