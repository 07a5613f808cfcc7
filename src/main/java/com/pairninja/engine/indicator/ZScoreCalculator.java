package com.pairninja.engine.indicator;

import com.pairninja.config.StrategyConfig;
import com.pairninja.model.ZScoreSnapshot;

import java.util.OptionalDouble;

/**
 * Rolling z-score of the relative price.
 *
 * sigmaEff = max(sigma, floor, EPSILON) keeps quiet regimes from blowing up
 * the score. Until the window is full, and while the floor is not yet
 * available, only r is reported.
 */
public class ZScoreCalculator {

    public static final double EPSILON = 1e-12;

    private final RollingWindow window;
    private final SigmaFloorCalculator sigmaFloor;

    public ZScoreCalculator(int windowSize, StrategyConfig.SigmaFloorParams floorParams) {
        this.window = new RollingWindow(windowSize);
        this.sigmaFloor = new SigmaFloorCalculator(floorParams);
    }

    public ZScoreSnapshot update(double r) {
        window.push(r);
        if (!window.isFull()) {
            return ZScoreSnapshot.warmingUp(r);
        }
        OptionalDouble sigmaValue = window.sampleStd();
        if (sigmaValue.isEmpty()) {
            return ZScoreSnapshot.warmingUp(r);
        }
        double mean = window.mean().getAsDouble();
        double sigma = sigmaValue.getAsDouble();
        OptionalDouble floor = sigmaFloor.update(sigma, window.values());
        if (floor.isEmpty()) {
            return new ZScoreSnapshot(r, mean, sigma, null, null, null);
        }
        double sigmaEff = Math.max(Math.max(sigma, floor.getAsDouble()), EPSILON);
        double zscore = (r - mean) / sigmaEff;
        return new ZScoreSnapshot(r, mean, sigma, floor.getAsDouble(), sigmaEff, zscore);
    }

    public boolean isWarm() {
        return window.isFull();
    }
}
