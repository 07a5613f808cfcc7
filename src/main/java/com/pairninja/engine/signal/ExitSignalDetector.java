package com.pairninja.engine.signal;

import com.pairninja.config.StrategyConfig;
import com.pairninja.model.ExitReason;
import com.pairninja.model.ExitSignal;
import com.pairninja.model.PositionSnapshot;
import com.pairninja.model.StrategyStatus;

import java.time.Instant;
import java.util.Optional;

/**
 * Priority-ordered exit detection, first match wins:
 * 1. STOP_LOSS when |z| >= slZ
 * 2. TAKE_PROFIT when |z| <= tpZ for tpConfirmBars consecutive bars (0 = immediately)
 * 3. TIME_STOP when the position has been held for maxHoldHours
 *
 * Take-profit confirmations belong to one position: the count restarts when
 * any exit fires and when a position with a different entry time shows up.
 */
public class ExitSignalDetector {

    private final double tpZ;
    private final double slZ;
    private final int maxHoldHours;
    private final int tpConfirmBars;
    private int tpCount;
    private Instant countedEntry;

    public ExitSignalDetector(double tpZ, double slZ, int maxHoldHours, int tpConfirmBars) {
        if (tpConfirmBars < 0 || maxHoldHours <= 0) {
            throw new IllegalArgumentException("Invalid exit parameters: maxHoldHours=" + maxHoldHours
                    + " tpConfirmBars=" + tpConfirmBars);
        }
        this.tpZ = tpZ;
        this.slZ = slZ;
        this.maxHoldHours = maxHoldHours;
        this.tpConfirmBars = tpConfirmBars;
    }

    public static ExitSignalDetector from(StrategyConfig config) {
        return new ExitSignalDetector(config.strategy.tpZ, config.strategy.slZ,
                config.risk.maxHoldHours, config.risk.tpConfirmBars);
    }

    public Optional<ExitSignal> evaluate(Double zscore, StrategyStatus status, PositionSnapshot position,
            Instant now) {
        if (status != StrategyStatus.IN_POSITION || position == null) {
            tpCount = 0;
            countedEntry = null;
            return Optional.empty();
        }
        if (!position.getEntryTime().equals(countedEntry)) {
            tpCount = 0;
            countedEntry = position.getEntryTime();
        }

        if (zscore != null) {
            double absZ = Math.abs(zscore);
            if (absZ >= slZ) {
                tpCount = 0;
                return Optional.of(new ExitSignal(ExitReason.STOP_LOSS, zscore));
            }
            if (absZ <= tpZ) {
                tpCount++;
                if (tpCount >= Math.max(1, tpConfirmBars)) {
                    tpCount = 0;
                    return Optional.of(new ExitSignal(ExitReason.TAKE_PROFIT, zscore));
                }
            } else {
                tpCount = 0;
            }
        } else {
            tpCount = 0;
        }

        if (position.holdingHours(now) >= maxHoldHours) {
            tpCount = 0;
            return Optional.of(new ExitSignal(ExitReason.TIME_STOP, zscore));
        }
        return Optional.empty();
    }

    /**
     * Consecutive take-profit confirmations collected so far.
     */
    public int getTpCount() {
        return tpCount;
    }
}
