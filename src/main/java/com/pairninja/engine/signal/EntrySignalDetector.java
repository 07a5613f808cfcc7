package com.pairninja.engine.signal;

import com.pairninja.model.EntrySignal;
import com.pairninja.model.StrategyStatus;
import com.pairninja.model.TradeDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Crossing-based entry detection.
 *
 * Fires only when |z| moves into the entry band [entryZ, slZ) from below
 * entryZ, so sitting inside the band never re-triggers. The previous |z| is
 * tracked on every bar, whatever the strategy status, and is forgotten when z
 * is unavailable. With no previous value there is nothing to cross from, so
 * the first observation never fires.
 */
public class EntrySignalDetector {
    private static final Logger logger = LoggerFactory.getLogger(EntrySignalDetector.class);

    private final double entryZ;
    private final double slZ;
    private Double previousAbsZ;

    public EntrySignalDetector(double entryZ, double slZ) {
        if (!(entryZ > 0) || !(entryZ < slZ)) {
            throw new IllegalArgumentException("Entry z must be in (0, slZ), got entryZ=" + entryZ + " slZ=" + slZ);
        }
        this.entryZ = entryZ;
        this.slZ = slZ;
    }

    public Optional<EntrySignal> evaluate(Double zscore, StrategyStatus status) {
        return evaluate(zscore, status, entryZ);
    }

    /**
     * @param effectiveEntryZ entry threshold for this bar, possibly raised by funding controls
     */
    public Optional<EntrySignal> evaluate(Double zscore, StrategyStatus status, double effectiveEntryZ) {
        Double previous = previousAbsZ;
        observe(zscore);
        if (zscore == null || previous == null || status != StrategyStatus.FLAT) {
            return Optional.empty();
        }
        double absZ = Math.abs(zscore);
        boolean crossed = previous < effectiveEntryZ && effectiveEntryZ <= absZ && absZ < slZ;
        if (!crossed) {
            return Optional.empty();
        }
        TradeDirection direction = TradeDirection.fromZScore(zscore);
        logger.debug("Entry crossing: |z| {} -> {} (threshold {}), direction {}",
                previous, absZ, effectiveEntryZ, direction);
        return Optional.of(new EntrySignal(direction, zscore));
    }

    /**
     * Track z without evaluating an entry (warm-up, bars outside FLAT).
     */
    public void observe(Double zscore) {
        previousAbsZ = zscore != null ? Math.abs(zscore) : null;
    }

    /**
     * Absolute z seen on the previous bar, null if unknown.
     */
    public Double getPreviousAbsZ() {
        return previousAbsZ;
    }

    public double getEntryZ() {
        return entryZ;
    }
}
