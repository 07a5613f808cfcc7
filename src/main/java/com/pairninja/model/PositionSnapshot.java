package com.pairninja.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An open (or partially open) pair position.
 *
 * Both legs zero is flat, both nonzero is hedged. Exactly one nonzero leg is a
 * residual: an error state that has to be repaired.
 */
public final class PositionSnapshot {

    private final TradeDirection direction;
    private final Instant entryTime;
    private final PositionLeg eth;
    private final PositionLeg btc;

    public PositionSnapshot(TradeDirection direction, Instant entryTime, PositionLeg eth, PositionLeg btc) {
        this.direction = Objects.requireNonNull(direction, "direction");
        this.entryTime = Objects.requireNonNull(entryTime, "entryTime");
        this.eth = Objects.requireNonNull(eth, "eth leg");
        this.btc = Objects.requireNonNull(btc, "btc leg");
    }

    public boolean isFlat() {
        return eth.isFlat() && btc.isFlat();
    }

    public boolean isHedged() {
        return !eth.isFlat() && !btc.isFlat();
    }

    public boolean hasResidual() {
        return eth.isFlat() != btc.isFlat();
    }

    public PositionLeg leg(Instrument instrument) {
        return instrument == Instrument.ETH_PERP ? eth : btc;
    }

    /**
     * Hours since entry, fractional.
     */
    public double holdingHours(Instant now) {
        long seconds = Duration.between(entryTime, now).getSeconds();
        return Math.max(0L, seconds) / 3600.0;
    }

    public PositionSnapshot withLeg(Instrument instrument, PositionLeg leg) {
        return instrument == Instrument.ETH_PERP
                ? new PositionSnapshot(direction, entryTime, leg, btc)
                : new PositionSnapshot(direction, entryTime, eth, leg);
    }

    public TradeDirection getDirection() {
        return direction;
    }

    public Instant getEntryTime() {
        return entryTime;
    }

    public PositionLeg getEth() {
        return eth;
    }

    public PositionLeg getBtc() {
        return btc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PositionSnapshot)) {
            return false;
        }
        PositionSnapshot other = (PositionSnapshot) o;
        return direction == other.direction
                && entryTime.equals(other.entryTime)
                && eth.equals(other.eth)
                && btc.equals(other.btc);
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction, entryTime, eth, btc);
    }

    @Override
    public String toString() {
        return "Position{" + direction + " since " + entryTime + ", eth=" + eth + ", btc=" + btc + "}";
    }
}
