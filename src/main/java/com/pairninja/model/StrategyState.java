package com.pairninja.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted strategy status. Immutable; the state machine swaps instances.
 *
 * Outside IN_POSITION the position, when present, is a residual that still
 * needs a repair order.
 */
public final class StrategyState {

    private static final StrategyState INITIAL = new StrategyState(StrategyStatus.FLAT, null, null);

    private final StrategyStatus status;
    private final PositionSnapshot position;
    private final Instant cooldownUntil;

    public StrategyState(StrategyStatus status, PositionSnapshot position, Instant cooldownUntil) {
        this.status = Objects.requireNonNull(status, "status");
        this.position = position;
        this.cooldownUntil = cooldownUntil;
    }

    public static StrategyState flat() {
        return INITIAL;
    }

    public static StrategyState inPosition(PositionSnapshot position) {
        return new StrategyState(StrategyStatus.IN_POSITION, position, null);
    }

    public static StrategyState cooldown(Instant until) {
        return new StrategyState(StrategyStatus.COOLDOWN, null, until);
    }

    public StrategyState withPosition(PositionSnapshot newPosition) {
        return new StrategyState(status, newPosition, cooldownUntil);
    }

    public boolean hasResidual() {
        return position != null && position.hasResidual();
    }

    public StrategyStatus getStatus() {
        return status;
    }

    public PositionSnapshot getPosition() {
        return position;
    }

    public Instant getCooldownUntil() {
        return cooldownUntil;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StrategyState)) {
            return false;
        }
        StrategyState other = (StrategyState) o;
        return status == other.status
                && Objects.equals(position, other.position)
                && Objects.equals(cooldownUntil, other.cooldownUntil);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, position, cooldownUntil);
    }

    @Override
    public String toString() {
        return "StrategyState{" + status + ", position=" + position + ", cooldownUntil=" + cooldownUntil + "}";
    }
}
