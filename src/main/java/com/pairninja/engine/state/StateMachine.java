package com.pairninja.engine.state;

import com.pairninja.model.ExitReason;
import com.pairninja.model.PositionSnapshot;
import com.pairninja.model.StrategyState;
import com.pairninja.model.StrategyStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Owner of the strategy state. FLAT is initial; there is no terminal state.
 *
 * <pre>
 * FLAT        --enter-->          IN_POSITION
 * IN_POSITION --exit(TP, TIME)--> FLAT
 * IN_POSITION --exit(SL)-->       COOLDOWN (until now + cooldown hours)
 * COOLDOWN    --update(now)-->    FLAT once now >= cooldownUntil
 * </pre>
 *
 * Outside IN_POSITION the state may carry a residual leg left behind by a
 * failed hedge operation; {@link #flagResidual} records it and
 * {@link #clearResidual} drops it once repaired. No entry is allowed while a
 * residual is recorded.
 */
public class StateMachine {
    private static final Logger logger = LoggerFactory.getLogger(StateMachine.class);

    private final Duration cooldown;
    private StrategyState state = StrategyState.flat();

    public StateMachine(int cooldownHours) {
        if (cooldownHours < 0) {
            throw new IllegalArgumentException("Cooldown hours must be >= 0, got " + cooldownHours);
        }
        this.cooldown = Duration.ofHours(cooldownHours);
    }

    public StrategyState getState() {
        return state;
    }

    public StrategyStatus getStatus() {
        return state.getStatus();
    }

    public void enter(PositionSnapshot position, Instant now) {
        if (state.getStatus() != StrategyStatus.FLAT) {
            throw new InvalidTransitionException("enter is only valid from FLAT, current status " + state.getStatus());
        }
        if (state.hasResidual()) {
            throw new InvalidTransitionException("enter refused: unrepaired residual " + state.getPosition());
        }
        if (position == null || !position.isHedged()) {
            throw new InvalidTransitionException("enter requires a hedged position, got " + position);
        }
        state = StrategyState.inPosition(position);
        logger.info("📈 FLAT -> IN_POSITION at {}: {}", now, position);
    }

    public void exit(ExitReason reason, Instant now) {
        if (state.getStatus() != StrategyStatus.IN_POSITION) {
            throw new InvalidTransitionException("exit is only valid from IN_POSITION, current status "
                    + state.getStatus());
        }
        if (reason == ExitReason.STOP_LOSS) {
            Instant until = now.plus(cooldown);
            state = StrategyState.cooldown(until);
            logger.info("📉 IN_POSITION -> COOLDOWN ({}) until {}", reason, until);
        } else {
            state = StrategyState.flat();
            logger.info("📉 IN_POSITION -> FLAT ({})", reason);
        }
    }

    /**
     * Advance time-based transitions.
     *
     * @return true if the cooldown expired on this call
     */
    public boolean update(Instant now) {
        if (state.getStatus() == StrategyStatus.COOLDOWN && state.getCooldownUntil() != null
                && !now.isBefore(state.getCooldownUntil())) {
            state = new StrategyState(StrategyStatus.FLAT, state.getPosition(), null);
            logger.info("⏰ COOLDOWN -> FLAT at {}", now);
            return true;
        }
        return false;
    }

    /**
     * Replace the current state with a stored one after checking its invariants.
     *
     * @throws InvalidTransitionException if the stored state is inconsistent
     */
    public void hydrate(StrategyState stored) {
        validate(stored);
        PositionSnapshot position = stored.getPosition();
        if (position != null && position.isFlat()) {
            stored = stored.withPosition(null);
        }
        state = stored;
        logger.info("💾 State hydrated: {}", state);
    }

    /**
     * Record a residual leg outside IN_POSITION so it survives restarts until repaired.
     */
    public void flagResidual(PositionSnapshot residual) {
        if (state.getStatus() == StrategyStatus.IN_POSITION) {
            throw new InvalidTransitionException("flagResidual is not valid while IN_POSITION");
        }
        if (residual == null || !residual.hasResidual()) {
            throw new InvalidTransitionException("flagResidual requires exactly one open leg, got " + residual);
        }
        state = state.withPosition(residual);
        logger.warn("⚠️ Residual recorded: {}", residual);
    }

    public void clearResidual() {
        if (state.getStatus() == StrategyStatus.IN_POSITION) {
            throw new InvalidTransitionException("clearResidual is not valid while IN_POSITION");
        }
        if (state.getPosition() != null) {
            state = state.withPosition(null);
            logger.info("✅ Residual cleared");
        }
    }

    /**
     * Invariants every state must satisfy.
     */
    public static void validate(StrategyState candidate) {
        if (candidate == null) {
            throw new InvalidTransitionException("state is null");
        }
        PositionSnapshot position = candidate.getPosition();
        switch (candidate.getStatus()) {
            case IN_POSITION:
                if (position == null || !position.isHedged()) {
                    throw new InvalidTransitionException("IN_POSITION requires a hedged position, got " + position);
                }
                break;
            case COOLDOWN:
                if (candidate.getCooldownUntil() == null) {
                    throw new InvalidTransitionException("COOLDOWN requires cooldownUntil");
                }
                rejectHedged(candidate);
                break;
            case FLAT:
            default:
                rejectHedged(candidate);
                break;
        }
    }

    private static void rejectHedged(StrategyState candidate) {
        if (candidate.getPosition() != null && candidate.getPosition().isHedged()) {
            throw new InvalidTransitionException(candidate.getStatus() + " cannot hold a hedged position");
        }
    }
}
