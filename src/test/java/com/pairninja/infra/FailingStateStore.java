package com.pairninja.infra;

import com.pairninja.model.StrategyState;

import java.util.Optional;

/**
 * In-memory store whose saves can be switched to fail.
 */
public class FailingStateStore implements StateStore {

    private StrategyState state;
    private boolean failing;

    public FailingStateStore(StrategyState initial) {
        this.state = initial;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public void save(StrategyState newState) throws StateStoreException {
        if (failing) {
            throw new StateStoreException("simulated write failure");
        }
        this.state = newState;
    }

    @Override
    public Optional<StrategyState> load() {
        return Optional.ofNullable(state);
    }
}
