package com.pairninja.infra;

import com.pairninja.model.StrategyState;

import java.util.Optional;

/**
 * Volatile state store for backtests and tests.
 */
public class InMemoryStateStore implements StateStore {

    private StrategyState state;
    private int saveCount;

    @Override
    public synchronized void save(StrategyState state) {
        this.state = state;
        saveCount++;
    }

    @Override
    public synchronized Optional<StrategyState> load() {
        return Optional.ofNullable(state);
    }

    public synchronized int getSaveCount() {
        return saveCount;
    }
}
