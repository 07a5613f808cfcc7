package com.pairninja.infra;

import com.pairninja.model.StrategyState;

import java.util.Optional;

/**
 * Durable strategy state. One logical writer per strategy instance.
 */
public interface StateStore {

    void save(StrategyState state) throws StateStoreException;

    /**
     * @return the last saved state, empty if nothing was ever saved
     */
    Optional<StrategyState> load() throws StateStoreException;
}
