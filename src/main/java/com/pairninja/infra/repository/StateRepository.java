package com.pairninja.infra.repository;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOptions;
import com.pairninja.infra.DatabaseService;
import com.pairninja.infra.StateStore;
import com.pairninja.infra.StateStoreException;
import com.pairninja.model.StrategyState;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * MongoDB-backed state store: one document per strategy id in
 * {@code strategy_state}, replaced on every save.
 */
public class StateRepository implements StateStore {
    private static final Logger logger = LoggerFactory.getLogger(StateRepository.class);

    private final MongoCollection<Document> collection;
    private final String strategyId;

    public StateRepository(DatabaseService databaseService, String strategyId) {
        this(databaseService.collection(DatabaseService.STRATEGY_STATE), strategyId);
    }

    StateRepository(MongoCollection<Document> collection, String strategyId) {
        this.collection = collection;
        this.strategyId = strategyId;
    }

    @Override
    public void save(StrategyState state) throws StateStoreException {
        try {
            collection.replaceOne(Filters.eq("_id", strategyId),
                    StrategyStateMapper.toDocument(strategyId, state),
                    new ReplaceOptions().upsert(true));
            logger.debug("💾 State saved for {}: {}", strategyId, state);
        } catch (MongoException e) {
            throw new StateStoreException("Failed to save state for " + strategyId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<StrategyState> load() throws StateStoreException {
        try {
            Document doc = collection.find(Filters.eq("_id", strategyId)).first();
            return Optional.ofNullable(doc).map(StrategyStateMapper::fromDocument);
        } catch (MongoException e) {
            throw new StateStoreException("Failed to load state for " + strategyId + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new StateStoreException("Stored state for " + strategyId + " is unreadable: " + e.getMessage(), e);
        }
    }
}
