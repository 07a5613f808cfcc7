package com.pairninja.infra.repository;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.pairninja.infra.DatabaseService;
import com.pairninja.model.TradeRecord;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Completed pair trades in the {@code trades} collection.
 */
public class TradeRepository {
    private static final Logger logger = LoggerFactory.getLogger(TradeRepository.class);

    private final MongoCollection<Document> collection;
    private final String strategyId;

    public TradeRepository(DatabaseService databaseService, String strategyId) {
        this.collection = databaseService != null ? databaseService.collection(DatabaseService.TRADES) : null;
        this.strategyId = strategyId;
    }

    /**
     * Record a trade. A failed insert is logged; the trade itself already happened.
     */
    public void saveTrade(TradeRecord trade) {
        if (collection == null) {
            return;
        }
        try {
            collection.insertOne(StrategyStateMapper.toDocument(strategyId, trade));
        } catch (MongoException e) {
            logger.error("❌ Failed to record trade {}: {}", trade, e.getMessage());
        }
    }
}
