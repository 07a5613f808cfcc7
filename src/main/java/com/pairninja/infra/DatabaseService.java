package com.pairninja.infra;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Indexes;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Owns the MongoDB client shared by the repositories and the names of the
 * collections they write to.
 *
 * Collections:
 * - strategy_state: one document per strategy id
 * - trades: completed pair trades, indexed by strategy and exit time
 * - price_bars: paired ETH/BTC bars keyed by bar close, shared by all strategies
 */
public class DatabaseService {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseService.class);

    public static final String STRATEGY_STATE = "strategy_state";
    public static final String TRADES = "trades";
    public static final String PRICE_BARS = "price_bars";

    private final MongoClient mongoClient;
    private final MongoDatabase database;

    public DatabaseService(String connectionString, String dbName) {
        logger.info("Connecting to MongoDB database '{}'", dbName);

        // No reachable server within 5s fails the startup
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(connectionString))
                .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(5, TimeUnit.SECONDS))
                .build();

        this.mongoClient = MongoClients.create(settings);
        this.database = mongoClient.getDatabase(dbName);
        database.runCommand(new Document("ping", 1));
        ensureIndexes();
        logger.info("✅ Connected to MongoDB");
    }

    private void ensureIndexes() {
        database.getCollection(TRADES).createIndex(Indexes.compoundIndex(
                Indexes.ascending("strategyId"), Indexes.ascending("exitTime")));
    }

    public MongoCollection<Document> collection(String name) {
        return database.getCollection(name);
    }

    public void close() {
        mongoClient.close();
        logger.info("MongoDB connection closed");
    }
}
