package com.pairninja.infra.repository;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.Sorts;
import com.pairninja.infra.DatabaseService;
import com.pairninja.infra.MarketDataException;
import com.pairninja.infra.PriceStore;
import com.pairninja.model.MarketSnapshot;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Paired bars in the {@code price_bars} collection, one document per bar close.
 */
public class PriceBarRepository implements PriceStore {
    private static final Logger logger = LoggerFactory.getLogger(PriceBarRepository.class);

    private final MongoCollection<Document> collection;

    public PriceBarRepository(DatabaseService databaseService) {
        this.collection = databaseService.collection(DatabaseService.PRICE_BARS);
    }

    @Override
    public void save(MarketSnapshot snapshot) throws MarketDataException {
        try {
            collection.replaceOne(Filters.eq("_id", Date.from(snapshot.getTimestamp())),
                    MarketSnapshotMapper.toDocument(snapshot), new ReplaceOptions().upsert(true));
            logger.debug("💾 Bar {} stored", snapshot.getTimestamp());
        } catch (MongoException e) {
            throw new MarketDataException("Failed to store bar " + snapshot.getTimestamp() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<MarketSnapshot> findRange(Instant start, Instant end) throws MarketDataException {
        List<MarketSnapshot> snapshots = new ArrayList<>();
        try {
            for (Document doc : collection.find(Filters.and(
                            Filters.gte("_id", Date.from(start)),
                            Filters.lte("_id", Date.from(end))))
                    .sort(Sorts.ascending("_id"))) {
                snapshots.add(MarketSnapshotMapper.fromDocument(doc));
            }
        } catch (MongoException e) {
            throw new MarketDataException("Failed to read bars " + start + " to " + end + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new MarketDataException("Stored bars " + start + " to " + end + " are unreadable: "
                    + e.getMessage(), e);
        }
        return snapshots;
    }
}
