package com.pairninja.infra;

import com.pairninja.model.MarketSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Archive of the paired snapshots the live loop has seen. Backtests can be
 * replayed from it.
 */
public interface PriceStore {

    /**
     * Store the snapshot, replacing any earlier one with the same bar close.
     */
    void save(MarketSnapshot snapshot) throws MarketDataException;

    /**
     * Snapshots with start <= bar close <= end, oldest first.
     */
    List<MarketSnapshot> findRange(Instant start, Instant end) throws MarketDataException;
}
