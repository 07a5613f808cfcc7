package com.pairninja.infra;

import com.pairninja.model.Instrument;
import com.pairninja.model.PriceBar;

import java.time.Instant;
import java.util.List;

/**
 * 15-minute aligned price bars for one instrument.
 */
public interface PriceSource {

    /**
     * The bar closing at the given aligned timestamp.
     */
    PriceBar fetchBar(Instrument symbol, Instant barClose) throws MarketDataException;

    /**
     * Bars with start <= close time <= end, oldest first.
     */
    List<PriceBar> fetchHistory(Instrument symbol, Instant start, Instant end) throws MarketDataException;
}
