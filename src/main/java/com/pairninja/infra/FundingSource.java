package com.pairninja.infra;

import com.pairninja.model.FundingRate;
import com.pairninja.model.Instrument;

import java.time.Instant;
import java.util.List;

public interface FundingSource {

    /**
     * Funding rate in effect at the given time.
     */
    FundingRate fetchRate(Instrument symbol, Instant at) throws MarketDataException;

    /**
     * Settled funding rates between start and end, oldest first.
     */
    List<FundingRate> fetchFundingHistory(Instrument symbol, Instant start, Instant end) throws MarketDataException;
}
