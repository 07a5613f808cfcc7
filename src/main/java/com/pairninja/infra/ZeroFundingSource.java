package com.pairninja.infra;

import com.pairninja.model.FundingRate;
import com.pairninja.model.Instrument;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Funding source for venues or datasets without funding: a zero rate on the
 * usual 8 hour schedule.
 */
public class ZeroFundingSource implements FundingSource {
    public static final int DEFAULT_INTERVAL_HOURS = 8;

    private final int intervalHours;

    public ZeroFundingSource() {
        this(DEFAULT_INTERVAL_HOURS);
    }

    public ZeroFundingSource(int intervalHours) {
        this.intervalHours = intervalHours;
    }

    @Override
    public FundingRate fetchRate(Instrument symbol, Instant at) {
        return new FundingRate(symbol, 0.0, at, intervalHours);
    }

    @Override
    public List<FundingRate> fetchFundingHistory(Instrument symbol, Instant start, Instant end) {
        List<FundingRate> rates = new ArrayList<>();
        Duration step = Duration.ofHours(intervalHours);
        for (Instant t = start; !t.isAfter(end); t = t.plus(step)) {
            rates.add(new FundingRate(symbol, 0.0, t, intervalHours));
        }
        return rates;
    }
}
