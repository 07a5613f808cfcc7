package com.pairninja.engine;

import com.pairninja.infra.FundingSource;
import com.pairninja.infra.MarketDataException;
import com.pairninja.infra.PriceSource;
import com.pairninja.model.FundingRate;
import com.pairninja.model.FundingSnapshot;
import com.pairninja.model.Instrument;
import com.pairninja.model.MarketSnapshot;
import com.pairninja.model.PriceBar;
import com.pairninja.model.PriceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds paired ETH/BTC snapshots for the engine.
 *
 * Both legs must describe the same bar close; anything else is rejected
 * rather than silently mixed. Funding is optional: when it cannot be fetched
 * the snapshot goes out without it and the funding controls stand down.
 */
public class MarketDataService {
    private static final Logger logger = LoggerFactory.getLogger(MarketDataService.class);

    private final PriceSource priceSource;
    private final FundingSource fundingSource;
    private final int barIntervalSeconds;

    /**
     * @param fundingSource may be null when funding is not used
     */
    public MarketDataService(PriceSource priceSource, FundingSource fundingSource, int barIntervalSeconds) {
        if (barIntervalSeconds <= 0) {
            throw new IllegalArgumentException("Bar interval must be > 0 seconds, got " + barIntervalSeconds);
        }
        this.priceSource = priceSource;
        this.fundingSource = fundingSource;
        this.barIntervalSeconds = barIntervalSeconds;
    }

    /**
     * Latest bar close at or before the given instant.
     */
    public static Instant alignToBarClose(Instant now, int intervalSeconds) {
        long epoch = now.getEpochSecond();
        return Instant.ofEpochSecond(epoch - Math.floorMod(epoch, (long) intervalSeconds));
    }

    public Instant alignToBarClose(Instant now) {
        return alignToBarClose(now, barIntervalSeconds);
    }

    /**
     * Paired snapshot for the bar closing at barClose.
     *
     * @throws MarketDataException if either leg is missing, misaligned or invalid
     */
    public MarketSnapshot fetchSnapshot(Instant barClose) throws MarketDataException {
        PriceBar eth = priceSource.fetchBar(Instrument.ETH_PERP, barClose);
        PriceBar btc = priceSource.fetchBar(Instrument.BTC_PERP, barClose);
        PriceSnapshot prices = pair(eth, btc);
        if (!prices.getTimestamp().equals(barClose)) {
            throw new MarketDataException("Bar close mismatch: requested " + barClose
                    + ", got " + prices.getTimestamp());
        }
        return new MarketSnapshot(prices, fetchFunding(barClose));
    }

    /**
     * Paired bars between start and end. Bars present for only one leg are
     * dropped with a warning.
     */
    public List<PriceSnapshot> fetchHistory(Instant start, Instant end) throws MarketDataException {
        List<PriceBar> ethBars = priceSource.fetchHistory(Instrument.ETH_PERP, start, end);
        List<PriceBar> btcBars = priceSource.fetchHistory(Instrument.BTC_PERP, start, end);

        Map<Instant, PriceBar> btcByTime = new HashMap<>();
        for (PriceBar bar : btcBars) {
            btcByTime.put(bar.getTimestamp(), bar);
        }
        List<PriceSnapshot> snapshots = new ArrayList<>();
        int dropped = 0;
        for (PriceBar eth : ethBars) {
            PriceBar btc = btcByTime.get(eth.getTimestamp());
            if (btc == null) {
                dropped++;
                continue;
            }
            snapshots.add(pair(eth, btc));
        }
        dropped += btcBars.size() - snapshots.size();
        if (dropped > 0) {
            logger.warn("⚠️ Dropped {} unpaired bars between {} and {}", dropped, start, end);
        }
        logger.info("📥 Loaded {} paired bars between {} and {}", snapshots.size(), start, end);
        return snapshots;
    }

    /**
     * The last {@code bars} paired snapshots before barClose, for indicator warm-up.
     */
    public List<PriceSnapshot> fetchWarmUp(Instant barClose, int bars) throws MarketDataException {
        if (bars <= 0) {
            return new ArrayList<>();
        }
        Instant start = barClose.minus(Duration.ofSeconds((long) barIntervalSeconds * bars));
        Instant end = barClose.minusSeconds(barIntervalSeconds);
        return fetchHistory(start, end);
    }

    private FundingSnapshot fetchFunding(Instant barClose) {
        if (fundingSource == null) {
            return null;
        }
        try {
            FundingRate eth = fundingSource.fetchRate(Instrument.ETH_PERP, barClose);
            FundingRate btc = fundingSource.fetchRate(Instrument.BTC_PERP, barClose);
            if (eth == null || btc == null) {
                return null;
            }
            return new FundingSnapshot(eth, btc);
        } catch (MarketDataException | IllegalArgumentException e) {
            logger.warn("⚠️ Funding unavailable at {}, continuing without funding controls: {}",
                    barClose, e.getMessage());
            return null;
        }
    }

    private static PriceSnapshot pair(PriceBar eth, PriceBar btc) throws MarketDataException {
        try {
            return new PriceSnapshot(eth, btc);
        } catch (IllegalArgumentException e) {
            throw new MarketDataException("Invalid ETH/BTC pair: " + e.getMessage(), e);
        }
    }
}
