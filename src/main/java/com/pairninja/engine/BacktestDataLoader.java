package com.pairninja.engine;

import com.pairninja.infra.FundingSource;
import com.pairninja.infra.MarketDataException;
import com.pairninja.infra.PriceStore;
import com.pairninja.model.BacktestBar;
import com.pairninja.model.FundingRate;
import com.pairninja.model.FundingSnapshot;
import com.pairninja.model.Instrument;
import com.pairninja.model.MarketSnapshot;
import com.pairninja.model.PriceField;
import com.pairninja.model.PriceSnapshot;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Loads backtest bars from JSON files, from the stored live bars or downloads
 * them from the exchange.
 *
 * File format: a JSON array of objects with {@code timestamp} (ISO-8601),
 * {@code ethPrice}, {@code btcPrice} and optional {@code fundingEth},
 * {@code fundingBtc}.
 */
public class BacktestDataLoader {
    private static final Logger logger = LoggerFactory.getLogger(BacktestDataLoader.class);

    private final MarketDataService marketData;
    private final FundingSource fundingSource;
    private final PriceField priceField;

    public BacktestDataLoader(MarketDataService marketData, FundingSource fundingSource, PriceField priceField) {
        this.marketData = marketData;
        this.fundingSource = fundingSource;
        this.priceField = priceField;
    }

    /**
     * Cached bars when the cache file exists, otherwise download and cache.
     */
    public List<BacktestBar> loadOrDownload(Path cacheFile, Instant start, Instant end)
            throws IOException, MarketDataException {
        if (Files.exists(cacheFile)) {
            logger.info("📂 Using cached bars from {}", cacheFile);
            return loadBars(cacheFile);
        }
        List<BacktestBar> bars = download(start, end);
        if (cacheFile.getParent() != null) {
            Files.createDirectories(cacheFile.getParent());
        }
        saveBars(cacheFile, bars);
        logger.info("💾 Cached {} bars to {}", bars.size(), cacheFile);
        return bars;
    }

    /**
     * Paired bars between the aligned start and end, each carrying the last
     * settled funding rates at or before its close.
     *
     * @throws MarketDataException if the history does not cover the whole range
     */
    public List<BacktestBar> download(Instant start, Instant end) throws MarketDataException {
        Instant alignedStart = marketData.alignToBarClose(start);
        Instant alignedEnd = marketData.alignToBarClose(end);
        List<PriceSnapshot> prices = marketData.fetchHistory(alignedStart, alignedEnd);
        if (prices.isEmpty() || prices.get(0).getTimestamp().isAfter(alignedStart)
                || prices.get(prices.size() - 1).getTimestamp().isBefore(alignedEnd)) {
            throw new MarketDataException("History coverage incomplete: requested " + alignedStart + " to "
                    + alignedEnd + ", got " + (prices.isEmpty() ? "nothing"
                            : prices.get(0).getTimestamp() + " to " + prices.get(prices.size() - 1).getTimestamp()));
        }

        NavigableMap<Instant, Double> ethFunding = new TreeMap<>();
        NavigableMap<Instant, Double> btcFunding = new TreeMap<>();
        if (fundingSource != null) {
            for (FundingRate rate : fundingSource.fetchFundingHistory(Instrument.ETH_PERP, alignedStart, alignedEnd)) {
                ethFunding.put(rate.getTimestamp(), rate.getRate());
            }
            for (FundingRate rate : fundingSource.fetchFundingHistory(Instrument.BTC_PERP, alignedStart, alignedEnd)) {
                btcFunding.put(rate.getTimestamp(), rate.getRate());
            }
        }

        List<BacktestBar> bars = new ArrayList<>(prices.size());
        for (PriceSnapshot snapshot : prices) {
            Instant ts = snapshot.getTimestamp();
            bars.add(new BacktestBar(ts, snapshot.ethPrice(priceField), snapshot.btcPrice(priceField),
                    floorValue(ethFunding, ts), floorValue(btcFunding, ts)));
        }
        logger.info("📥 Downloaded {} backtest bars ({} ETH / {} BTC funding points)", bars.size(),
                ethFunding.size(), btcFunding.size());
        return bars;
    }

    /**
     * Bars recorded by the live loop between the aligned start and end.
     *
     * @throws MarketDataException if any bar in the range is missing
     */
    public static List<BacktestBar> loadFromStore(PriceStore store, Instant start, Instant end,
            int barIntervalSeconds, PriceField priceField) throws MarketDataException {
        Instant alignedStart = MarketDataService.alignToBarClose(start, barIntervalSeconds);
        Instant alignedEnd = MarketDataService.alignToBarClose(end, barIntervalSeconds);
        List<MarketSnapshot> snapshots = store.findRange(alignedStart, alignedEnd);

        List<BacktestBar> bars = new ArrayList<>(snapshots.size());
        Instant expected = alignedStart;
        for (MarketSnapshot snapshot : snapshots) {
            if (!snapshot.getTimestamp().equals(expected)) {
                throw new MarketDataException("Stored bars incomplete: expected " + expected + ", next stored bar is "
                        + snapshot.getTimestamp());
            }
            FundingSnapshot funding = snapshot.getFunding();
            bars.add(new BacktestBar(snapshot.getTimestamp(),
                    snapshot.getPrices().ethPrice(priceField), snapshot.getPrices().btcPrice(priceField),
                    funding != null ? funding.getEth().getRate() : null,
                    funding != null ? funding.getBtc().getRate() : null));
            expected = expected.plusSeconds(barIntervalSeconds);
        }
        if (!expected.isAfter(alignedEnd)) {
            throw new MarketDataException("Stored bars incomplete: nothing stored from " + expected + " to "
                    + alignedEnd);
        }
        logger.info("📂 Loaded {} stored bars from {} to {}", bars.size(), alignedStart, alignedEnd);
        return bars;
    }

    private static Double floorValue(NavigableMap<Instant, Double> series, Instant at) {
        Map.Entry<Instant, Double> entry = series.floorEntry(at);
        return entry == null ? null : entry.getValue();
    }

    public static List<BacktestBar> loadBars(Path path) throws IOException {
        String payload = Files.readString(path, StandardCharsets.UTF_8);
        try {
            return parseBars(payload);
        } catch (JSONException | DateTimeParseException | IllegalArgumentException e) {
            throw new IOException("Malformed bar file " + path + ": " + e.getMessage(), e);
        }
    }

    static List<BacktestBar> parseBars(String payload) {
        JSONArray rows = new JSONArray(payload);
        List<BacktestBar> bars = new ArrayList<>(rows.length());
        for (int i = 0; i < rows.length(); i++) {
            JSONObject row = rows.getJSONObject(i);
            bars.add(new BacktestBar(
                    Instant.parse(row.getString("timestamp")),
                    row.getDouble("ethPrice"),
                    row.getDouble("btcPrice"),
                    row.has("fundingEth") && !row.isNull("fundingEth") ? row.getDouble("fundingEth") : null,
                    row.has("fundingBtc") && !row.isNull("fundingBtc") ? row.getDouble("fundingBtc") : null));
        }
        return bars;
    }

    public static void saveBars(Path path, List<BacktestBar> bars) throws IOException {
        JSONArray rows = new JSONArray();
        for (BacktestBar bar : bars) {
            JSONObject row = new JSONObject();
            row.put("timestamp", bar.getTimestamp().toString());
            row.put("ethPrice", bar.getEthPrice());
            row.put("btcPrice", bar.getBtcPrice());
            if (bar.getFundingEth() != null) {
                row.put("fundingEth", bar.getFundingEth());
            }
            if (bar.getFundingBtc() != null) {
                row.put("fundingBtc", bar.getFundingBtc());
            }
            rows.put(row);
        }
        Files.writeString(path, rows.toString(), StandardCharsets.UTF_8);
    }
}
