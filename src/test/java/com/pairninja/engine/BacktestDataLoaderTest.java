package com.pairninja.engine;

import com.pairninja.infra.InMemoryPriceStore;
import com.pairninja.infra.MarketDataException;
import com.pairninja.infra.ZeroFundingSource;
import com.pairninja.model.BacktestBar;
import com.pairninja.model.FundingRate;
import com.pairninja.model.FundingSnapshot;
import com.pairninja.model.Instrument;
import com.pairninja.model.MarketSnapshot;
import com.pairninja.model.PriceField;
import com.pairninja.model.PriceSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BacktestDataLoaderTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    public void testParseBarsWithOptionalFunding() {
        String payload = "["
                + "{\"timestamp\":\"2024-03-01T00:00:00Z\",\"ethPrice\":3000.5,\"btcPrice\":60000,"
                + "\"fundingEth\":0.0001,\"fundingBtc\":-0.00005},"
                + "{\"timestamp\":\"2024-03-01T00:15:00Z\",\"ethPrice\":3001,\"btcPrice\":60010}"
                + "]";

        List<BacktestBar> bars = BacktestDataLoader.parseBars(payload);

        assertEquals(2, bars.size());
        assertEquals(T0, bars.get(0).getTimestamp());
        assertEquals(3000.5, bars.get(0).getEthPrice());
        assertTrue(bars.get(0).hasFunding());
        assertEquals(-0.00005, bars.get(0).getFundingBtc());
        assertFalse(bars.get(1).hasFunding());
        assertNull(bars.get(1).getFundingEth());
    }

    @Test
    public void testMalformedFileIsReportedAsIOException() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "[{\"timestamp\":\"yesterday\",\"ethPrice\":1,\"btcPrice\":1}]");
        assertThrows(IOException.class, () -> BacktestDataLoader.loadBars(file));
    }

    @Test
    public void testSaveThenLoadKeepsBars() throws IOException {
        Path file = tempDir.resolve("bars.json");
        List<BacktestBar> bars = List.of(
                new BacktestBar(T0, 3000.0, 60_000.0, 0.0001, 0.0002),
                new BacktestBar(T0.plusSeconds(900), 3002.0, 60_050.0));

        BacktestDataLoader.saveBars(file, bars);
        List<BacktestBar> loaded = BacktestDataLoader.loadBars(file);

        assertEquals(2, loaded.size());
        assertEquals(0.0002, loaded.get(0).getFundingBtc());
        assertEquals(60_050.0, loaded.get(1).getBtcPrice());
        assertFalse(loaded.get(1).hasFunding());
    }

    @Test
    public void testDownloadPairsPricesWithFunding() throws MarketDataException {
        MarketDataServiceTest.StubPriceSource prices = new MarketDataServiceTest.StubPriceSource();
        for (int i = 0; i <= 4; i++) {
            prices.add(T0.plusSeconds(900L * i), 3000.0 + i, 60_000.0);
        }
        BacktestDataLoader loader = new BacktestDataLoader(new MarketDataService(prices, null, 900),
                new ZeroFundingSource(), PriceField.MID);

        List<BacktestBar> bars = loader.download(T0.plusSeconds(10), T0.plusSeconds(3600));

        assertEquals(5, bars.size());
        assertEquals(3004.0, bars.get(4).getEthPrice());
    }

    @Test
    public void testDownloadFailsOnIncompleteCoverage() {
        MarketDataServiceTest.StubPriceSource prices = new MarketDataServiceTest.StubPriceSource()
                .add(T0, 3000.0, 60_000.0);
        BacktestDataLoader loader = new BacktestDataLoader(new MarketDataService(prices, null, 900), null,
                PriceField.CLOSE);

        assertThrows(MarketDataException.class, () -> loader.download(T0, T0.plusSeconds(3600)));
    }

    private static InMemoryPriceStore storeWithBars(int... indexes) throws MarketDataException {
        InMemoryPriceStore store = new InMemoryPriceStore();
        for (int i : indexes) {
            Instant ts = T0.plusSeconds(900L * i);
            FundingSnapshot funding = i == 0 ? new FundingSnapshot(
                    new FundingRate(Instrument.ETH_PERP, 0.0001, T0, 8),
                    new FundingRate(Instrument.BTC_PERP, 0.00005, T0, 8)) : null;
            store.save(new MarketSnapshot(PriceSnapshot.ofClose(ts, 3000.0 + i, 60_000.0), funding));
        }
        return store;
    }

    @Test
    public void testLoadFromStoreCoversWholeRange() throws MarketDataException {
        InMemoryPriceStore store = storeWithBars(0, 1, 2, 3, 4, 5);

        List<BacktestBar> bars = BacktestDataLoader.loadFromStore(store, T0.plusSeconds(5), T0.plusSeconds(3600),
                900, PriceField.CLOSE);

        // aligned to 00:00 .. 01:00
        assertEquals(5, bars.size());
        assertEquals(T0, bars.get(0).getTimestamp());
        assertEquals(0.0001, bars.get(0).getFundingEth());
        assertFalse(bars.get(1).hasFunding());
        assertEquals(3004.0, bars.get(4).getEthPrice());
    }

    @Test
    public void testLoadFromStoreRejectsGap() throws MarketDataException {
        InMemoryPriceStore store = storeWithBars(0, 1, 3, 4);

        MarketDataException e = assertThrows(MarketDataException.class,
                () -> BacktestDataLoader.loadFromStore(store, T0, T0.plusSeconds(3600), 900, PriceField.CLOSE));
        assertTrue(e.getMessage().contains(T0.plusSeconds(1800).toString()));
    }

    @Test
    public void testLoadFromStoreRejectsMissingTail() throws MarketDataException {
        InMemoryPriceStore store = storeWithBars(0, 1, 2);

        assertThrows(MarketDataException.class,
                () -> BacktestDataLoader.loadFromStore(store, T0, T0.plusSeconds(3600), 900, PriceField.CLOSE));
        assertThrows(MarketDataException.class,
                () -> BacktestDataLoader.loadFromStore(new InMemoryPriceStore(), T0, T0, 900, PriceField.CLOSE));
    }
}
