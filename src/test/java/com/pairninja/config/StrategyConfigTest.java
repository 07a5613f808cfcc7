package com.pairninja.config;

import com.pairninja.model.Instrument;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class StrategyConfigTest {

    private static StrategyConfig load(String... pairs) {
        Properties properties = new Properties();
        for (int i = 0; i < pairs.length; i += 2) {
            properties.setProperty(pairs[i], pairs[i + 1]);
        }
        return StrategyConfig.from(Config.fromProperties(properties));
    }

    @Test
    public void testDefaultsAreValid() {
        StrategyConfig config = StrategyConfig.defaults();
        assertEquals(1.5, config.strategy.entryZ);
        assertEquals(SigmaFloorMode.CONST, config.sigmaFloor.mode);
        assertNotNull(config.constraintsFor(Instrument.ETH_PERP));
        assertNotNull(config.constraintsFor(Instrument.BTC_PERP));
    }

    @Test
    public void testApplicationPropertiesLoad() {
        StrategyConfig config = StrategyConfig.from(Config.fromProperties(loadResource()));
        assertEquals(900, config.runtime.barIntervalSeconds);
        assertEquals(20.0, config.constraintsFor(Instrument.ETH_PERP).minNotional);
        assertEquals(100.0, config.constraintsFor(Instrument.BTC_PERP).minNotional);
    }

    private static Properties loadResource() {
        Properties properties = new Properties();
        try (InputStream input = StrategyConfigTest.class.getClassLoader()
                .getResourceAsStream("application.properties")) {
            assertNotNull(input, "application.properties on the classpath");
            properties.load(input);
        } catch (IOException e) {
            fail(e);
        }
        return properties;
    }

    @Test
    public void testKeysOverrideDefaults() {
        StrategyConfig config = load("strategy.entry.z", "2.0", "strategy.sl.z", "4.0",
                "sigma.floor.mode", "ewma_mix", "instrument.ETHUSDT.step.size", "0.01");
        assertEquals(2.0, config.strategy.entryZ);
        assertEquals(4.0, config.strategy.slZ);
        assertEquals(SigmaFloorMode.EWMA_MIX, config.sigmaFloor.mode);
        assertEquals(0.01, config.constraintsFor(Instrument.ETH_PERP).stepSize);
    }

    @Test
    public void testTakeProfitMustBeBelowEntry() {
        ConfigException e = assertThrows(ConfigException.class, () -> load("strategy.tp.z", "1.5"));
        assertEquals("strategy.tp.z", e.getKey());
    }

    @Test
    public void testEntryMustBeBelowStopLoss() {
        assertThrows(ConfigException.class, () -> load("strategy.entry.z", "3.5"));
    }

    @Test
    public void testEquityRatioNeedsK() {
        assertThrows(ConfigException.class, () -> load("position.capital.mode", "EQUITY_RATIO"));
        StrategyConfig ok = load("position.capital.mode", "EQUITY_RATIO", "position.equity.ratio.k", "0.5");
        assertEquals(0.5, ok.position.equityRatioK);
    }

    @Test
    public void testMinSizeRatioBounded() {
        assertThrows(ConfigException.class, () -> load("funding.modes", "SIZE", "funding.size.min.ratio", "1.5"));
    }

    @Test
    public void testCopyIsIndependent() {
        StrategyConfig base = StrategyConfig.defaults();
        StrategyConfig copy = base.copy();
        copy.strategy.entryZ = 2.0;
        copy.funding.modes.clear();
        copy.constraintsFor(Instrument.BTC_PERP).minQty = 1.0;

        assertEquals(1.5, base.strategy.entryZ);
        assertFalse(base.funding.modes.isEmpty());
        assertNotEquals(1.0, base.constraintsFor(Instrument.BTC_PERP).minQty);
    }
}
