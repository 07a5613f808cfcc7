package com.pairninja.config;

import com.pairninja.model.OrderType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

    private static Properties props(String... pairs) {
        Properties properties = new Properties();
        for (int i = 0; i < pairs.length; i += 2) {
            properties.setProperty(pairs[i], pairs[i + 1]);
        }
        return properties;
    }

    @Test
    public void testEnvironmentOverridesProperties() {
        Config config = new Config(props("strategy.entry.z", "1.5"), Map.of("STRATEGY_ENTRY_Z", "2.0"));
        assertEquals(2.0, config.getDouble("strategy.entry.z", 0.0));
    }

    @Test
    public void testBlankValueCountsAsMissing() {
        Config config = Config.fromProperties(props("position.max.notional", "  "));
        assertFalse(config.has("position.max.notional"));
        assertNull(config.getOptionalDouble("position.max.notional"));
        assertEquals(7, config.getInt("missing.key", 7));
    }

    @Test
    public void testMalformedNumberNamesTheKey() {
        Config config = Config.fromProperties(props("risk.max.hold.hours", "two days"));
        ConfigException e = assertThrows(ConfigException.class, () -> config.getInt("risk.max.hold.hours", 48));
        assertEquals("risk.max.hold.hours", e.getKey());
    }

    @Test
    public void testNonFiniteDoubleRejected() {
        Config config = Config.fromProperties(props("strategy.entry.z", "NaN"));
        assertThrows(ConfigException.class, () -> config.getDouble("strategy.entry.z", 1.5));
    }

    @Test
    public void testBooleanMustBeExplicit() {
        Config config = Config.fromProperties(props("PAPER_MODE", "yes"));
        assertThrows(ConfigException.class, () -> config.getBoolean("PAPER_MODE", true));
    }

    @Test
    public void testEnumListParsing() {
        Config config = Config.fromProperties(props("funding.modes", "filter, size"));
        assertEquals(List.of(FundingMode.FILTER, FundingMode.SIZE),
                config.getEnumList("funding.modes", FundingMode.class, List.of()));
        assertEquals(OrderType.MARKET, config.getEnum("execution.order.type", OrderType.class, OrderType.MARKET));
        Config bad = Config.fromProperties(props("funding.modes", "FILTER,BOGUS"));
        assertThrows(ConfigException.class, () -> bad.getEnumList("funding.modes", FundingMode.class, List.of()));
    }

    @Test
    public void testEmptyEnumListDisablesAll() {
        Config config = Config.fromProperties(props("funding.modes", ","));
        assertTrue(config.getEnumList("funding.modes", FundingMode.class, List.of(FundingMode.FILTER)).isEmpty());
    }
}
