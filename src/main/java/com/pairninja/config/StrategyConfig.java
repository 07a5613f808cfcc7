package com.pairninja.config;

import com.pairninja.model.Instrument;
import com.pairninja.model.OrderType;
import com.pairninja.model.PriceField;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Typed strategy configuration, built once at startup and handed to every
 * component that needs it.
 *
 * Groups:
 * - strategy: z-score window and entry/exit thresholds
 * - sigmaFloor: floor applied to the rolling sigma
 * - position: capital and volatility window
 * - funding: funding cost controls
 * - risk: holding limit, cooldown, take-profit confirmation
 * - execution: order type, slippage, retry policy, price field
 * - runtime: live loop pacing
 * - backtest: replay cost model
 * - constraints: per-instrument exchange rules
 *
 * {@link #from(Config)} validates everything before returning, so a bad
 * setting never reaches a running strategy.
 */
public class StrategyConfig {

    public static class StrategyParams {
        public int zWindow = 384;
        public double entryZ = 1.5;
        public double tpZ = 0.45;
        public double slZ = 3.5;
    }

    public static class SigmaFloorParams {
        public SigmaFloorMode mode = SigmaFloorMode.CONST;
        public double constValue = 0.001;
        public int quantileWindowDays = 30;
        public double quantileP = 0.10;
        public double ewmaHalfLife = 20.0;
    }

    public static class PositionParams {
        public CapitalMode capitalMode = CapitalMode.FIXED_NOTIONAL;
        public Double capitalValue = 50_000.0;
        public Double equityRatioK;
        public Double maxNotional;
        public int volWindow = 672;
        public MinSizePolicy minSizePolicy = MinSizePolicy.SKIP;
    }

    public static class FundingParams {
        public List<FundingMode> modes = new ArrayList<>(List.of(FundingMode.FILTER));
        public Double costThreshold = 0.001;
        public Double thresholdK = 0.5;
        public Double sizeAlpha = 0.5;
        public Double minSizeRatio = 0.3;
    }

    public static class RiskParams {
        public int maxHoldHours = 48;
        public int cooldownHours = 24;
        public int tpConfirmBars = 0;
    }

    public static class ExecutionParams {
        public OrderType orderType = OrderType.MARKET;
        public double slippageBps = 5.0;
        public int retryMaxAttempts = 2;
        public long retryBaseDelayMs = 1;
        public PriceField priceField = PriceField.MID;
    }

    public static class RuntimeParams {
        public String strategyId = "eth-btc";
        public int barIntervalSeconds = 900;
        public int rateLimitPerSecond = 10;
        public int warmUpBars = 0;
    }

    public static class BacktestParams {
        public double initialEquity = 100_000.0;
        public double feeBps = 2.0;
        public double slippageBps = 5.0;
        public boolean includeFees = true;
        public boolean includeSlippage = true;
        public boolean includeFunding = true;
        public int fundingIntervalHours = 8;
    }

    public StrategyParams strategy = new StrategyParams();
    public SigmaFloorParams sigmaFloor = new SigmaFloorParams();
    public PositionParams position = new PositionParams();
    public FundingParams funding = new FundingParams();
    public RiskParams risk = new RiskParams();
    public ExecutionParams execution = new ExecutionParams();
    public RuntimeParams runtime = new RuntimeParams();
    public BacktestParams backtest = new BacktestParams();
    public Map<Instrument, InstrumentConstraints> constraints = new EnumMap<>(Instrument.class);

    public StrategyConfig() {
        for (Instrument instrument : Instrument.values()) {
            constraints.put(instrument, new InstrumentConstraints());
        }
    }

    public static StrategyConfig defaults() {
        return new StrategyConfig().validate();
    }

    /**
     * Read every known key from the given source, falling back to defaults for
     * missing keys, and validate the result.
     */
    public static StrategyConfig from(Config config) {
        StrategyConfig c = new StrategyConfig();

        c.strategy.zWindow = config.getInt("strategy.zscore.window", c.strategy.zWindow);
        c.strategy.entryZ = config.getDouble("strategy.entry.z", c.strategy.entryZ);
        c.strategy.tpZ = config.getDouble("strategy.tp.z", c.strategy.tpZ);
        c.strategy.slZ = config.getDouble("strategy.sl.z", c.strategy.slZ);

        c.sigmaFloor.mode = config.getEnum("sigma.floor.mode", SigmaFloorMode.class, c.sigmaFloor.mode);
        c.sigmaFloor.constValue = config.getDouble("sigma.floor.const", c.sigmaFloor.constValue);
        c.sigmaFloor.quantileWindowDays = config.getInt("sigma.floor.quantile.window.days",
                c.sigmaFloor.quantileWindowDays);
        c.sigmaFloor.quantileP = config.getDouble("sigma.floor.quantile.p", c.sigmaFloor.quantileP);
        c.sigmaFloor.ewmaHalfLife = config.getDouble("sigma.floor.ewma.half.life", c.sigmaFloor.ewmaHalfLife);

        c.position.capitalMode = config.getEnum("position.capital.mode", CapitalMode.class, c.position.capitalMode);
        if (config.has("position.capital.value")) {
            c.position.capitalValue = config.getOptionalDouble("position.capital.value");
        }
        c.position.equityRatioK = config.getOptionalDouble("position.equity.ratio.k");
        c.position.maxNotional = config.getOptionalDouble("position.max.notional");
        c.position.volWindow = config.getInt("position.vol.window", c.position.volWindow);
        c.position.minSizePolicy = config.getEnum("position.min.size.policy", MinSizePolicy.class,
                c.position.minSizePolicy);

        c.funding.modes = new ArrayList<>(config.getEnumList("funding.modes", FundingMode.class, c.funding.modes));
        c.funding.costThreshold = config.getDouble("funding.cost.threshold", c.funding.costThreshold);
        c.funding.thresholdK = config.getDouble("funding.threshold.k", c.funding.thresholdK);
        c.funding.sizeAlpha = config.getDouble("funding.size.alpha", c.funding.sizeAlpha);
        c.funding.minSizeRatio = config.getDouble("funding.size.min.ratio", c.funding.minSizeRatio);

        c.risk.maxHoldHours = config.getInt("risk.max.hold.hours", c.risk.maxHoldHours);
        c.risk.cooldownHours = config.getInt("risk.cooldown.hours", c.risk.cooldownHours);
        c.risk.tpConfirmBars = config.getInt("risk.tp.confirm.bars", c.risk.tpConfirmBars);

        c.execution.orderType = config.getEnum("execution.order.type", OrderType.class, c.execution.orderType);
        c.execution.slippageBps = config.getDouble("execution.slippage.bps", c.execution.slippageBps);
        c.execution.retryMaxAttempts = config.getInt("execution.retry.max.attempts", c.execution.retryMaxAttempts);
        c.execution.retryBaseDelayMs = config.getLong("execution.retry.base.delay.ms", c.execution.retryBaseDelayMs);
        c.execution.priceField = config.getEnum("execution.price.field", PriceField.class, c.execution.priceField);

        c.runtime.strategyId = config.get("runtime.strategy.id", c.runtime.strategyId);
        c.runtime.barIntervalSeconds = config.getInt("runtime.bar.interval.seconds", c.runtime.barIntervalSeconds);
        c.runtime.rateLimitPerSecond = config.getInt("runtime.rate.limit.per.second", c.runtime.rateLimitPerSecond);
        c.runtime.warmUpBars = config.getInt("runtime.warmup.bars", c.runtime.warmUpBars);

        c.backtest.initialEquity = config.getDouble("backtest.initial.equity", c.backtest.initialEquity);
        c.backtest.feeBps = config.getDouble("backtest.fee.bps", c.backtest.feeBps);
        c.backtest.slippageBps = config.getDouble("backtest.slippage.bps", c.backtest.slippageBps);
        c.backtest.includeFees = config.getBoolean("backtest.include.fees", c.backtest.includeFees);
        c.backtest.includeSlippage = config.getBoolean("backtest.include.slippage", c.backtest.includeSlippage);
        c.backtest.includeFunding = config.getBoolean("backtest.include.funding", c.backtest.includeFunding);
        c.backtest.fundingIntervalHours = config.getInt("backtest.funding.interval.hours",
                c.backtest.fundingIntervalHours);

        for (Instrument instrument : Instrument.values()) {
            String prefix = "instrument." + instrument.getExchangeSymbol() + ".";
            InstrumentConstraints ic = c.constraints.get(instrument);
            ic.minQty = config.getDouble(prefix + "min.qty", ic.minQty);
            ic.minNotional = config.getDouble(prefix + "min.notional", ic.minNotional);
            ic.stepSize = config.getDouble(prefix + "step.size", ic.stepSize);
            ic.tickSize = config.getDouble(prefix + "tick.size", ic.tickSize);
            ic.qtyPrecision = config.getInt(prefix + "qty.precision", ic.qtyPrecision);
            ic.pricePrecision = config.getInt(prefix + "price.precision", ic.pricePrecision);
            ic.roundingMode = config.getEnum(prefix + "rounding.mode", QtyRoundingMode.class, ic.roundingMode);
        }

        return c.validate();
    }

    /**
     * Check every field and cross-field rule.
     *
     * @return this, for chaining
     * @throws ConfigException on the first violation
     */
    public StrategyConfig validate() {
        require(strategy.zWindow > 0, "strategy.zscore.window", "must be > 0");
        require(strategy.tpZ > 0, "strategy.tp.z", "must be > 0");
        require(strategy.tpZ < strategy.entryZ, "strategy.tp.z",
                "must be < entry z (" + strategy.entryZ + "), otherwise take-profit is unreachable");
        require(strategy.entryZ < strategy.slZ, "strategy.entry.z",
                "must be < stop-loss z (" + strategy.slZ + ")");

        require(sigmaFloor.mode != null, "sigma.floor.mode", "is required");
        require(sigmaFloor.constValue > 0, "sigma.floor.const", "must be > 0");
        require(sigmaFloor.quantileWindowDays > 0, "sigma.floor.quantile.window.days", "must be > 0");
        require(sigmaFloor.quantileP > 0 && sigmaFloor.quantileP <= 1, "sigma.floor.quantile.p",
                "must be in (0, 1]");
        require(sigmaFloor.ewmaHalfLife > 0, "sigma.floor.ewma.half.life", "must be > 0");

        require(position.volWindow > 0, "position.vol.window", "must be > 0");
        require(position.minSizePolicy != null, "position.min.size.policy", "is required");
        if (position.capitalMode == CapitalMode.FIXED_NOTIONAL) {
            require(position.capitalValue != null, "position.capital.value", "required for FIXED_NOTIONAL");
            require(position.capitalValue > 0, "position.capital.value", "must be > 0");
        } else if (position.capitalMode == CapitalMode.EQUITY_RATIO) {
            require(position.equityRatioK != null, "position.equity.ratio.k", "required for EQUITY_RATIO");
            require(position.equityRatioK > 0 && position.equityRatioK <= 1, "position.equity.ratio.k",
                    "must be in (0, 1]");
        } else {
            throw new ConfigException("position.capital.mode", "is required");
        }
        if (position.maxNotional != null) {
            require(position.maxNotional > 0, "position.max.notional", "must be > 0");
        }

        require(funding.modes != null, "funding.modes", "is required");
        if (funding.modes.contains(FundingMode.FILTER)) {
            require(funding.costThreshold != null && funding.costThreshold >= 0, "funding.cost.threshold",
                    "required for FILTER and must be >= 0");
        }
        if (funding.modes.contains(FundingMode.THRESHOLD)) {
            require(funding.thresholdK != null && funding.thresholdK >= 0, "funding.threshold.k",
                    "required for THRESHOLD and must be >= 0");
        }
        if (funding.modes.contains(FundingMode.SIZE)) {
            require(funding.sizeAlpha != null && funding.sizeAlpha >= 0, "funding.size.alpha",
                    "required for SIZE and must be >= 0");
            require(funding.minSizeRatio != null, "funding.size.min.ratio", "required for SIZE");
        }
        if (funding.minSizeRatio != null) {
            require(funding.minSizeRatio >= 0 && funding.minSizeRatio <= 1, "funding.size.min.ratio",
                    "must be in [0, 1]");
        }

        require(risk.maxHoldHours > 0, "risk.max.hold.hours", "must be > 0");
        require(risk.cooldownHours >= 0, "risk.cooldown.hours", "must be >= 0");
        require(risk.tpConfirmBars >= 0, "risk.tp.confirm.bars", "must be >= 0");

        require(execution.orderType != null, "execution.order.type", "is required");
        require(execution.slippageBps >= 0, "execution.slippage.bps", "must be >= 0");
        require(execution.retryMaxAttempts >= 0, "execution.retry.max.attempts", "must be >= 0");
        require(execution.retryBaseDelayMs >= 0, "execution.retry.base.delay.ms", "must be >= 0");
        require(execution.priceField != null, "execution.price.field", "is required");

        require(runtime.strategyId != null && !runtime.strategyId.isBlank(), "runtime.strategy.id", "is required");
        require(runtime.barIntervalSeconds > 0, "runtime.bar.interval.seconds", "must be > 0");
        require(runtime.rateLimitPerSecond > 0, "runtime.rate.limit.per.second", "must be > 0");
        require(runtime.warmUpBars >= 0, "runtime.warmup.bars", "must be >= 0");

        require(backtest.initialEquity > 0, "backtest.initial.equity", "must be > 0");
        require(backtest.feeBps >= 0, "backtest.fee.bps", "must be >= 0");
        require(backtest.slippageBps >= 0, "backtest.slippage.bps", "must be >= 0");
        require(backtest.fundingIntervalHours > 0, "backtest.funding.interval.hours", "must be > 0");

        for (Instrument instrument : Instrument.values()) {
            InstrumentConstraints ic = constraints.get(instrument);
            String prefix = "instrument." + instrument.getExchangeSymbol() + ".";
            require(ic != null, prefix + "*", "constraints missing");
            require(ic.minQty > 0, prefix + "min.qty", "must be > 0");
            require(ic.minNotional > 0, prefix + "min.notional", "must be > 0");
            require(ic.stepSize > 0, prefix + "step.size", "must be > 0");
            require(ic.tickSize > 0, prefix + "tick.size", "must be > 0");
            require(ic.qtyPrecision >= 0, prefix + "qty.precision", "must be >= 0");
            require(ic.pricePrecision >= 0, prefix + "price.precision", "must be >= 0");
            require(ic.roundingMode != null, prefix + "rounding.mode", "is required");
        }
        return this;
    }

    private static void require(boolean condition, String key, String message) {
        if (!condition) {
            throw new ConfigException(key, message);
        }
    }

    public InstrumentConstraints constraintsFor(Instrument instrument) {
        return constraints.get(instrument);
    }

    /**
     * Deep copy, used to derive variants (sensitivity runs) without touching the original.
     */
    public StrategyConfig copy() {
        StrategyConfig c = new StrategyConfig();
        c.strategy.zWindow = strategy.zWindow;
        c.strategy.entryZ = strategy.entryZ;
        c.strategy.tpZ = strategy.tpZ;
        c.strategy.slZ = strategy.slZ;

        c.sigmaFloor.mode = sigmaFloor.mode;
        c.sigmaFloor.constValue = sigmaFloor.constValue;
        c.sigmaFloor.quantileWindowDays = sigmaFloor.quantileWindowDays;
        c.sigmaFloor.quantileP = sigmaFloor.quantileP;
        c.sigmaFloor.ewmaHalfLife = sigmaFloor.ewmaHalfLife;

        c.position.capitalMode = position.capitalMode;
        c.position.capitalValue = position.capitalValue;
        c.position.equityRatioK = position.equityRatioK;
        c.position.maxNotional = position.maxNotional;
        c.position.volWindow = position.volWindow;
        c.position.minSizePolicy = position.minSizePolicy;

        c.funding.modes = new ArrayList<>(funding.modes);
        c.funding.costThreshold = funding.costThreshold;
        c.funding.thresholdK = funding.thresholdK;
        c.funding.sizeAlpha = funding.sizeAlpha;
        c.funding.minSizeRatio = funding.minSizeRatio;

        c.risk.maxHoldHours = risk.maxHoldHours;
        c.risk.cooldownHours = risk.cooldownHours;
        c.risk.tpConfirmBars = risk.tpConfirmBars;

        c.execution.orderType = execution.orderType;
        c.execution.slippageBps = execution.slippageBps;
        c.execution.retryMaxAttempts = execution.retryMaxAttempts;
        c.execution.retryBaseDelayMs = execution.retryBaseDelayMs;
        c.execution.priceField = execution.priceField;

        c.runtime.strategyId = runtime.strategyId;
        c.runtime.barIntervalSeconds = runtime.barIntervalSeconds;
        c.runtime.rateLimitPerSecond = runtime.rateLimitPerSecond;
        c.runtime.warmUpBars = runtime.warmUpBars;

        c.backtest.initialEquity = backtest.initialEquity;
        c.backtest.feeBps = backtest.feeBps;
        c.backtest.slippageBps = backtest.slippageBps;
        c.backtest.includeFees = backtest.includeFees;
        c.backtest.includeSlippage = backtest.includeSlippage;
        c.backtest.includeFunding = backtest.includeFunding;
        c.backtest.fundingIntervalHours = backtest.fundingIntervalHours;

        for (Instrument instrument : Instrument.values()) {
            c.constraints.put(instrument, constraints.get(instrument).copy());
        }
        return c;
    }
}
