package com.pairninja.engine;

import com.pairninja.config.CapitalMode;
import com.pairninja.config.InstrumentConstraints;
import com.pairninja.config.StrategyConfig;
import com.pairninja.engine.execution.ExecutionCoordinator;
import com.pairninja.engine.execution.OrderExecutionException;
import com.pairninja.engine.execution.PairFill;
import com.pairninja.engine.indicator.IndicatorEngine;
import com.pairninja.engine.signal.EntrySignalDetector;
import com.pairninja.engine.signal.ExitSignalDetector;
import com.pairninja.engine.sizing.BelowMinimumException;
import com.pairninja.engine.sizing.FundingController;
import com.pairninja.engine.sizing.FundingDecision;
import com.pairninja.engine.sizing.PositionSizer;
import com.pairninja.engine.sizing.SizeConverter;
import com.pairninja.engine.sizing.SizingException;
import com.pairninja.engine.state.RecoveryAction;
import com.pairninja.engine.state.RecoveryReport;
import com.pairninja.engine.state.StateMachine;
import com.pairninja.engine.state.StateRecovery;
import com.pairninja.infra.AccountBalanceSource;
import com.pairninja.infra.AlertLevel;
import com.pairninja.infra.AlertSink;
import com.pairninja.infra.MarketDataException;
import com.pairninja.infra.StateStore;
import com.pairninja.infra.StateStoreException;
import com.pairninja.model.BarEvent;
import com.pairninja.model.BarOutcome;
import com.pairninja.model.EntrySignal;
import com.pairninja.model.ExitSignal;
import com.pairninja.model.FundingSnapshot;
import com.pairninja.model.Instrument;
import com.pairninja.model.MarketSnapshot;
import com.pairninja.model.OrderRequest;
import com.pairninja.model.OrderSide;
import com.pairninja.model.OrderType;
import com.pairninja.model.PositionLeg;
import com.pairninja.model.PositionSnapshot;
import com.pairninja.model.PriceField;
import com.pairninja.model.PriceSnapshot;
import com.pairninja.model.StrategyState;
import com.pairninja.model.StrategyStatus;
import com.pairninja.model.TradeDirection;
import com.pairninja.model.TradeRecord;
import com.pairninja.model.VolatilitySnapshot;
import com.pairninja.model.ZScoreSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-bar control loop of the pair strategy. Identical for live trading and
 * backtests; only the capabilities handed in differ.
 *
 * Each bar:
 * 1. update indicators with the paired snapshot
 * 2. IN_POSITION: evaluate exits, close the pair, transition and persist
 * 3. FLAT: evaluate the crossing entry against the funding-adjusted threshold,
 *    size the legs, open the pair, transition and persist
 * 4. advance the cooldown
 * 5. emit one {@link BarOutcome}
 *
 * Hedge-integrity failures (PARTIAL_FILL, RESIDUAL) always raise a CRITICAL
 * alert. A residual that cannot be repaired immediately is recorded on the
 * state and retried at the start of every following bar; no entry is taken
 * until it is gone.
 *
 * A transition whose persistence fails is kept in memory, since the orders
 * behind it have already been sent. The bar raises a CRITICAL alert and the
 * save is retried at the start of every following bar. No entry is taken
 * while the stored state is behind.
 */
public class StrategyEngine {
    private static final Logger logger = LoggerFactory.getLogger(StrategyEngine.class);

    private final StrategyConfig config;
    private final IndicatorEngine indicators;
    private final EntrySignalDetector entryDetector;
    private final ExitSignalDetector exitDetector;
    private final PositionSizer positionSizer;
    private final FundingController fundingController;
    private final SizeConverter ethConverter;
    private final SizeConverter btcConverter;
    private final ExecutionCoordinator coordinator;
    private final StateMachine stateMachine;
    private final StateStore stateStore;
    private final AlertSink alertSink;
    private final AccountBalanceSource balanceSource;

    private double cumulativePnl = 0.0;
    private boolean unsaved = false;

    /**
     * @param balanceSource account equity, only consulted in EQUITY_RATIO mode (may be null otherwise)
     */
    public StrategyEngine(StrategyConfig config,
            ExecutionCoordinator coordinator,
            StateStore stateStore,
            AlertSink alertSink,
            AccountBalanceSource balanceSource) {
        if (config.position.capitalMode == CapitalMode.EQUITY_RATIO && balanceSource == null) {
            throw new IllegalArgumentException("EQUITY_RATIO sizing needs an account balance source");
        }
        this.config = config;
        this.indicators = new IndicatorEngine(config);
        this.entryDetector = new EntrySignalDetector(config.strategy.entryZ, config.strategy.slZ);
        this.exitDetector = ExitSignalDetector.from(config);
        this.positionSizer = new PositionSizer(config.position);
        this.fundingController = new FundingController(config.funding, config.risk.maxHoldHours);
        this.ethConverter = new SizeConverter(config.constraintsFor(Instrument.ETH_PERP), config.position.minSizePolicy);
        this.btcConverter = new SizeConverter(config.constraintsFor(Instrument.BTC_PERP), config.position.minSizePolicy);
        this.coordinator = coordinator;
        this.stateMachine = new StateMachine(config.risk.cooldownHours);
        this.stateStore = stateStore;
        this.alertSink = alertSink;
        this.balanceSource = balanceSource;

        logger.info("✅ Strategy engine initialized: zWindow={}, entryZ={}, tpZ={}, slZ={}, floor={}, capital={}",
                config.strategy.zWindow, config.strategy.entryZ, config.strategy.tpZ, config.strategy.slZ,
                config.sigmaFloor.mode, config.position.capitalMode);
    }

    // ==================== Startup ====================

    /**
     * Load the stored state, reconcile it, hydrate the state machine and carry
     * out the recommended repairs. Run once before the first bar.
     */
    public RecoveryReport recover(Instant now) throws StateStoreException {
        Optional<StrategyState> stored = stateStore.load();
        RecoveryReport report = StateRecovery.recover(stored.orElse(null), now);
        stateMachine.hydrate(report.getState());

        for (String anomaly : report.getAnomalies()) {
            logger.warn("⚠️ Recovery anomaly: {}", anomaly);
        }
        for (RecoveryReport.Alert alert : report.getAlerts()) {
            alertSink.send(alert.getLevel(), alert.getMessage());
        }

        if (report.getActions().contains(RecoveryAction.REPAIR_RESIDUAL)) {
            PositionSnapshot residual = stateMachine.getState().getPosition();
            try {
                coordinator.repairResidual(residual);
                stateMachine.clearResidual();
                alertSink.send(AlertLevel.INFO, "Residual repaired at startup: " + residual);
            } catch (OrderExecutionException e) {
                logger.error("🚨 Startup residual repair failed, will retry on the next bar: {}", e.getMessage());
                alertSink.send(AlertLevel.CRITICAL, "Startup residual repair failed: " + e.getMessage());
            }
        }

        if (stored.isEmpty() || !stored.get().equals(stateMachine.getState())) {
            stateStore.save(stateMachine.getState());
        }
        logger.info("✅ Recovery complete: {}", stateMachine.getState());
        return report;
    }

    /**
     * Feed historical snapshots through the indicators without trading so the
     * first live bar starts from warm windows.
     */
    public void warmUp(List<PriceSnapshot> history) {
        PriceField field = config.execution.priceField;
        for (PriceSnapshot snapshot : history) {
            IndicatorEngine.Reading reading = indicators.update(snapshot.ethPrice(field), snapshot.btcPrice(field));
            entryDetector.observe(reading.getZscore().getZscore());
        }
        logger.info("🔥 Indicators warmed up with {} bars", history.size());
    }

    // ==================== Per-bar cycle ====================

    public BarOutcome onBar(MarketSnapshot snapshot) {
        Instant now = snapshot.getTimestamp();
        PriceField field = config.execution.priceField;
        double ethPrice = snapshot.getPrices().ethPrice(field);
        double btcPrice = snapshot.getPrices().btcPrice(field);

        BarOutcome outcome = new BarOutcome(now);
        outcome.ethPrice = ethPrice;
        outcome.btcPrice = btcPrice;
        FundingSnapshot funding = snapshot.getFunding();
        if (funding != null) {
            outcome.fundingEth = funding.getEth().getRate();
            outcome.fundingBtc = funding.getBtc().getRate();
        }

        // 1. Indicators
        IndicatorEngine.Reading reading = indicators.update(ethPrice, btcPrice);
        ZScoreSnapshot z = reading.getZscore();
        VolatilitySnapshot vol = reading.getVolatility();
        outcome.r = z.getR();
        outcome.mean = z.getMean();
        outcome.sigma = z.getSigma();
        outcome.sigmaEff = z.getSigmaEff();
        outcome.zscore = z.getZscore();
        outcome.volEth = vol.getVolEth();
        outcome.volBtc = vol.getVolBtc();
        if (!z.isReady()) {
            outcome.events.add(BarEvent.WARMING_UP);
        }
        PositionSizer.Weights weights = PositionSizer.riskParityWeights(vol.getVolEth(), vol.getVolBtc());
        outcome.weightEth = weights.getEth();
        outcome.weightBtc = weights.getBtc();

        if (unsaved) {
            persist(outcome);
        }
        if (stateMachine.getState().hasResidual()) {
            repairCarriedResidual(ethPrice, btcPrice, outcome);
        }

        // 2./3. Exactly one of exit evaluation, entry evaluation, neither
        StrategyStatus status = stateMachine.getStatus();
        if (status == StrategyStatus.IN_POSITION) {
            entryDetector.observe(z.getZscore());
            evaluateExit(now, z, ethPrice, btcPrice, outcome);
        } else if (status == StrategyStatus.FLAT && !stateMachine.getState().hasResidual() && !unsaved) {
            evaluateEntry(now, z, vol, funding, ethPrice, btcPrice, outcome);
        } else {
            entryDetector.observe(z.getZscore());
        }

        // 4. Cooldown
        if (stateMachine.update(now)) {
            persist(outcome);
            outcome.events.add(BarEvent.COOLDOWN_EXPIRED);
        }

        // 5. Outcome
        outcome.status = stateMachine.getStatus();
        outcome.position = stateMachine.getState().getPosition();
        logger.info("📊 {} r={} z={} status={} events={}", now, format(outcome.r), format(outcome.zscore),
                outcome.status, outcome.events);
        return outcome;
    }

    private void evaluateEntry(Instant now, ZScoreSnapshot z, VolatilitySnapshot vol, FundingSnapshot funding,
            double ethPrice, double btcPrice, BarOutcome outcome) {
        Double zscore = z.getZscore();
        if (zscore == null) {
            entryDetector.observe(null);
            return;
        }

        TradeDirection candidate = TradeDirection.fromZScore(zscore);
        PositionSizer.Weights weights = PositionSizer.riskParityWeights(vol.getVolEth(), vol.getVolBtc());

        FundingDecision decision;
        if (funding != null) {
            Double baseCapital = baseCapitalOrNull();
            if (baseCapital == null) {
                entryDetector.observe(zscore);
                return;
            }
            decision = fundingController.apply(candidate, baseCapital, config.strategy.entryZ,
                    baseCapital * weights.getEth(), baseCapital * weights.getBtc(), funding);
            outcome.fundingCostEstimate = decision.getEstimate() != null ? decision.getEstimate().getCost() : null;
            outcome.fundingVeto = decision.isVeto();
        } else {
            decision = FundingDecision.unadjusted(config.strategy.entryZ, Double.NaN);
        }
        outcome.effectiveEntryZ = decision.getEffectiveEntryZ();

        Optional<EntrySignal> signal = entryDetector.evaluate(zscore, StrategyStatus.FLAT,
                decision.getEffectiveEntryZ());
        if (signal.isEmpty()) {
            return;
        }
        outcome.events.add(BarEvent.ENTRY_SIGNAL);
        TradeDirection direction = signal.get().getDirection();
        logger.info("🎯 Entry signal {} at z={} (threshold {})", direction, format(zscore),
                format(decision.getEffectiveEntryZ()));

        if (decision.isVeto()) {
            outcome.events.add(BarEvent.FUNDING_VETO);
            logger.info("⏭️ Entry skipped: funding cost {} above threshold", format(outcome.fundingCostEstimate));
            return;
        }

        double capital;
        if (Double.isNaN(decision.getCapital())) {
            Double baseCapital = baseCapitalOrNull();
            if (baseCapital == null) {
                outcome.events.add(BarEvent.ENTRY_FAILED);
                return;
            }
            capital = baseCapital;
        } else {
            capital = decision.getCapital();
        }
        double notionalEth = capital * weights.getEth();
        double notionalBtc = capital * weights.getBtc();
        outcome.notionalEth = notionalEth;
        outcome.notionalBtc = notionalBtc;

        double qtyEth;
        double qtyBtc;
        try {
            qtyEth = ethConverter.convert(notionalEth, ethPrice);
            qtyBtc = btcConverter.convert(notionalBtc, btcPrice);
        } catch (BelowMinimumException e) {
            outcome.events.add(BarEvent.BELOW_MINIMUM);
            logger.info("⏭️ Entry skipped: {}", e.getMessage());
            return;
        } catch (SizingException e) {
            outcome.events.add(BarEvent.ENTRY_FAILED);
            logger.warn("⚠️ Entry sizing failed: {}", e.getMessage());
            return;
        }

        OrderRequest ethOrder = order(Instrument.ETH_PERP, direction.getEthSide(), qtyEth, ethPrice);
        OrderRequest btcOrder = order(Instrument.BTC_PERP, direction.getBtcSide(), qtyBtc, btcPrice);

        PairFill fill;
        try {
            fill = coordinator.openPair(ethOrder, btcOrder);
        } catch (OrderExecutionException e) {
            outcome.events.add(BarEvent.ENTRY_FAILED);
            handleOpenFailure(e, direction, now, ethPrice, btcPrice, notionalEth, notionalBtc, outcome);
            return;
        }

        PositionSnapshot position = new PositionSnapshot(direction, now,
                new PositionLeg(direction.getEthSide().sign() * fill.getFirstFilled(), ethPrice, notionalEth),
                new PositionLeg(direction.getBtcSide().sign() * fill.getSecondFilled(), btcPrice, notionalBtc));
        stateMachine.enter(position, now);
        outcome.events.add(BarEvent.ENTERED);
        persist(outcome);
        alertSink.send(AlertLevel.INFO, String.format("📈 Pair opened %s: ETH %.4f @ %.2f, BTC %.4f @ %.2f",
                direction, position.getEth().getQuantity(), ethPrice, position.getBtc().getQuantity(), btcPrice));
    }

    private void handleOpenFailure(OrderExecutionException e, TradeDirection direction, Instant now,
            double ethPrice, double btcPrice, double notionalEth, double notionalBtc, BarOutcome outcome) {
        switch (e.getKind()) {
            case PARTIAL_FILL:
                logger.error("❌ Pair open failed, first leg rolled back: {}", e.getMessage());
                alertSink.send(AlertLevel.CRITICAL, "Pair open PARTIAL_FILL, first leg rolled back: " + e.getMessage());
                break;
            case RESIDUAL: {
                Instrument symbol = e.getResidualSymbol();
                double price = symbol == Instrument.ETH_PERP ? ethPrice : btcPrice;
                double notional = symbol == Instrument.ETH_PERP ? notionalEth : notionalBtc;
                PositionSnapshot residual = new PositionSnapshot(direction, now,
                        PositionLeg.flat(), PositionLeg.flat())
                        .withLeg(symbol, new PositionLeg(e.getResidualQuantity(), price, notional));
                alertSink.send(AlertLevel.CRITICAL, "Pair open left a residual leg: " + residual);
                repairOrFlag(residual, ethPrice, btcPrice, outcome);
                break;
            }
            default:
                logger.warn("⚠️ Pair open failed, staying FLAT: {}", e.getMessage());
                break;
        }
    }

    private void evaluateExit(Instant now, ZScoreSnapshot z, double ethPrice, double btcPrice, BarOutcome outcome) {
        PositionSnapshot position = stateMachine.getState().getPosition();
        Optional<ExitSignal> signal = exitDetector.evaluate(z.getZscore(), StrategyStatus.IN_POSITION, position, now);
        if (signal.isEmpty()) {
            return;
        }
        ExitSignal exit = signal.get();
        outcome.events.add(BarEvent.EXIT_SIGNAL);
        logger.info("🏁 Exit signal {} at z={}, held {}h", exit.getReason(), format(exit.getZscore()),
                String.format("%.2f", position.holdingHours(now)));

        OrderRequest ethClose = closeOrder(Instrument.ETH_PERP, position.getEth(), ethPrice);
        OrderRequest btcClose = closeOrder(Instrument.BTC_PERP, position.getBtc(), btcPrice);

        try {
            coordinator.closePair(ethClose, btcClose);
        } catch (OrderExecutionException e) {
            outcome.events.add(BarEvent.EXIT_FAILED);
            if (!e.requiresRepair()) {
                logger.error("❌ Pair close failed, position unchanged: {}", e.getMessage());
                alertSink.send(AlertLevel.WARNING, "Pair close failed, still IN_POSITION: " + e.getMessage());
                return;
            }
            Instrument openSymbol = e.getResidualSymbol();
            PositionSnapshot residual = new PositionSnapshot(position.getDirection(), position.getEntryTime(),
                    PositionLeg.flat(), PositionLeg.flat())
                    .withLeg(openSymbol, position.leg(openSymbol));
            alertSink.send(AlertLevel.CRITICAL, "Pair close left a residual leg: " + residual);
            try {
                coordinator.repairResidual(residual, ethPrice, btcPrice);
            } catch (OrderExecutionException repairFailure) {
                stateMachine.exit(exit.getReason(), now);
                stateMachine.flagResidual(residual);
                outcome.events.add(BarEvent.RESIDUAL_FLAGGED);
                persist(outcome);
                alertSink.send(AlertLevel.CRITICAL, "Residual repair failed, recorded for retry: "
                        + repairFailure.getMessage());
                return;
            }
            outcome.events.add(BarEvent.RESIDUAL_REPAIRED);
        }

        stateMachine.exit(exit.getReason(), now);
        outcome.events.add(BarEvent.EXITED);
        persist(outcome);

        double pnl = TradeRecord.pairPnl(position.getDirection(),
                position.getEth().getAvgPrice(), position.getBtc().getAvgPrice(), ethPrice, btcPrice,
                position.getEth().getNotional(), position.getBtc().getNotional());
        cumulativePnl += pnl;
        outcome.trade = new TradeRecord(position.getDirection(), position.getEntryTime(), now,
                position.getEth().getAvgPrice(), position.getBtc().getAvgPrice(), ethPrice, btcPrice,
                position.getEth().getNotional(), position.getBtc().getNotional(), pnl, cumulativePnl,
                exit.getReason());
        alertSink.send(pnl >= 0 ? AlertLevel.INFO : AlertLevel.WARNING,
                String.format("📉 Pair closed (%s): PnL %.2f, cumulative %.2f", exit.getReason(), pnl, cumulativePnl));
    }

    private void repairCarriedResidual(double ethPrice, double btcPrice, BarOutcome outcome) {
        PositionSnapshot residual = stateMachine.getState().getPosition();
        try {
            coordinator.repairResidual(residual, ethPrice, btcPrice);
        } catch (OrderExecutionException e) {
            logger.error("🚨 Residual {} still open: {}", residual, e.getMessage());
            alertSink.send(AlertLevel.CRITICAL, "Residual still open: " + residual + " (" + e.getMessage() + ")");
            return;
        }
        stateMachine.clearResidual();
        outcome.events.add(BarEvent.RESIDUAL_REPAIRED);
        persist(outcome);
        alertSink.send(AlertLevel.INFO, "Residual repaired: " + residual);
    }

    private void repairOrFlag(PositionSnapshot residual, double ethPrice, double btcPrice, BarOutcome outcome) {
        try {
            coordinator.repairResidual(residual, ethPrice, btcPrice);
            outcome.events.add(BarEvent.RESIDUAL_REPAIRED);
            logger.warn("⚠️ Residual {} repaired immediately", residual);
        } catch (OrderExecutionException e) {
            stateMachine.flagResidual(residual);
            outcome.events.add(BarEvent.RESIDUAL_FLAGGED);
            persist(outcome);
            alertSink.send(AlertLevel.CRITICAL, "Residual repair failed, recorded for retry: " + e.getMessage());
        }
    }

    // ==================== Helpers ====================

    /**
     * Save the current state. On failure the in-memory state stays as it is
     * and the save is retried on the next bar.
     */
    private void persist(BarOutcome outcome) {
        StrategyState state = stateMachine.getState();
        try {
            stateStore.save(state);
        } catch (StateStoreException e) {
            outcome.events.add(BarEvent.STATE_NOT_SAVED);
            logger.error("🚨 State persistence failed, {} kept in memory: {}", state.getStatus(), e.getMessage());
            if (!unsaved) {
                alertSink.send(AlertLevel.CRITICAL, "State persistence failed, " + state.getStatus()
                        + " kept in memory and retried every bar, no new entries: " + e.getMessage());
            }
            unsaved = true;
            return;
        }
        if (unsaved) {
            unsaved = false;
            logger.info("💾 State saved again after earlier failures: {}", state);
            alertSink.send(AlertLevel.INFO, "State persistence restored: " + state.getStatus());
        }
    }

    private Double baseCapitalOrNull() {
        Double equity = null;
        if (config.position.capitalMode == CapitalMode.EQUITY_RATIO) {
            try {
                equity = balanceSource.fetchEquity();
            } catch (MarketDataException e) {
                logger.warn("⚠️ Account equity unavailable, no entry this bar: {}", e.getMessage());
                return null;
            }
        }
        try {
            return positionSizer.computeCapital(equity);
        } catch (SizingException e) {
            logger.warn("⚠️ Capital unavailable, no entry this bar: {}", e.getMessage());
            return null;
        }
    }

    private OrderRequest order(Instrument instrument, OrderSide side, double quantity, double referencePrice) {
        OrderType type = config.execution.orderType;
        double price = type == OrderType.LIMIT ? limitPrice(instrument, side, referencePrice) : referencePrice;
        return new OrderRequest(instrument, side, quantity, type, price);
    }

    private OrderRequest closeOrder(Instrument instrument, PositionLeg leg, double referencePrice) {
        return order(instrument, OrderSide.closing(leg.getQuantity()), Math.abs(leg.getQuantity()), referencePrice);
    }

    /**
     * Marketable limit: reference moved against us by the slippage allowance,
     * rounded away from the reference to the instrument tick.
     */
    private double limitPrice(Instrument instrument, OrderSide side, double referencePrice) {
        InstrumentConstraints constraints = config.constraintsFor(instrument);
        double slip = config.execution.slippageBps / 10_000.0;
        double raw = side == OrderSide.BUY ? referencePrice * (1 + slip) : referencePrice * (1 - slip);
        BigDecimal tick = BigDecimal.valueOf(constraints.tickSize);
        RoundingMode mode = side == OrderSide.BUY ? RoundingMode.CEILING : RoundingMode.FLOOR;
        BigDecimal ticks = BigDecimal.valueOf(raw).divide(tick, 0, mode);
        return ticks.multiply(tick).setScale(constraints.pricePrecision, mode).doubleValue();
    }

    private static String format(Double value) {
        return value == null ? "n/a" : String.format("%.4f", value);
    }

    // ==================== Accessors ====================

    public StrategyState getState() {
        return stateMachine.getState();
    }

    /**
     * True while the in-memory state has not reached the state store.
     */
    public boolean hasUnsavedState() {
        return unsaved;
    }

    public double getCumulativePnl() {
        return cumulativePnl;
    }

    public StrategyConfig getConfig() {
        return config;
    }
}
