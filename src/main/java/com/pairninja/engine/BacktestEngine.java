package com.pairninja.engine;

import com.pairninja.config.StrategyConfig;
import com.pairninja.engine.execution.ExecutionCoordinator;
import com.pairninja.engine.execution.RetryPolicy;
import com.pairninja.engine.sizing.FundingController;
import com.pairninja.infra.InMemoryStateStore;
import com.pairninja.infra.LoggingAlertSink;
import com.pairninja.infra.SimulatedFuturesExchange;
import com.pairninja.model.BacktestBar;
import com.pairninja.model.BacktestReport;
import com.pairninja.model.BarOutcome;
import com.pairninja.model.FundingRate;
import com.pairninja.model.FundingSnapshot;
import com.pairninja.model.Instrument;
import com.pairninja.model.MarketSnapshot;
import com.pairninja.model.PriceSnapshot;
import com.pairninja.model.TradeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Backtest Engine
 *
 * Replays historical bars through the same {@link StrategyEngine} used live,
 * with {@link SimulatedFuturesExchange} as order transport and account, and an
 * in-memory state store.
 *
 * Each closed trade is charged, on top of its gross pair PnL:
 * - fees: feeBps on total notional (if enabled)
 * - slippage: slippageBps on total notional (if enabled)
 * - funding: estimated over the whole holding hours with the exit bar's rates
 *   (if enabled and the bar carries rates)
 *
 * Runs are deterministic: the same bars and configuration always give the
 * same trades and equity curve.
 */
public class BacktestEngine {

    private static final Logger logger = LoggerFactory.getLogger(BacktestEngine.class);

    private final StrategyConfig config;

    public BacktestEngine(StrategyConfig config) {
        this.config = config;
    }

    public BacktestReport run(List<BacktestBar> bars) {
        StrategyConfig.BacktestParams params = config.backtest;
        logger.info("🚀 Starting backtest '{}' with {} bars", config.runtime.strategyId, bars.size());

        SimulatedFuturesExchange exchange = new SimulatedFuturesExchange(params.initialEquity, params.slippageBps);
        ExecutionCoordinator coordinator = new ExecutionCoordinator(exchange, RetryPolicy.from(config.execution));
        StrategyEngine engine = new StrategyEngine(config, coordinator, new InMemoryStateStore(),
                new LoggingAlertSink(), exchange);

        BacktestReport report = new BacktestReport();
        report.strategyId = config.runtime.strategyId;
        report.initialBalance = params.initialEquity;
        report.barCount = bars.size();
        if (!bars.isEmpty()) {
            report.startTime = bars.get(0).getTimestamp();
            report.endTime = bars.get(bars.size() - 1).getTimestamp();
        }

        double equity = params.initialEquity;
        for (BacktestBar bar : bars) {
            exchange.onBar(bar.getTimestamp(), bar.getEthPrice(), bar.getBtcPrice());

            BarOutcome outcome = engine.onBar(toSnapshot(bar));

            if (outcome.trade != null) {
                BacktestReport.TradeEntry entry = chargeCosts(outcome.trade, bar);
                exchange.settle(entry.pnl);
                equity += entry.pnl;
                report.trades.add(entry);
                logger.debug("Trade closed {} -> {}: gross {} net {}", entry.trade.getEntryTime(),
                        entry.trade.getExitTime(), entry.trade.getRealizedPnl(), entry.pnl);
            }
            report.equityCurve.add(new BacktestReport.EquityPoint(bar.getTimestamp(), equity));
        }

        report.calculateMetrics();
        logger.info("✅ Backtest complete: {} trades, net {} ({}%)", report.totalTrades,
                String.format("%.2f", report.netProfit), String.format("%.2f", report.getNetProfitPercent()));
        return report;
    }

    private MarketSnapshot toSnapshot(BacktestBar bar) {
        PriceSnapshot prices = PriceSnapshot.ofClose(bar.getTimestamp(), bar.getEthPrice(), bar.getBtcPrice());
        FundingSnapshot funding = null;
        if (bar.hasFunding()) {
            funding = new FundingSnapshot(
                    new FundingRate(Instrument.ETH_PERP, bar.getFundingEth(), bar.getTimestamp(),
                            config.backtest.fundingIntervalHours),
                    new FundingRate(Instrument.BTC_PERP, bar.getFundingBtc(), bar.getTimestamp(),
                            config.backtest.fundingIntervalHours));
        }
        return new MarketSnapshot(prices, funding);
    }

    BacktestReport.TradeEntry chargeCosts(TradeRecord trade, BacktestBar exitBar) {
        StrategyConfig.BacktestParams params = config.backtest;
        double totalNotional = trade.getNotionalEth() + trade.getNotionalBtc();
        double fees = params.includeFees ? totalNotional * params.feeBps / 10_000.0 : 0.0;
        double slippage = params.includeSlippage ? totalNotional * params.slippageBps / 10_000.0 : 0.0;

        double funding = 0.0;
        if (params.includeFunding && exitBar.hasFunding()) {
            long holdingHours = Math.max(0, Duration.between(trade.getEntryTime(), trade.getExitTime()).toHours());
            funding = FundingController.estimateCost(trade.getDirection(),
                    trade.getNotionalEth(), trade.getNotionalBtc(),
                    new FundingRate(Instrument.ETH_PERP, exitBar.getFundingEth(), exitBar.getTimestamp(),
                            params.fundingIntervalHours),
                    new FundingRate(Instrument.BTC_PERP, exitBar.getFundingBtc(), exitBar.getTimestamp(),
                            params.fundingIntervalHours),
                    holdingHours).getCost();
        }
        return new BacktestReport.TradeEntry(trade, fees, slippage, funding);
    }

    // ==================== Research helpers ====================

    /**
     * Run the same bars under several configurations, in order.
     */
    public static List<BacktestReport> runSensitivity(List<StrategyConfig> configs, List<BacktestBar> bars) {
        List<BacktestReport> reports = new ArrayList<>();
        for (StrategyConfig candidate : configs) {
            reports.add(new BacktestEngine(candidate).run(bars));
        }
        return reports;
    }

    /**
     * Copies of the base configuration, one per entry z. Values that would
     * break tpZ &lt; entryZ &lt; slZ are skipped.
     */
    public static List<StrategyConfig> entryZSweep(StrategyConfig base, double... entryZs) {
        List<StrategyConfig> configs = new ArrayList<>();
        for (double entryZ : entryZs) {
            if (!(entryZ > base.strategy.tpZ && entryZ < base.strategy.slZ)) {
                logger.warn("⚠️ Skipping entry z {}: outside ({}, {})", entryZ, base.strategy.tpZ,
                        base.strategy.slZ);
                continue;
            }
            StrategyConfig copy = base.copy();
            copy.strategy.entryZ = entryZ;
            configs.add(copy);
        }
        return configs;
    }

    /**
     * Run twice and compare trades and equity curves.
     */
    public boolean verifyReproducibility(List<BacktestBar> bars) {
        BacktestReport first = run(bars);
        BacktestReport second = run(bars);
        boolean same = first.trades.equals(second.trades) && first.equityCurve.equals(second.equityCurve);
        if (same) {
            logger.info("✅ Backtest reproducible: {} trades, {} equity points", first.trades.size(),
                    first.equityCurve.size());
        } else {
            logger.error("❌ Backtest not reproducible: trades {} vs {}", first.trades.size(), second.trades.size());
        }
        return same;
    }
}
