package com.pairninja.engine;

import com.pairninja.config.SigmaFloorMode;
import com.pairninja.config.StrategyConfig;
import com.pairninja.engine.indicator.SigmaFloorCalculator;
import com.pairninja.engine.state.RecoveryReport;
import com.pairninja.infra.AlertLevel;
import com.pairninja.infra.AlertSink;
import com.pairninja.infra.MarketDataException;
import com.pairninja.infra.PriceStore;
import com.pairninja.infra.StateStoreException;
import com.pairninja.infra.repository.TradeRepository;
import com.pairninja.model.BarOutcome;
import com.pairninja.model.MarketSnapshot;
import com.pairninja.model.PriceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Live loop: one strategy cycle per bar close on a single scheduler thread.
 *
 * Startup runs state recovery, then warms the indicators from history. Each
 * cycle fetches the paired snapshot for the bar that just closed, archives it
 * in the price store, runs {@link StrategyEngine#onBar} and records completed
 * trades. Cycles never overlap and {@link #stop()} only returns once the
 * in-flight cycle is done.
 *
 * Every bar outcome is written as one JSON line to the {@value #BAR_LOG}
 * logger and every completed trade to {@value #TRADE_LOG}; logback.xml routes
 * both to their own files.
 *
 * A bar whose data cannot be fetched is skipped with a WARNING alert; a bar
 * whose state cannot be persisted raises a CRITICAL alert from the engine.
 * Neither stops the loop.
 */
public class LiveTradingRunner {
    private static final Logger logger = LoggerFactory.getLogger(LiveTradingRunner.class);
    private static final Duration BAR_SETTLE_DELAY = Duration.ofSeconds(5);

    public static final String BAR_LOG = "com.pairninja.bars";
    public static final String TRADE_LOG = "com.pairninja.trades";
    private static final Logger barLog = LoggerFactory.getLogger(BAR_LOG);
    private static final Logger tradeLog = LoggerFactory.getLogger(TRADE_LOG);

    private final StrategyEngine engine;
    private final MarketDataService marketData;
    private final TradeRepository tradeRepository;
    private final PriceStore priceStore;
    private final AlertSink alertSink;
    private final Clock clock;
    private final int barIntervalSeconds;
    private final ScheduledExecutorService scheduler;

    private volatile boolean running = false;

    /**
     * @param tradeRepository may be null when trades are not stored
     * @param priceStore may be null when bars are not archived
     */
    public LiveTradingRunner(StrategyEngine engine, MarketDataService marketData, TradeRepository tradeRepository,
            PriceStore priceStore, AlertSink alertSink, Clock clock) {
        this.engine = engine;
        this.marketData = marketData;
        this.tradeRepository = tradeRepository;
        this.priceStore = priceStore;
        this.alertSink = alertSink;
        this.clock = clock;
        this.barIntervalSeconds = engine.getConfig().runtime.barIntervalSeconds;
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread thread = new Thread(r, "pair-trading-loop");
            thread.setDaemon(false);
            return thread;
        });
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.scheduler = executor;
    }

    /**
     * Recover persisted state and warm up the indicators.
     */
    public RecoveryReport startup() throws StateStoreException, MarketDataException {
        Instant now = clock.instant();
        RecoveryReport report = engine.recover(now);
        if (!report.isClean()) {
            logger.warn("⚠️ Recovery finished with {} anomalies and actions {}", report.getAnomalies().size(),
                    report.getActions());
        }

        int bars = warmUpBars(engine.getConfig());
        Instant lastClose = marketData.alignToBarClose(now);
        List<PriceSnapshot> history = marketData.fetchWarmUp(lastClose.plusSeconds(barIntervalSeconds), bars);
        engine.warmUp(history);
        return report;
    }

    /**
     * Bars needed to fill every indicator window. A configured value above
     * zero takes precedence.
     */
    static int warmUpBars(StrategyConfig config) {
        if (config.runtime.warmUpBars > 0) {
            return config.runtime.warmUpBars;
        }
        int bars = Math.max(config.strategy.zWindow, config.position.volWindow + 1);
        if (config.sigmaFloor.mode != SigmaFloorMode.CONST) {
            bars = Math.max(bars, config.strategy.zWindow
                    + config.sigmaFloor.quantileWindowDays * SigmaFloorCalculator.BARS_PER_DAY);
        }
        return bars;
    }

    public void start() {
        running = true;
        scheduleNext();
        logger.info("🚀 Live trading loop started ({}s bars)", barIntervalSeconds);
    }

    private void scheduleNext() {
        if (!running) {
            return;
        }
        Instant now = clock.instant();
        Instant nextClose = marketData.alignToBarClose(now).plusSeconds(barIntervalSeconds);
        long delayMs = Math.max(0, Duration.between(now, nextClose.plus(BAR_SETTLE_DELAY)).toMillis());
        try {
            scheduler.schedule(() -> {
                runCycle(nextClose);
                scheduleNext();
            }, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Scheduler shut down, no further cycles");
            return;
        }
        logger.debug("Next cycle for bar {} in {} ms", nextClose, delayMs);
    }

    /**
     * One strategy cycle for the bar closing at barClose.
     *
     * @return the bar outcome, or null if the bar was skipped or failed
     */
    public BarOutcome runCycle(Instant barClose) {
        MarketSnapshot snapshot;
        try {
            snapshot = marketData.fetchSnapshot(barClose);
        } catch (MarketDataException e) {
            logger.warn("⚠️ Skipping bar {}: {}", barClose, e.getMessage());
            alertSink.send(AlertLevel.WARNING, "Market data unavailable for bar " + barClose + ": " + e.getMessage());
            return null;
        }

        if (priceStore != null) {
            try {
                priceStore.save(snapshot);
            } catch (MarketDataException e) {
                logger.warn("⚠️ Bar {} not archived: {}", barClose, e.getMessage());
            }
        }

        try {
            BarOutcome outcome = engine.onBar(snapshot);
            barLog.info("{}", outcome.toJson());
            if (outcome.trade != null) {
                tradeLog.info("{}", outcome.trade.toJson());
                if (tradeRepository != null) {
                    tradeRepository.saveTrade(outcome.trade);
                }
            }
            return outcome;
        } catch (RuntimeException e) {
            logger.error("🚨 Unexpected failure in cycle for bar {}", barClose, e);
            alertSink.send(AlertLevel.CRITICAL, "Strategy cycle failed for bar " + barClose + ": " + e.getMessage());
            return null;
        }
    }

    /**
     * Stop scheduling and wait for the in-flight cycle to complete.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.MINUTES)) {
                logger.warn("⚠️ Trading cycle still running after 2 minutes, forcing shutdown");
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("🛑 Live trading loop stopped");
    }

    public boolean isRunning() {
        return running;
    }
}
