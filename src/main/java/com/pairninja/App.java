package com.pairninja;

import com.pairninja.config.Config;
import com.pairninja.config.StrategyConfig;
import com.pairninja.engine.LiveTradingRunner;
import com.pairninja.engine.MarketDataService;
import com.pairninja.engine.StrategyEngine;
import com.pairninja.engine.execution.ExecutionCoordinator;
import com.pairninja.engine.execution.RetryPolicy;
import com.pairninja.infra.AlertSink;
import com.pairninja.infra.DatabaseService;
import com.pairninja.infra.ExchangeRateLimiter;
import com.pairninja.infra.FuturesBinanceService;
import com.pairninja.infra.InMemoryStateStore;
import com.pairninja.infra.OrderTransport;
import com.pairninja.infra.PaperOrderTransport;
import com.pairninja.infra.PriceStore;
import com.pairninja.infra.StateStore;
import com.pairninja.infra.TelegramNotifier;
import com.pairninja.infra.repository.PriceBarRepository;
import com.pairninja.infra.repository.StateRepository;
import com.pairninja.infra.repository.TradeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        SpringApplication.run(App.class, args);
    }

    @Bean
    public Config config() {
        return Config.load();
    }

    @Bean
    public StrategyConfig strategyConfig(Config config) {
        StrategyConfig strategyConfig = StrategyConfig.from(config);
        logger.info("⚙️  Strategy '{}': entryZ={}, tpZ={}, slZ={}, bar={}s",
                strategyConfig.runtime.strategyId, strategyConfig.strategy.entryZ, strategyConfig.strategy.tpZ,
                strategyConfig.strategy.slZ, strategyConfig.runtime.barIntervalSeconds);
        return strategyConfig;
    }

    @Bean
    public ExchangeRateLimiter exchangeRateLimiter(StrategyConfig strategyConfig) {
        return new ExchangeRateLimiter("binance", strategyConfig.runtime.rateLimitPerSecond);
    }

    @Bean
    public FuturesBinanceService futuresBinanceService(Config config, StrategyConfig strategyConfig,
            ExchangeRateLimiter rateLimiter) {
        return new FuturesBinanceService(config, rateLimiter, strategyConfig.runtime.barIntervalSeconds,
                strategyConfig.backtest.fundingIntervalHours);
    }

    @Bean
    public OrderTransport orderTransport(Config config, FuturesBinanceService futuresBinanceService) {
        boolean paper = config.getBoolean(Config.PAPER_MODE, true);
        logger.warn("⚠️  TRADING MODE: PAPER_MODE={}", paper);
        if (paper) {
            return new PaperOrderTransport();
        }
        logger.error("🚨 REAL TRADING ENABLED - REAL MONEY AT RISK! 🚨");
        return futuresBinanceService;
    }

    /**
     * Only created when a MongoDB URI is configured.
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = Config.MONGODB_URI)
    public DatabaseService databaseService(Config config) {
        return new DatabaseService(config.get(Config.MONGODB_URI), config.get(Config.DB_NAME, "pair_trading"));
    }

    @Bean
    public StateStore stateStore(ObjectProvider<DatabaseService> databaseService, StrategyConfig strategyConfig) {
        DatabaseService db = databaseService.getIfAvailable();
        if (db == null) {
            logger.warn("⚠️  {} not set, strategy state will NOT survive a restart", Config.MONGODB_URI);
            return new InMemoryStateStore();
        }
        return new StateRepository(db, strategyConfig.runtime.strategyId);
    }

    @Bean
    public TradeRepository tradeRepository(ObjectProvider<DatabaseService> databaseService,
            StrategyConfig strategyConfig) {
        return new TradeRepository(databaseService.getIfAvailable(), strategyConfig.runtime.strategyId);
    }

    @Bean
    public TelegramNotifier telegramNotifier(Config config) {
        return new TelegramNotifier(config);
    }

    @Bean
    public StrategyEngine strategyEngine(StrategyConfig strategyConfig,
            @Qualifier("orderTransport") OrderTransport orderTransport,
            StateStore stateStore, TelegramNotifier telegramNotifier, FuturesBinanceService futuresBinanceService) {
        ExecutionCoordinator coordinator = new ExecutionCoordinator(orderTransport,
                RetryPolicy.from(strategyConfig.execution));
        return new StrategyEngine(strategyConfig, coordinator, stateStore, telegramNotifier, futuresBinanceService);
    }

    @Bean
    public MarketDataService marketDataService(StrategyConfig strategyConfig,
            FuturesBinanceService futuresBinanceService) {
        return new MarketDataService(futuresBinanceService, futuresBinanceService,
                strategyConfig.runtime.barIntervalSeconds);
    }

    @Bean(destroyMethod = "stop")
    public LiveTradingRunner liveTradingRunner(StrategyEngine strategyEngine, MarketDataService marketDataService,
            TradeRepository tradeRepository, ObjectProvider<DatabaseService> databaseService, AlertSink alertSink) {
        DatabaseService db = databaseService.getIfAvailable();
        PriceStore priceStore = db != null ? new PriceBarRepository(db) : null;
        return new LiveTradingRunner(strategyEngine, marketDataService, tradeRepository, priceStore, alertSink,
                Clock.systemUTC());
    }

    @Bean
    public CommandLineRunner startTradingLoop(LiveTradingRunner runner) {
        return args -> {
            runner.startup();
            runner.start();
            logger.info("🚀 Pair trading loop STARTED");
        };
    }
}
