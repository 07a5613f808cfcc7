package com.pairninja;

import com.pairninja.config.Config;
import com.pairninja.config.ConfigException;
import com.pairninja.config.StrategyConfig;
import com.pairninja.engine.BacktestDataLoader;
import com.pairninja.engine.BacktestEngine;
import com.pairninja.engine.MarketDataService;
import com.pairninja.infra.DatabaseService;
import com.pairninja.infra.ExchangeRateLimiter;
import com.pairninja.infra.FuturesBinanceService;
import com.pairninja.infra.repository.PriceBarRepository;
import com.pairninja.model.BacktestBar;
import com.pairninja.model.BacktestReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Backtest CLI - runs the pair strategy over historical ETH/BTC bars
 *
 * Usage:
 * java -cp target/classes com.pairninja.BacktestCLI 2024-01-01 2024-06-01
 *
 * Arguments:
 * 1. startDate - Start date (YYYY-MM-DD, UTC)
 * 2. endDate - End date (YYYY-MM-DD, UTC)
 *
 * Options:
 * --bars FILE      read bars from a JSON file instead of downloading
 * --from-db        replay the bars archived by the live loop in MongoDB
 * --config FILE    properties file used instead of application.properties
 * --verify         run twice and check the results are identical
 * --sweep Z1,Z2    extra runs with each entry z
 */
public class BacktestCLI {

    private static final Logger logger = LoggerFactory.getLogger(BacktestCLI.class);
    private static final String REPORT_DIR = "backtest_reports";
    private static final String DATA_DIR = "data";

    public static void main(String[] args) {
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println("   PairNinja ETH/BTC Backtest Engine v1.0");
        System.out.println("═══════════════════════════════════════════════════════════");

        if (args.length < 2) {
            printUsage();
            System.exit(1);
        }

        String startDate = args[0];
        String endDate = args[1];
        if (!isValidDate(startDate) || !isValidDate(endDate)) {
            System.err.println("❌ Invalid date format. Use YYYY-MM-DD");
            System.exit(1);
        }

        String barsFile = null;
        boolean fromDb = false;
        String configFile = null;
        boolean verify = false;
        List<Double> sweep = new ArrayList<>();
        for (int i = 2; i < args.length; i++) {
            switch (args[i]) {
                case "--bars":
                    barsFile = requireValue(args, ++i, "--bars");
                    break;
                case "--from-db":
                    fromDb = true;
                    break;
                case "--config":
                    configFile = requireValue(args, ++i, "--config");
                    break;
                case "--verify":
                    verify = true;
                    break;
                case "--sweep":
                    for (String z : requireValue(args, ++i, "--sweep").split(",")) {
                        try {
                            sweep.add(Double.parseDouble(z.trim()));
                        } catch (NumberFormatException e) {
                            System.err.println("❌ Invalid entry z in --sweep: " + z);
                            System.exit(1);
                        }
                    }
                    break;
                default:
                    System.err.println("❌ Unknown option: " + args[i]);
                    printUsage();
                    System.exit(1);
            }
        }

        try {
            Config config = configFile != null ? Config.load(Paths.get(configFile)) : Config.load();
            StrategyConfig strategyConfig = StrategyConfig.from(config);
            Instant start = LocalDate.parse(startDate).atStartOfDay().toInstant(ZoneOffset.UTC);
            Instant end = LocalDate.parse(endDate).atStartOfDay().toInstant(ZoneOffset.UTC);
            if (!end.isAfter(start)) {
                System.err.println("❌ End date must be after start date");
                System.exit(1);
            }

            System.out.println();
            System.out.println("📊 Backtest Parameters:");
            System.out.println("   Strategy:  " + strategyConfig.runtime.strategyId);
            System.out.println("   Period:    " + startDate + " to " + endDate);
            System.out.println("   Bar:       " + strategyConfig.runtime.barIntervalSeconds + "s");
            System.out.println("   Entry z:   " + strategyConfig.strategy.entryZ
                    + " (TP " + strategyConfig.strategy.tpZ + ", SL " + strategyConfig.strategy.slZ + ")");
            System.out.println("   Initial:   $" + strategyConfig.backtest.initialEquity);
            System.out.println();

            List<BacktestBar> bars = loadBars(config, strategyConfig, barsFile, fromDb, start, end, startDate,
                    endDate);
            if (bars.isEmpty()) {
                System.err.println("❌ No bars in the requested period");
                System.exit(1);
            }

            System.out.println("🚀 Starting backtest over " + bars.size() + " bars...");
            System.out.println();

            BacktestEngine backtestEngine = new BacktestEngine(strategyConfig);
            long startTime = System.currentTimeMillis();
            BacktestReport report = backtestEngine.run(bars);
            long duration = System.currentTimeMillis() - startTime;

            System.out.println();
            System.out.println("═══════════════════════════════════════════════════════════");
            System.out.println("   BACKTEST RESULTS");
            System.out.println("═══════════════════════════════════════════════════════════");
            System.out.println(report.getSummary());
            System.out.println();
            System.out.println("⏱️  Execution time: " + (duration / 1000.0) + " seconds");

            Files.createDirectories(Paths.get(REPORT_DIR));
            String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
            String baseName = String.format("%s/%s_%s_%s_%s", REPORT_DIR, strategyConfig.runtime.strategyId,
                    startDate, endDate, timestamp);

            Path metricsPath = Paths.get(baseName + "_metrics.json");
            report.exportMetricsJson(metricsPath);
            System.out.println("📄 Metrics saved: " + metricsPath);

            Path tradesPath = Paths.get(baseName + "_trades.csv");
            report.exportTradesCsv(tradesPath);
            System.out.println("📊 Trade log saved: " + tradesPath);

            Path equityPath = Paths.get(baseName + "_equity.csv");
            report.exportEquityCsv(equityPath);
            System.out.println("📈 Equity curve saved: " + equityPath);

            if (verify) {
                System.out.println();
                boolean same = backtestEngine.verifyReproducibility(bars);
                System.out.println(same ? "✅ Reproducibility check passed" : "❌ Reproducibility check FAILED");
                if (!same) {
                    System.exit(2);
                }
            }

            if (!sweep.isEmpty()) {
                printSweep(strategyConfig, bars, sweep);
            }

            System.out.println();
            System.out.println("✅ Backtest complete!");

        } catch (ConfigException e) {
            System.err.println("❌ Configuration error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            logger.error("Backtest failed", e);
            System.err.println("❌ Error: " + e.getMessage());
            System.exit(1);
        }
    }

    private static List<BacktestBar> loadBars(Config config, StrategyConfig strategyConfig, String barsFile,
            boolean fromDb, Instant start, Instant end, String startDate, String endDate) throws Exception {
        if (barsFile != null) {
            System.out.println("📂 Loading bars from " + barsFile);
            List<BacktestBar> all = BacktestDataLoader.loadBars(Paths.get(barsFile));
            List<BacktestBar> inRange = new ArrayList<>();
            for (BacktestBar bar : all) {
                if (!bar.getTimestamp().isBefore(start) && !bar.getTimestamp().isAfter(end)) {
                    inRange.add(bar);
                }
            }
            return inRange;
        }

        if (fromDb) {
            String uri = config.get(Config.MONGODB_URI);
            if (uri == null) {
                throw new ConfigException(Config.MONGODB_URI, "required for --from-db");
            }
            DatabaseService db = new DatabaseService(uri, config.get(Config.DB_NAME, "pair_trading"));
            try {
                System.out.println("🗄️  Loading stored bars from MongoDB");
                return BacktestDataLoader.loadFromStore(new PriceBarRepository(db), start, end,
                        strategyConfig.runtime.barIntervalSeconds, strategyConfig.execution.priceField);
            } finally {
                db.close();
            }
        }

        // Public market endpoints only, no keys needed
        int barInterval = strategyConfig.runtime.barIntervalSeconds;
        FuturesBinanceService binance = new FuturesBinanceService(config,
                new ExchangeRateLimiter("binance-backtest", strategyConfig.runtime.rateLimitPerSecond),
                barInterval, strategyConfig.backtest.fundingIntervalHours);
        BacktestDataLoader loader = new BacktestDataLoader(new MarketDataService(binance, binance, barInterval),
                binance, strategyConfig.execution.priceField);
        Path cacheFile = Paths.get(DATA_DIR, String.format("ETHBTC_%ds_%s_%s.json", barInterval, startDate, endDate));
        System.out.println("📥 Loading bars (cache: " + cacheFile + ")");
        return loader.loadOrDownload(cacheFile, start, end);
    }

    private static void printSweep(StrategyConfig base, List<BacktestBar> bars, List<Double> entryZs) {
        double[] values = new double[entryZs.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = entryZs.get(i);
        }
        List<StrategyConfig> configs = BacktestEngine.entryZSweep(base, values);
        List<BacktestReport> reports = BacktestEngine.runSensitivity(configs, bars);

        System.out.println();
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println("   ENTRY Z SENSITIVITY");
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println(String.format("%8s %8s %10s %12s %10s %8s", "entryZ", "trades", "winRate",
                "netProfit", "maxDD", "sharpe"));
        for (int i = 0; i < configs.size(); i++) {
            BacktestReport r = reports.get(i);
            System.out.println(String.format("%8.2f %8d %9.1f%% %12.2f %9.2f%% %8.2f",
                    configs.get(i).strategy.entryZ, r.totalTrades, r.winRate * 100, r.netProfit,
                    r.maxDrawdown * 100, r.sharpeRatio));
        }
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            System.err.println("❌ Missing value for " + option);
            System.exit(1);
        }
        return args[index];
    }

    private static void printUsage() {
        System.out.println(
                "Usage: java -cp target/classes com.pairninja.BacktestCLI <startDate> <endDate> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  startDate  - Start date in YYYY-MM-DD format (UTC)");
        System.out.println("  endDate    - End date in YYYY-MM-DD format (UTC)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --bars FILE     Read bars from a JSON file instead of downloading");
        System.out.println("  --from-db       Replay bars archived by the live loop (needs MONGODB_URI)");
        System.out.println("  --config FILE   Properties file used instead of application.properties");
        System.out.println("  --verify        Run twice and compare trades and equity curve");
        System.out.println("  --sweep Z1,Z2   Extra runs, one per entry z");
        System.out.println();
        System.out.println("Example:");
        System.out.println("  java -cp target/classes com.pairninja.BacktestCLI 2024-01-01 2024-06-01 --verify");
    }

    private static boolean isValidDate(String date) {
        try {
            LocalDate.parse(date, DateTimeFormatter.ISO_LOCAL_DATE);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
