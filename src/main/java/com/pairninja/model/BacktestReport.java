package com.pairninja.model;

import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Backtest Report - Performance Metrics and Trade Log
 *
 * Contains the results of one backtest run:
 * - per-trade log with gross PnL and cost breakdown
 * - equity curve with one point per bar
 * - metrics: win rate, profit factor, stop-loss rate, annualized return,
 *   Sharpe ratio, max drawdown
 *
 * Ratios (win rate, stop-loss rate, drawdown, annualized return) are
 * fractions, not percentages.
 */
public class BacktestReport {
    private static final double SECONDS_PER_YEAR = 31_536_000.0;

    // Basic Information
    public String strategyId;
    public Instant startTime;
    public Instant endTime;
    public int barCount = 0;
    public double initialBalance;
    public double finalBalance;

    // Trade Statistics
    public int totalTrades = 0;
    public int winningTrades = 0;
    public int losingTrades = 0;
    public int stopLossTrades = 0;
    public double winRate = 0.0;
    public double stopLossRate = 0.0;

    // Financial Metrics
    public double totalProfit = 0.0;
    public double totalLoss = 0.0;
    public double netProfit = 0.0;
    public double profitFactor = 0.0;
    public double totalFees = 0.0;
    public double totalSlippage = 0.0;
    public double totalFunding = 0.0;

    // Risk Metrics
    public double maxDrawdown = 0.0;
    public double sharpeRatio = 0.0;
    public double annualizedReturn = 0.0;
    public double averageHoldingHours = 0.0;

    // Trade Log
    public List<TradeEntry> trades = new ArrayList<>();

    // Equity Curve
    public List<EquityPoint> equityCurve = new ArrayList<>();

    /**
     * One closed pair trade with its costs.
     */
    public static class TradeEntry {
        public final TradeRecord trade;
        public final double fees;
        public final double slippage;
        public final double funding;
        public final double pnl;

        public TradeEntry(TradeRecord trade, double fees, double slippage, double funding) {
            this.trade = trade;
            this.fees = fees;
            this.slippage = slippage;
            this.funding = funding;
            this.pnl = trade.getRealizedPnl() - fees - slippage - funding;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof TradeEntry)) {
                return false;
            }
            TradeEntry other = (TradeEntry) o;
            return trade.equals(other.trade)
                    && Double.compare(fees, other.fees) == 0
                    && Double.compare(slippage, other.slippage) == 0
                    && Double.compare(funding, other.funding) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(trade, fees, slippage, funding);
        }
    }

    /**
     * Equity after a bar.
     */
    public static class EquityPoint {
        public final Instant timestamp;
        public final double equity;

        public EquityPoint(Instant timestamp, double equity) {
            this.timestamp = timestamp;
            this.equity = equity;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof EquityPoint)) {
                return false;
            }
            EquityPoint other = (EquityPoint) o;
            return timestamp.equals(other.timestamp) && Double.compare(equity, other.equity) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(timestamp, equity);
        }
    }

    /**
     * Calculate all metrics from the trade log and equity curve. Metrics stay
     * at zero without trades or with fewer than two equity points.
     */
    public void calculateMetrics() {
        finalBalance = equityCurve.isEmpty() ? initialBalance : equityCurve.get(equityCurve.size() - 1).equity;
        netProfit = finalBalance - initialBalance;
        totalTrades = trades.size();
        totalFees = trades.stream().mapToDouble(t -> t.fees).sum();
        totalSlippage = trades.stream().mapToDouble(t -> t.slippage).sum();
        totalFunding = trades.stream().mapToDouble(t -> t.funding).sum();

        if (trades.isEmpty() || equityCurve.size() < 2) {
            return;
        }

        winningTrades = (int) trades.stream().filter(t -> t.pnl > 0).count();
        losingTrades = (int) trades.stream().filter(t -> t.pnl < 0).count();
        stopLossTrades = (int) trades.stream()
                .filter(t -> t.trade.getExitReason() == ExitReason.STOP_LOSS).count();
        winRate = (double) winningTrades / totalTrades;
        stopLossRate = (double) stopLossTrades / totalTrades;

        totalProfit = trades.stream().filter(t -> t.pnl > 0).mapToDouble(t -> t.pnl).sum();
        totalLoss = Math.abs(trades.stream().filter(t -> t.pnl < 0).mapToDouble(t -> t.pnl).sum());
        // Wins without a single loss are reported as infinite
        if (totalLoss > 0) {
            profitFactor = totalProfit / totalLoss;
        } else {
            profitFactor = totalProfit > 0 ? Double.POSITIVE_INFINITY : 0;
        }

        averageHoldingHours = trades.stream().mapToDouble(t -> t.trade.holdingHours()).average().orElse(0);

        EquityPoint first = equityCurve.get(0);
        EquityPoint last = equityCurve.get(equityCurve.size() - 1);

        // Annualized return
        double years = Duration.between(first.timestamp, last.timestamp).getSeconds() / SECONDS_PER_YEAR;
        if (first.equity > 0 && last.equity > 0 && years > 0) {
            annualizedReturn = Math.pow(last.equity / first.equity, 1.0 / years) - 1.0;
        }

        // Max drawdown as a fraction of the running peak
        double peak = 0.0;
        for (EquityPoint point : equityCurve) {
            if (point.equity > peak) {
                peak = point.equity;
            }
            if (peak > 0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - point.equity) / peak);
            }
        }

        // Sharpe: per-bar returns, sample std, annualized by the observed bar spacing
        List<Double> returns = new ArrayList<>();
        long totalSeconds = 0;
        for (int i = 1; i < equityCurve.size(); i++) {
            EquityPoint prev = equityCurve.get(i - 1);
            EquityPoint next = equityCurve.get(i);
            if (prev.equity > 0) {
                returns.add(next.equity / prev.equity - 1.0);
                totalSeconds += Duration.between(prev.timestamp, next.timestamp).getSeconds();
            }
        }
        if (returns.size() >= 2 && totalSeconds > 0) {
            double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0);
            double variance = returns.stream().mapToDouble(r -> (r - mean) * (r - mean)).sum()
                    / (returns.size() - 1);
            double std = Math.sqrt(variance);
            double periodsPerYear = SECONDS_PER_YEAR / ((double) totalSeconds / returns.size());
            sharpeRatio = std > 0 ? mean / std * Math.sqrt(periodsPerYear) : 0;
        }
    }

    /**
     * Net PnL per calendar month (UTC) of the exit time.
     */
    public Map<YearMonth, Double> monthlyBreakdown() {
        Map<YearMonth, Double> months = new TreeMap<>();
        for (TradeEntry entry : trades) {
            YearMonth month = YearMonth.from(entry.trade.getExitTime().atZone(ZoneOffset.UTC));
            months.merge(month, entry.pnl, Double::sum);
        }
        return months;
    }

    /**
     * Get formatted summary string
     */
    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(60)).append("\n");
        sb.append("  BACKTEST REPORT\n");
        sb.append("=".repeat(60)).append("\n");
        sb.append(String.format("Strategy: %s | Bars: %d\n", strategyId, barCount));
        sb.append(String.format("Period: %s to %s\n", startTime, endTime));
        sb.append("\n");

        sb.append("FINANCIAL PERFORMANCE\n");
        sb.append("-".repeat(60)).append("\n");
        sb.append(String.format("Initial Balance: $%.2f\n", initialBalance));
        sb.append(String.format("Final Balance:   $%.2f\n", finalBalance));
        sb.append(String.format("Net Profit:      $%.2f (%.2f%%)\n", netProfit, getNetProfitPercent()));
        sb.append(String.format("Total Trades:    %d (Won: %d, Lost: %d)\n", totalTrades, winningTrades, losingTrades));
        sb.append(String.format("Win Rate:        %.1f%%\n", winRate * 100));
        sb.append(String.format("Profit Factor:   %.2f\n", profitFactor));
        sb.append(String.format("Costs:           fees $%.2f, slippage $%.2f, funding $%.2f\n",
                totalFees, totalSlippage, totalFunding));
        sb.append("\n");

        sb.append("RISK METRICS\n");
        sb.append("-".repeat(60)).append("\n");
        sb.append(String.format("Max Drawdown:    %.2f%%\n", maxDrawdown * 100));
        sb.append(String.format("Sharpe Ratio:    %.2f\n", sharpeRatio));
        sb.append(String.format("Annual Return:   %.2f%%\n", annualizedReturn * 100));
        sb.append(String.format("Stop-Loss Rate:  %.1f%%\n", stopLossRate * 100));
        sb.append(String.format("Avg Holding:     %.1f h\n", averageHoldingHours));
        sb.append("\n");

        Map<YearMonth, Double> months = monthlyBreakdown();
        if (!months.isEmpty()) {
            sb.append("MONTHLY PNL\n");
            sb.append("-".repeat(60)).append("\n");
            for (Map.Entry<YearMonth, Double> month : months.entrySet()) {
                sb.append(String.format("%s: $%.2f\n", month.getKey(), month.getValue()));
            }
        }
        sb.append("=".repeat(60)).append("\n");
        return sb.toString();
    }

    public double getNetProfitPercent() {
        if (initialBalance == 0) {
            return 0.0;
        }
        return (netProfit / initialBalance) * 100;
    }

    public JSONObject metricsJson() {
        JSONObject json = new JSONObject();
        json.put("strategyId", strategyId);
        json.put("tradeCount", totalTrades);
        json.put("winRate", winRate);
        // JSON has no infinity
        json.put("profitFactor", Double.isInfinite(profitFactor) ? "Infinity" : profitFactor);
        json.put("stopLossRate", stopLossRate);
        json.put("annualizedReturn", annualizedReturn);
        json.put("sharpeRatio", sharpeRatio);
        json.put("maxDrawdown", maxDrawdown);
        json.put("netProfit", netProfit);
        json.put("finalBalance", finalBalance);

        JSONArray monthly = new JSONArray();
        for (Map.Entry<YearMonth, Double> month : monthlyBreakdown().entrySet()) {
            monthly.put(new JSONObject().put("month", month.getKey().toString()).put("pnl", month.getValue()));
        }
        json.put("monthly", monthly);
        return json;
    }

    public void exportMetricsJson(Path path) throws IOException {
        Files.writeString(path, metricsJson().toString(2), StandardCharsets.UTF_8);
    }

    public void exportTradesCsv(Path path) throws IOException {
        StringBuilder csv = new StringBuilder(
                "entry_time,exit_time,direction,entry_eth,entry_btc,exit_eth,exit_btc,notional_eth,notional_btc,"
                        + "gross_pnl,fees,slippage,funding,pnl,exit_reason\n");
        for (TradeEntry entry : trades) {
            TradeRecord t = entry.trade;
            csv.append(t.getEntryTime()).append(',')
                    .append(t.getExitTime()).append(',')
                    .append(t.getDirection()).append(',')
                    .append(t.getEntryEthPrice()).append(',')
                    .append(t.getEntryBtcPrice()).append(',')
                    .append(t.getExitEthPrice()).append(',')
                    .append(t.getExitBtcPrice()).append(',')
                    .append(t.getNotionalEth()).append(',')
                    .append(t.getNotionalBtc()).append(',')
                    .append(t.getRealizedPnl()).append(',')
                    .append(entry.fees).append(',')
                    .append(entry.slippage).append(',')
                    .append(entry.funding).append(',')
                    .append(entry.pnl).append(',')
                    .append(t.getExitReason()).append('\n');
        }
        Files.writeString(path, csv.toString(), StandardCharsets.UTF_8);
    }

    public void exportEquityCsv(Path path) throws IOException {
        StringBuilder csv = new StringBuilder("timestamp,equity\n");
        for (EquityPoint point : equityCurve) {
            csv.append(point.timestamp).append(',').append(point.equity).append('\n');
        }
        Files.writeString(path, csv.toString(), StandardCharsets.UTF_8);
    }
}
