package com.pairninja.engine.sizing;

import com.pairninja.config.ConfigException;
import com.pairninja.config.FundingMode;
import com.pairninja.config.StrategyConfig;
import com.pairninja.model.FundingRate;
import com.pairninja.model.FundingSnapshot;
import com.pairninja.model.TradeDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Funding cost estimation and entry controls.
 *
 * Enabled modes always compose in the same order, whatever order they are
 * configured in:
 * 1. FILTER: veto the entry when the estimated cost exceeds the threshold
 * 2. THRESHOLD: raise the effective entry z by k * normalized cost
 * 3. SIZE: scale capital by clamp(1 - alpha * normalized cost, minSizeRatio, 1)
 */
public class FundingController {
    private static final Logger logger = LoggerFactory.getLogger(FundingController.class);

    private final StrategyConfig.FundingParams params;
    private final int horizonHours;

    /**
     * @param horizonHours worst-case holding horizon used for estimates (max hold hours)
     */
    public FundingController(StrategyConfig.FundingParams params, int horizonHours) {
        this.params = params;
        this.horizonHours = horizonHours;
    }

    /**
     * Funding paid over the given holding time. Long legs pay a positive rate,
     * short legs receive it.
     */
    public static FundingCostEstimate estimateCost(TradeDirection direction, double notionalEth, double notionalBtc,
            FundingRate ethRate, FundingRate btcRate, double holdHours) {
        int intervalHours = ethRate.getIntervalHours();
        if (intervalHours <= 0 || btcRate.getIntervalHours() != intervalHours) {
            throw new IllegalArgumentException("Funding intervals must be equal and > 0: ETH "
                    + ethRate.getIntervalHours() + "h, BTC " + btcRate.getIntervalHours() + "h");
        }
        if (holdHours < 0) {
            throw new IllegalArgumentException("Holding hours must be >= 0, got " + holdHours);
        }
        int intervals = (int) Math.ceil(holdHours / intervalHours);
        double ethFlow = ethRate.getRate() * notionalEth;
        double btcFlow = btcRate.getRate() * notionalBtc;
        double perInterval = direction == TradeDirection.LONG_ETH_SHORT_BTC
                ? ethFlow - btcFlow
                : -ethFlow + btcFlow;
        double cost = Math.max(perInterval * intervals, 0.0);
        double totalNotional = notionalEth + notionalBtc;
        double normalized = totalNotional > 0 ? cost / totalNotional : 0.0;
        return new FundingCostEstimate(cost, normalized, intervals);
    }

    /**
     * Apply the enabled controls to a candidate entry.
     *
     * @param baseCapital capital before the SIZE control
     * @param baseEntryZ  configured entry z
     * @param funding     current funding, null when unavailable (no adjustment)
     */
    public FundingDecision apply(TradeDirection direction, double baseCapital, double baseEntryZ,
            double notionalEth, double notionalBtc, FundingSnapshot funding) {
        if (funding == null) {
            return FundingDecision.unadjusted(baseEntryZ, baseCapital);
        }
        FundingCostEstimate estimate = estimateCost(direction, notionalEth, notionalBtc,
                funding.getEth(), funding.getBtc(), horizonHours);

        boolean veto = false;
        double effectiveEntryZ = baseEntryZ;
        double capital = baseCapital;

        if (params.modes.contains(FundingMode.FILTER)) {
            double threshold = required(params.costThreshold, "funding.cost.threshold");
            if (estimate.getCost() > threshold) {
                veto = true;
                logger.info("⚠️ Funding FILTER veto: cost {} > threshold {}", estimate.getCost(), threshold);
            }
        }
        if (params.modes.contains(FundingMode.THRESHOLD)) {
            double k = required(params.thresholdK, "funding.threshold.k");
            effectiveEntryZ = baseEntryZ + k * estimate.getNormalizedCost();
        }
        if (params.modes.contains(FundingMode.SIZE)) {
            double alpha = required(params.sizeAlpha, "funding.size.alpha");
            double minRatio = required(params.minSizeRatio, "funding.size.min.ratio");
            double raw = 1.0 - alpha * estimate.getNormalizedCost();
            double ratio = Double.isNaN(raw) ? minRatio : Math.min(1.0, Math.max(minRatio, raw));
            capital = baseCapital * ratio;
        }
        return new FundingDecision(veto, effectiveEntryZ, capital, estimate);
    }

    private static double required(Double value, String key) {
        if (value == null) {
            throw new ConfigException(key, "required by the enabled funding mode");
        }
        return value;
    }
}
