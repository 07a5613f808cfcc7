package com.pairninja.engine.state;

import com.pairninja.infra.AlertLevel;
import com.pairninja.model.PositionSnapshot;
import com.pairninja.model.StrategyState;
import com.pairninja.model.StrategyStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reconciles a stored state once at startup, before the live loop.
 *
 * Checks:
 * - expired COOLDOWN becomes FLAT
 * - COOLDOWN without an end time becomes FLAT
 * - IN_POSITION with empty legs becomes FLAT
 * - a single open leg, under any status, is kept on a FLAT/COOLDOWN state and
 *   flagged for residual repair
 * - both legs open under FLAT/COOLDOWN are adopted as IN_POSITION
 *
 * Recovery never trades. The orchestrator acts on the returned report.
 */
public final class StateRecovery {
    private static final Logger logger = LoggerFactory.getLogger(StateRecovery.class);

    private StateRecovery() {
    }

    public static RecoveryReport recover(StrategyState stored, Instant now) {
        if (stored == null) {
            return new RecoveryReport(StrategyState.flat());
        }
        StrategyStatus status = stored.getStatus();
        PositionSnapshot position = stored.getPosition();
        Instant cooldownUntil = stored.getCooldownUntil();
        if (position != null && position.isFlat()) {
            position = null;
        }

        List<String> anomalies = new ArrayList<>();
        List<RecoveryAction> actions = new ArrayList<>();
        List<RecoveryReport.Alert> alerts = new ArrayList<>();

        if (status == StrategyStatus.COOLDOWN) {
            if (cooldownUntil == null) {
                anomalies.add("COOLDOWN without cooldown end time");
                alerts.add(new RecoveryReport.Alert(AlertLevel.WARNING,
                        "Stored COOLDOWN had no end time, resetting to FLAT"));
                status = StrategyStatus.FLAT;
            } else if (!now.isBefore(cooldownUntil)) {
                logger.info("⏰ Stored cooldown expired at {}, resuming FLAT", cooldownUntil);
                status = StrategyStatus.FLAT;
                cooldownUntil = null;
            }
        }

        if (status == StrategyStatus.IN_POSITION) {
            if (position == null) {
                anomalies.add("IN_POSITION but both legs are empty");
                alerts.add(new RecoveryReport.Alert(AlertLevel.CRITICAL,
                        "Stored IN_POSITION has no open legs, resetting to FLAT"));
                status = StrategyStatus.FLAT;
            } else if (position.hasResidual()) {
                anomalies.add("IN_POSITION with a single open leg: " + position);
                alerts.add(new RecoveryReport.Alert(AlertLevel.CRITICAL,
                        "Residual exposure found at startup: " + position));
                actions.add(RecoveryAction.REPAIR_RESIDUAL);
                status = StrategyStatus.FLAT;
            }
        } else if (position != null) {
            if (position.isHedged()) {
                anomalies.add(status + " but both legs are open: " + position);
                alerts.add(new RecoveryReport.Alert(AlertLevel.WARNING,
                        "Stored " + status + " holds an open hedge, resuming IN_POSITION: " + position));
                actions.add(RecoveryAction.RESUME_POSITION);
                status = StrategyStatus.IN_POSITION;
                cooldownUntil = null;
            } else {
                anomalies.add(status + " with residual leg: " + position);
                alerts.add(new RecoveryReport.Alert(AlertLevel.CRITICAL,
                        "Residual exposure found at startup: " + position));
                actions.add(RecoveryAction.REPAIR_RESIDUAL);
            }
        }

        if (status != StrategyStatus.COOLDOWN) {
            cooldownUntil = null;
        }
        RecoveryReport report = new RecoveryReport(new StrategyState(status, position, cooldownUntil));
        anomalies.forEach(report::addAnomaly);
        actions.forEach(report::addAction);
        alerts.forEach(alert -> report.addAlert(alert.getLevel(), alert.getMessage()));

        if (!report.isClean()) {
            logger.warn("⚠️ Recovery found {} anomalies, actions {}", anomalies.size(), actions);
        }
        return report;
    }
}
