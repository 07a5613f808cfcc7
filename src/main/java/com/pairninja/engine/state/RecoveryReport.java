package com.pairninja.engine.state;

import com.pairninja.infra.AlertLevel;
import com.pairninja.model.StrategyState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Startup diagnosis: the state to hydrate, what looked wrong, what to do about
 * it and who to tell.
 */
public class RecoveryReport {

    private final StrategyState state;
    private final List<String> anomalies = new ArrayList<>();
    private final List<RecoveryAction> actions = new ArrayList<>();
    private final List<Alert> alerts = new ArrayList<>();

    RecoveryReport(StrategyState state) {
        this.state = state;
    }

    public StrategyState getState() {
        return state;
    }

    public List<String> getAnomalies() {
        return Collections.unmodifiableList(anomalies);
    }

    public List<RecoveryAction> getActions() {
        return Collections.unmodifiableList(actions);
    }

    public List<Alert> getAlerts() {
        return Collections.unmodifiableList(alerts);
    }

    public boolean isClean() {
        return anomalies.isEmpty() && actions.isEmpty();
    }

    void addAnomaly(String anomaly) {
        anomalies.add(anomaly);
    }

    void addAction(RecoveryAction action) {
        if (!actions.contains(action)) {
            actions.add(action);
        }
    }

    void addAlert(AlertLevel level, String message) {
        alerts.add(new Alert(level, message));
    }

    public static final class Alert {
        private final AlertLevel level;
        private final String message;

        public Alert(AlertLevel level, String message) {
            this.level = level;
            this.message = message;
        }

        public AlertLevel getLevel() {
            return level;
        }

        public String getMessage() {
            return message;
        }
    }
}
