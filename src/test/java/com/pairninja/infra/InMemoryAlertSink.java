package com.pairninja.infra;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects alerts for assertions.
 */
public class InMemoryAlertSink implements AlertSink {

    public static final class Alert {
        public final AlertLevel level;
        public final String message;

        Alert(AlertLevel level, String message) {
            this.level = level;
            this.message = message;
        }
    }

    private final List<Alert> alerts = new ArrayList<>();

    @Override
    public synchronized void send(AlertLevel level, String message) {
        alerts.add(new Alert(level, message));
    }

    public synchronized List<Alert> getAlerts() {
        return new ArrayList<>(alerts);
    }

    public synchronized long count(AlertLevel level) {
        return alerts.stream().filter(a -> a.level == level).count();
    }
}
