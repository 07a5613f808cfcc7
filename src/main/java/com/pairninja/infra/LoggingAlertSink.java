package com.pairninja.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Alerts written to the application log only.
 */
public class LoggingAlertSink implements AlertSink {
    private static final Logger logger = LoggerFactory.getLogger(LoggingAlertSink.class);

    @Override
    public void send(AlertLevel level, String message) {
        switch (level) {
            case CRITICAL:
                logger.error("🚨 {}", message);
                break;
            case WARNING:
                logger.warn("⚠️ {}", message);
                break;
            case INFO:
            default:
                logger.info("ℹ️ {}", message);
                break;
        }
    }
}
