package com.pairninja.infra;

/**
 * Operator notifications. Best-effort: implementations log delivery failures
 * and never throw, so a broken channel cannot interrupt trading.
 */
public interface AlertSink {

    void send(AlertLevel level, String message);
}
