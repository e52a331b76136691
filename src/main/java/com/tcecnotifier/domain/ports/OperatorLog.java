package com.tcecnotifier.domain.ports;

/**
 * Port for operator-facing messages about the notifier itself.
 */
public interface OperatorLog {

    void start();

    void info(String message);

    void warning(String message);

    void error(String message);
}
