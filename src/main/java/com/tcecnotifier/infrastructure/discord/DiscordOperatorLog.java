package com.tcecnotifier.infrastructure.discord;

import com.tcecnotifier.domain.ports.OperatorLog;
import com.tcecnotifier.infrastructure.config.TcecProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Operator log that writes through SLF4J and mirrors each line to the log
 * webhook when one is configured.
 */
@Component
public class DiscordOperatorLog implements OperatorLog {

    private static final Logger logger = LoggerFactory.getLogger(DiscordOperatorLog.class);

    private final String logWebhook;

    public DiscordOperatorLog(TcecProperties properties) {
        this.logWebhook = properties.hasLogWebhook() ? properties.logWebhook() : null;
    }

    @Override
    public void start() {
        logger.info("TCEC notifier started");
        relay(":green_circle: Started");
    }

    @Override
    public void info(String message) {
        logger.info(message);
        relay(":information_source: " + message);
    }

    @Override
    public void warning(String message) {
        logger.warn(message);
        relay(":warning: " + message);
    }

    @Override
    public void error(String message) {
        logger.error(message);
        relay(":x: " + message);
    }

    private void relay(String message) {
        if (logWebhook == null) {
            return;
        }
        try {
            DiscordWebhookNotifier.sendMessage(logWebhook, message);
        } catch (IOException e) {
            logger.warn("Unable to relay log message to Discord", e);
        }
    }
}
