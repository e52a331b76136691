package com.tcecnotifier.infrastructure.config;

/**
 * Endpoints the notifier talks to.
 *
 * @param pgnUrl        Live game feed, one PGN game
 * @param siteUrl       Link shown in announcements
 * @param configUrl     Subscriber configuration document
 * @param notifyWebhook Discord webhook for game announcements
 * @param logWebhook    Discord webhook for operator messages, may be null
 */
public record TcecProperties(
    String pgnUrl,
    String siteUrl,
    String configUrl,
    String notifyWebhook,
    String logWebhook
) {

    public boolean hasLogWebhook() {
        return logWebhook != null && !logWebhook.isBlank();
    }
}
