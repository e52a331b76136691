package com.tcecnotifier.infrastructure.discord;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tcecnotifier.domain.model.NotifyContent;
import com.tcecnotifier.domain.ports.NotificationGateway;
import com.tcecnotifier.infrastructure.config.TcecProperties;
import com.tcecnotifier.infrastructure.http.HttpClientUtil;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.stream.Collectors;

/**
 * Announces new games on a Discord channel through a webhook.
 */
@Component
public class DiscordWebhookNotifier implements NotificationGateway {

    static final String USERNAME = "tcec-notifier";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final TcecProperties properties;

    public DiscordWebhookNotifier(TcecProperties properties) {
        this.properties = properties;
    }

    @Override
    public void notify(NotifyContent content) throws IOException {
        sendMessage(properties.notifyWebhook(), formatMessage(content, properties.siteUrl()));
    }

    /**
     * Formats the announcement, e.g.
     * {@code [`TCEC Season 29`](https://tcec-chess.com/) `Stockfish` vs. `Lc0`   cc. <@!1> <@!2>}.
     */
    public static String formatMessage(NotifyContent content, String siteUrl) {
        String mentions = "";
        if (!content.mentions().isEmpty()) {
            mentions = "   cc. " + content.mentions().stream()
                .sorted()
                .map(m -> "<@!" + m + ">")
                .collect(Collectors.joining(" "));
        }

        return String.format("[`%s`](%s) `%s` vs. `%s`%s",
            content.tournament(), siteUrl, content.whitePlayer(), content.blackPlayer(), mentions);
    }

    /**
     * Posts a plain message; only user mentions are allowed to ping.
     */
    public static void sendMessage(String webhookUrl, String message) throws IOException {
        HttpClientUtil.postJson(webhookUrl, buildPayload(message));
    }

    static ObjectNode buildPayload(String message) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("username", USERNAME);
        payload.putObject("allowed_mentions").putArray("parse").add("users");
        payload.put("content", message);
        return payload;
    }
}
