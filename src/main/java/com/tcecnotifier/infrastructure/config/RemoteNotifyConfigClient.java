package com.tcecnotifier.infrastructure.config;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.tcecnotifier.domain.model.NotifyConfig;
import com.tcecnotifier.domain.ports.NotifyConfigGateway;
import com.tcecnotifier.infrastructure.http.HttpClientUtil;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the subscriber configuration from a remote JSON5-style document:
 *
 * <pre>
 * {
 *   users: {
 *     // discord user id: engines to be told about
 *     "106120945231466496": ["Stockfish", "Lc0"],
 *   },
 * }
 * </pre>
 */
@Component
public class RemoteNotifyConfigClient implements NotifyConfigGateway {

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
        .enable(JsonReadFeature.ALLOW_YAML_COMMENTS)
        .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
        .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
        .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
        .build();

    private final TcecProperties properties;

    public RemoteNotifyConfigClient(TcecProperties properties) {
        this.properties = properties;
    }

    @Override
    public NotifyConfig fetchNotifyConfig() throws IOException {
        JsonNode document = HttpClientUtil.getJson(properties.configUrl(), Map.of(), LENIENT_MAPPER);
        return toNotifyConfig(document);
    }

    /**
     * Parses a configuration document given as text.
     */
    public static NotifyConfig parseConfig(String document) throws IOException {
        return toNotifyConfig(LENIENT_MAPPER.readTree(document));
    }

    static NotifyConfig toNotifyConfig(JsonNode document) throws IOException {
        JsonNode users = document.get("users");
        if (users == null || !users.isObject()) {
            throw new IOException("Config document has no 'users' object");
        }

        Map<String, List<String>> subscriptions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = users.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isArray()) {
                throw new IOException("Engines of user " + field.getKey() + " must be a list");
            }
            List<String> engines = new ArrayList<>();
            for (JsonNode engine : field.getValue()) {
                engines.add(engine.asText());
            }
            subscriptions.put(field.getKey(), engines);
        }

        return NotifyConfig.fromUserSubscriptions(subscriptions);
    }
}
