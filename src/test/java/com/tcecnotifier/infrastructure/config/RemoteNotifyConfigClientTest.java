package com.tcecnotifier.infrastructure.config;

import com.tcecnotifier.domain.model.NotifyConfig;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RemoteNotifyConfigClient.
 */
class RemoteNotifyConfigClientTest {

    @Test
    void testParseConfigInvertsUsersToEngines() throws Exception {
        String document = "{\n"
            + "  // subscribers\n"
            + "  users: {\n"
            + "    '111': ['Stockfish', 'Lc0',],\n"
            + "    \"222\": [\"Stockfish\"],\n"
            + "  },\n"
            + "}\n";

        NotifyConfig config = RemoteNotifyConfigClient.parseConfig(document);

        assertEquals(Map.of(
            "Stockfish", Set.of("111", "222"),
            "Lc0", Set.of("111")), config.engines());
    }

    @Test
    void testEqualConfigsCompareEqual() throws Exception {
        NotifyConfig a = RemoteNotifyConfigClient.parseConfig("{users: {'1': ['Lunar'], '2': ['Lunar']}}");
        NotifyConfig b = RemoteNotifyConfigClient.parseConfig("{users: {'2': ['Lunar'], '1': ['Lunar']}}");
        NotifyConfig c = RemoteNotifyConfigClient.parseConfig("{users: {'1': ['Lunar']}}");

        assertEquals(a, b);
        assertNotEquals(a, c);
    }

    @Test
    void testEmptyUsers() throws Exception {
        assertEquals(NotifyConfig.empty(), RemoteNotifyConfigClient.parseConfig("{users: {}}"));
    }

    @Test
    void testMissingUsersFails() {
        assertThrows(IOException.class, () -> RemoteNotifyConfigClient.parseConfig("{engines: {}}"));
        assertThrows(IOException.class, () -> RemoteNotifyConfigClient.parseConfig("{users: {'1': 'Lunar'}}"));
        assertThrows(IOException.class, () -> RemoteNotifyConfigClient.parseConfig("{users: "));
    }
}
