package com.tcecnotifier.infrastructure.tcec;

import com.tcecnotifier.domain.model.PgnGame;
import com.tcecnotifier.domain.ports.GameFeedGateway;
import com.tcecnotifier.infrastructure.config.TcecProperties;
import com.tcecnotifier.infrastructure.http.HttpClientUtil;
import com.tcecnotifier.infrastructure.pgn.PgnParseException;
import com.tcecnotifier.infrastructure.pgn.PgnParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * Reads the game in progress from the TCEC live PGN.
 */
@Component
public class TcecLiveGameClient implements GameFeedGateway {

    private static final Logger logger = LoggerFactory.getLogger(TcecLiveGameClient.class);

    private static final Map<String, String> HEADERS = Map.of(
        "accept", "application/x-chess-pgn, text/plain, */*",
        "user-agent", "tcec-notifier"
    );

    private final TcecProperties properties;

    public TcecLiveGameClient(TcecProperties properties) {
        this.properties = properties;
    }

    @Override
    public PgnGame fetchCurrentGame() throws IOException, PgnParseException {
        String pgn = HttpClientUtil.getText(properties.pgnUrl(), HEADERS);
        logger.debug("Fetched {} characters of PGN from {}", pgn.length(), properties.pgnUrl());

        return PgnParser.parse(pgn);
    }
}
