package com.tcecnotifier.domain.ports;

import com.tcecnotifier.domain.model.PgnGame;

/**
 * Port for reading the game currently being played on the live feed.
 */
public interface GameFeedGateway {

    /**
     * Fetches and parses the current game.
     *
     * @return The current game, which may still be in its opening
     * @throws Exception if the feed cannot be fetched or its PGN cannot be parsed
     */
    PgnGame fetchCurrentGame() throws Exception;
}
