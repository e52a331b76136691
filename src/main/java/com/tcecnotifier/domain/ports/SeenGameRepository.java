package com.tcecnotifier.domain.ports;

import com.tcecnotifier.domain.model.PgnGame;

import java.io.IOException;

/**
 * Port for remembering which games were already announced.
 */
public interface SeenGameRepository {

    /**
     * @param game A parsed game
     * @return true if a game with the same identity hash was added before
     */
    boolean contains(PgnGame game);

    /**
     * Records the game as seen.
     *
     * The game is remembered in memory even when persisting it fails, so it is
     * not announced again during this run.
     *
     * @throws IOException if the game could not be persisted
     */
    void add(PgnGame game) throws IOException;

    /**
     * @return Number of remembered games
     */
    int size();
}
