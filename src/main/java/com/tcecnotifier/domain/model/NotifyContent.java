package com.tcecnotifier.domain.model;

import java.util.Set;

/**
 * What gets announced when a new game leaves book.
 */
public record NotifyContent(
    String tournament,
    EngineName whitePlayer,
    EngineName blackPlayer,
    Set<String> mentions
) {

    public static NotifyContent forGame(PgnGame game, Set<String> mentions) {
        return new NotifyContent(game.getEvent(), game.getWhitePlayer(), game.getBlackPlayer(), Set.copyOf(mentions));
    }
}
