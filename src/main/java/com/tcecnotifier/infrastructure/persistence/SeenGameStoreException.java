package com.tcecnotifier.infrastructure.persistence;

import java.io.IOException;

/**
 * Thrown when the seen-games state file holds a line that is not a game hash.
 */
public class SeenGameStoreException extends IOException {

    public SeenGameStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
