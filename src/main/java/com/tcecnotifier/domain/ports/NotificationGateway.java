package com.tcecnotifier.domain.ports;

import com.tcecnotifier.domain.model.NotifyContent;

import java.io.IOException;

/**
 * Port for announcing a new game.
 */
public interface NotificationGateway {

    void notify(NotifyContent content) throws IOException;
}
