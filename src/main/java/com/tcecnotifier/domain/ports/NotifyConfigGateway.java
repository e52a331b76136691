package com.tcecnotifier.domain.ports;

import com.tcecnotifier.domain.model.NotifyConfig;

/**
 * Port for loading the subscriber configuration.
 */
public interface NotifyConfigGateway {

    /**
     * @return The current engine to subscribers mapping
     * @throws Exception if the configuration cannot be fetched or parsed
     */
    NotifyConfig fetchNotifyConfig() throws Exception;
}
