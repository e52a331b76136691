package com.tcecnotifier.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Subscriber configuration: configured engine name to the Discord user ids to mention.
 *
 * Value equality is used to detect configuration changes between polls.
 */
public record NotifyConfig(Map<String, Set<String>> engines) {

    public NotifyConfig {
        Map<String, Set<String>> copy = new HashMap<>();
        engines.forEach((engine, users) -> copy.put(engine, Set.copyOf(users)));
        engines = Collections.unmodifiableMap(copy);
    }

    public static NotifyConfig empty() {
        return new NotifyConfig(Map.of());
    }

    /**
     * Builds the engine to users mapping from a users to engines listing.
     */
    public static NotifyConfig fromUserSubscriptions(Map<String, ? extends Iterable<String>> users) {
        Map<String, Set<String>> enginesToUsers = new HashMap<>();
        users.forEach((user, engines) -> {
            for (String engine : engines) {
                enginesToUsers.computeIfAbsent(engine, k -> new LinkedHashSet<>()).add(user);
            }
        });
        return new NotifyConfig(enginesToUsers);
    }
}
