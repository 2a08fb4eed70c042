package com.zonecast.pusher.zone;

import java.util.Set;

/**
 * Zones a session started and stopped listening to after a viewport change.
 */
public record ZoneDelta(Set<ZoneKey> entered, Set<ZoneKey> left) {
    public static final ZoneDelta EMPTY = new ZoneDelta(Set.of(), Set.of());

    public boolean isEmpty() {
        return entered.isEmpty() && left.isEmpty();
    }
}
