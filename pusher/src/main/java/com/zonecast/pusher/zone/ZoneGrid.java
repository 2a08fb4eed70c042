package com.zonecast.pusher.zone;

import com.zonecast.core.model.Viewport;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fixed-size partition of room coordinates into zone cells.
 */
public class ZoneGrid {
    private final int zoneWidth;
    private final int zoneHeight;

    public ZoneGrid(int zoneWidth, int zoneHeight) {
        if (zoneWidth <= 0 || zoneHeight <= 0) {
            throw new IllegalArgumentException("Zone size must be positive: " + zoneWidth + "x" + zoneHeight);
        }
        this.zoneWidth = zoneWidth;
        this.zoneHeight = zoneHeight;
    }

    /**
     * Every cell the viewport overlaps, bounds inclusive. An inverted viewport overlaps nothing.
     */
    public Set<ZoneKey> zonesFor(String roomId, Viewport viewport) {
        if (viewport == null || viewport.isEmpty()) {
            return Collections.emptySet();
        }
        int fromX = Math.floorDiv(viewport.getLeft(), zoneWidth);
        int toX = Math.floorDiv(viewport.getRight(), zoneWidth);
        int fromY = Math.floorDiv(viewport.getTop(), zoneHeight);
        int toY = Math.floorDiv(viewport.getBottom(), zoneHeight);

        Set<ZoneKey> zones = new LinkedHashSet<>();
        for (int y = fromY; y <= toY; y++) {
            for (int x = fromX; x <= toX; x++) {
                zones.add(new ZoneKey(roomId, x, y));
            }
        }
        return zones;
    }
}
