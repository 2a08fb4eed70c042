package com.zonecast.core.model;

import com.zonecast.core.hash.Hashers;

/**
 * Deterministic avatar colors.
 */
public final class Colors {
    private static final int MIN_CHANNEL = 0x40;

    private Colors() {
    }

    /**
     * Derives a stable {@code #rrggbb} color from a string. Each channel is kept above
     * a floor so the color stays readable on a dark background.
     *
     * @param value e.g. the player name
     * @return hex color
     */
    public static String colorFor(String value) {
        long hash = Hashers.stableHash(value == null ? "" : value);
        int r = channel(hash);
        int g = channel(hash >>> 8);
        int b = channel(hash >>> 16);
        return String.format("#%02x%02x%02x", r, g, b);
    }

    private static int channel(long bits) {
        return MIN_CHANNEL + (int) ((bits & 0xFF) * (0xFF - MIN_CHANNEL) / 0xFF);
    }
}
