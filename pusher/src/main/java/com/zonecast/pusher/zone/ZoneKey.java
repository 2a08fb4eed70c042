package com.zonecast.pusher.zone;

/**
 * Coordinates of one zone cell inside a room.
 */
public record ZoneKey(String roomId, int x, int y) {
}
