package com.zonecast.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Availability shown next to a player, as sent by clients in their numeric form.
 */
public enum AvailabilityStatus {
    UNCHANGED(0),
    ONLINE(1),
    SILENT(2),
    AWAY(3),
    JITSI(4),
    BBB(5),
    DENY_PROXIMITY_MEETING(6),
    SPEAKER(7),
    BUSY(8),
    DO_NOT_DISTURB(9),
    BACK_IN_A_MOMENT(10);

    private final int code;

    AvailabilityStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static Optional<AvailabilityStatus> fromCode(int code) {
        return Arrays.stream(values()).filter(s -> s.code == code).findFirst();
    }
}
