package com.zonecast.pusher.ws;

/**
 * WebSocket close codes used by the pusher.
 */
public final class CloseCodes {
    private CloseCodes() {
    }

    public static final int NORMAL = 1000;
    public static final int GOING_AWAY = 1001;
    public static final int INVALID_PAYLOAD = 1007;
    public static final int POLICY_VIOLATION = 1008;

    /**
     * Close frames carry at most 123 bytes of reason.
     */
    public static String reason(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 120 ? text.substring(0, 120) : text;
    }
}
