package com.zonecast.pusher.gateway;

/**
 * Why an upgrade was refused. A {@code null} reason means a generic refusal.
 */
public enum RejectionReason {
    TOKEN_INVALID,
    ERROR,
    INVALID_TEXTURE
}
