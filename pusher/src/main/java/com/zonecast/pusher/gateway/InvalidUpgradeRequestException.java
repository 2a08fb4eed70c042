package com.zonecast.pusher.gateway;

/**
 * The upgrade query string is missing a parameter or carries a malformed one.
 */
public class InvalidUpgradeRequestException extends RuntimeException {
    public InvalidUpgradeRequestException(String message) {
        super(message);
    }
}
