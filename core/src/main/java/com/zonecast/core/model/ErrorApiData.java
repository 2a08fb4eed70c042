package com.zonecast.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Structured, user-facing error description.
 * <p>
 * Returned by the member-data provider when it refuses a connection, and produced by the
 * gateway itself for version mismatches. Clients render it as an error screen.
 * </p>
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ErrorApiData {
    /**
     * "error", "retry", "unauthorized" or "redirect".
     */
    String type;
    String code;
    String title;
    String subtitle;
    String details;
    String image;
    String buttonTitle;
    boolean canRetryManual;
    long timeToRetry;
}
