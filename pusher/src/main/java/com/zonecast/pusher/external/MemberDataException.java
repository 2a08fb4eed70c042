package com.zonecast.pusher.external;

import com.zonecast.core.model.ErrorApiData;
import lombok.Getter;

/**
 * The admin API refused or failed a member lookup.
 * <p>
 * When the API answered with a structured error body, {@link #getErrorData()} carries it and
 * the client is shown that error; otherwise the failure is reported as an unstructured one.
 * </p>
 */
@Getter
public class MemberDataException extends RuntimeException {
    /**
     * HTTP status of the admin API answer, 0 when no answer was received.
     */
    private final int status;
    private final ErrorApiData errorData;

    public MemberDataException(int status, ErrorApiData errorData, String message) {
        super(message);
        this.status = status;
        this.errorData = errorData;
    }

    public MemberDataException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.errorData = null;
    }

    public boolean isStructured() {
        return errorData != null;
    }
}
