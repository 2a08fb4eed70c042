package com.zonecast.pusher.gateway;

import com.zonecast.core.model.ErrorApiData;
import com.zonecast.core.msg.ServerMessage;
import com.zonecast.core.msg.ServerMessages;
import com.zonecast.pusher.session.SessionSeed;
import lombok.Value;

import java.util.Locale;

/**
 * Outcome of {@link ConnectionGateway#upgrade}.
 */
public interface UpgradeResult {

    boolean isAccepted();

    @Value
    class Accepted implements UpgradeResult {
        SessionSeed seed;

        @Override
        public boolean isAccepted() {
            return true;
        }
    }

    /**
     * A refused connection. The socket is still upgraded to deliver {@link #toClientMessage()},
     * then closed with {@link #closeCode()}.
     */
    @Value
    class Rejected implements UpgradeResult {
        public static final String CHARACTER = "character";
        public static final String COMPANION = "companion";

        RejectionReason reason;
        int status;
        String message;
        ErrorApiData error;
        /**
         * {@link #CHARACTER} or {@link #COMPANION} for texture rejections.
         */
        String entityType;

        public static Rejected tokenInvalid(String message) {
            return new Rejected(RejectionReason.TOKEN_INVALID, 401, message, null, null);
        }

        public static Rejected error(int status, ErrorApiData error) {
            return new Rejected(RejectionReason.ERROR, status, error.getTitle(), error, null);
        }

        public static Rejected invalidTexture(String entityType) {
            return new Rejected(RejectionReason.INVALID_TEXTURE, 422, "Invalid " + entityType + " texture", null,
                entityType);
        }

        public static Rejected generic(int status, String message) {
            return new Rejected(null, status, message, null, null);
        }

        @Override
        public boolean isAccepted() {
            return false;
        }

        public int closeCode() {
            if (reason == RejectionReason.TOKEN_INVALID) {
                return 4401;
            }
            if (reason == RejectionReason.INVALID_TEXTURE) {
                return 4422;
            }
            return 4000 + status;
        }

        public ServerMessage toClientMessage() {
            if (reason == null) {
                return new ServerMessages.ConnectionErrorMessage(message);
            }
            return switch (reason) {
                case TOKEN_INVALID -> new ServerMessages.TokenExpiredMessage();
                case ERROR -> new ServerMessages.ErrorScreenMessage(error);
                case INVALID_TEXTURE -> new ServerMessages.InvalidTextureMessage(entityType);
            };
        }

        public String metricTag() {
            return reason == null ? "unknown" : reason.name().toLowerCase(Locale.ROOT);
        }
    }
}
