package com.zonecast.core.msg;

import com.zonecast.core.model.AvailabilityStatus;
import com.zonecast.core.model.CharacterTexture;
import com.zonecast.core.model.CompanionTexture;
import com.zonecast.core.model.ErrorApiData;
import com.zonecast.core.model.Position;
import com.zonecast.core.model.SpaceUser;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Pusher → client messages.
 */
public final class ServerMessages {
    private ServerMessages() {
    }

    /**
     * Envelope of one flush: the sub-messages accumulated for a session during a coalescing window.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BatchMessage implements ServerMessage {
        String event;
        List<SubMessage> payload;
    }

    /**
     * First frame after a successful join.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RoomJoinedMessage implements ServerMessage {
        long userId;
        String userUuid;
        String roomId;
        List<String> tags;
        boolean canEdit;
        String userRoomToken;
        String jabberId;
        String jabberPassword;
        List<CharacterTexture> characterTextures;
        CompanionTexture companionTexture;
        String lastCommandId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorScreenMessage implements ServerMessage {
        ErrorApiData error;
    }

    @Data
    @NoArgsConstructor
    public static class TokenExpiredMessage implements ServerMessage {
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InvalidTextureMessage implements ServerMessage {
        /**
         * "character" or "companion".
         */
        String entityType;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConnectionErrorMessage implements ServerMessage {
        String message;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SendUserMessage implements ServerMessage {
        /**
         * "message" or "ban"; kept apart from the frame's own {@code type}.
         */
        String messageType;
        String message;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BanUserMessage implements ServerMessage {
        String messageType;
        String message;
    }

    /**
     * A user became visible in one of the zones the receiver listens to.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserJoinedZoneMessage implements SubMessage {
        long userId;
        String userUuid;
        String name;
        Position position;
        List<CharacterTexture> characterTextures;
        CompanionTexture companionTexture;
        AvailabilityStatus availabilityStatus;
        List<String> tags;
        String visitCardUrl;
        int zoneX;
        int zoneY;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserLeftZoneMessage implements SubMessage {
        long userId;
        int zoneX;
        int zoneY;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserMovedMessage implements SubMessage {
        long userId;
        Position position;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AddSpaceUserMessage implements SubMessage {
        String spaceName;
        String filterName;
        SpaceUser user;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UpdateSpaceUserMessage implements SubMessage {
        String spaceName;
        String filterName;
        SpaceUser user;
        List<String> updatedFields;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RemoveSpaceUserMessage implements SubMessage {
        String spaceName;
        String filterName;
        long userId;
    }

    @Data
    @NoArgsConstructor
    public static class PongMessage implements SubMessage {
    }
}
