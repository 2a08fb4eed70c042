package com.zonecast.core.msg;

import com.zonecast.core.model.AvailabilityStatus;
import com.zonecast.core.model.Position;
import com.zonecast.core.model.SpaceFilter;
import com.zonecast.core.model.Viewport;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client → pusher messages.
 */
public final class ClientMessages {
    private ClientMessages() {
    }

    /**
     * The client scrolled or resized its view.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ViewportMessage implements ClientMessage {
        int top;
        int right;
        int bottom;
        int left;

        public Viewport toViewport() {
            return new Viewport(top, right, bottom, left);
        }

        @Override
        public MessageKind kind() {
            return MessageKind.VIEWPORT;
        }
    }

    /**
     * The player moved. The viewport travels with the position because the camera follows the player.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserMovesMessage implements ClientMessage {
        Position position;
        Viewport viewport;

        @Override
        public MessageKind kind() {
            return MessageKind.USER_MOVES;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReportPlayerMessage implements ClientMessage {
        String reportedUserUuid;
        String reportComment;

        @Override
        public MessageKind kind() {
            return MessageKind.REPORT_PLAYER;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AddSpaceFilterMessage implements ClientMessage {
        String spaceName;
        String filterName;
        SpaceFilter filter;

        @Override
        public MessageKind kind() {
            return MessageKind.ADD_SPACE_FILTER;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UpdateSpaceFilterMessage implements ClientMessage {
        String spaceName;
        String filterName;
        SpaceFilter filter;

        @Override
        public MessageKind kind() {
            return MessageKind.UPDATE_SPACE_FILTER;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RemoveSpaceFilterMessage implements ClientMessage {
        String spaceName;
        String filterName;

        @Override
        public MessageKind kind() {
            return MessageKind.REMOVE_SPACE_FILTER;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SetPlayerDetailsMessage implements ClientMessage {
        AvailabilityStatus availabilityStatus;
        String visitCardUrl;

        @Override
        public MessageKind kind() {
            return MessageKind.SET_PLAYER_DETAILS;
        }
    }

    /**
     * Joins a space and registers a first filter on it.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WatchSpaceMessage implements ClientMessage {
        String spaceName;
        String filterName;
        SpaceFilter filter;

        @Override
        public MessageKind kind() {
            return MessageKind.WATCH_SPACE;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UnwatchSpaceMessage implements ClientMessage {
        String spaceName;

        @Override
        public MessageKind kind() {
            return MessageKind.UNWATCH_SPACE;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CameraStateMessage implements ClientMessage {
        boolean value;

        @Override
        public MessageKind kind() {
            return MessageKind.CAMERA_STATE;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MicrophoneStateMessage implements ClientMessage {
        boolean value;

        @Override
        public MessageKind kind() {
            return MessageKind.MICROPHONE_STATE;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScreenSharingStateMessage implements ClientMessage {
        boolean value;

        @Override
        public MessageKind kind() {
            return MessageKind.SCREEN_SHARING_STATE;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MegaphoneStateMessage implements ClientMessage {
        boolean value;

        @Override
        public MessageKind kind() {
            return MessageKind.MEGAPHONE_STATE;
        }
    }

    /**
     * Application-level keepalive. Answered with a pong sub-message.
     */
    @Data
    @NoArgsConstructor
    public static class PingMessage implements ClientMessage {
        @Override
        public MessageKind kind() {
            return MessageKind.PING;
        }
    }
}
