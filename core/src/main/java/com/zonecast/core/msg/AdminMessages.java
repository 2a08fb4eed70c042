package com.zonecast.core.msg;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * JSON frames exchanged on the admin rooms socket.
 */
public final class AdminMessages {
    private AdminMessages() {
    }

    public static final String EVENT_LISTEN = "listen";
    public static final String EVENT_USER_MESSAGE = "user-message";

    public static final String TYPE_BAN = "ban";
    public static final String TYPE_BANNED = "banned";

    /**
     * Admin → pusher request. Every request carries the admin token that authorizes it.
     */
    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "event")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = ListenRequest.class, name = EVENT_LISTEN),
        @JsonSubTypes.Type(value = UserMessageRequest.class, name = EVENT_USER_MESSAGE)
    })
    public interface AdminRequest {
        String getJwt();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ListenRequest implements AdminRequest {
        String jwt;
        List<String> roomIds;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserMessageRequest implements AdminRequest {
        String jwt;
        String world;
        UserMessage message;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserMessage {
        /**
         * {@link #TYPE_BAN} or {@link #TYPE_BANNED}.
         */
        String type;
        String userUuid;
        String message;
    }

    /**
     * Pusher → admin event ({@code MemberJoin}, {@code MemberLeave} or {@code Error}).
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AdminEvent {
        String type;
        Map<String, Object> data;

        public static AdminEvent error(String message) {
            return new AdminEvent("Error", Map.of("message", message));
        }
    }
}
