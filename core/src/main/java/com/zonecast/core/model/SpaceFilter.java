package com.zonecast.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Value;

import java.util.Locale;

/**
 * Predicate attached to a space watch registration. Decides which published
 * {@link SpaceUser}s the watcher is told about.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SpaceFilter.Everybody.class, name = "everybody"),
    @JsonSubTypes.Type(value = SpaceFilter.InRoom.class, name = "inRoom"),
    @JsonSubTypes.Type(value = SpaceFilter.HasTag.class, name = "hasTag"),
    @JsonSubTypes.Type(value = SpaceFilter.NameContains.class, name = "nameContains"),
    @JsonSubTypes.Type(value = SpaceFilter.LiveStreaming.class, name = "liveStreaming")
})
public interface SpaceFilter {

    boolean matches(SpaceUser user);

    @Value
    class Everybody implements SpaceFilter {
        @Override
        public boolean matches(SpaceUser user) {
            return true;
        }
    }

    /**
     * Users currently in the given room.
     */
    @Value
    class InRoom implements SpaceFilter {
        String playUri;

        @JsonCreator
        public InRoom(@JsonProperty("playUri") String playUri) {
            this.playUri = playUri;
        }

        @Override
        public boolean matches(SpaceUser user) {
            return playUri != null && playUri.equals(user.getPlayUri());
        }
    }

    @Value
    class HasTag implements SpaceFilter {
        String tag;

        @JsonCreator
        public HasTag(@JsonProperty("tag") String tag) {
            this.tag = tag;
        }

        @Override
        public boolean matches(SpaceUser user) {
            return user.getTags() != null && user.getTags().contains(tag);
        }
    }

    /**
     * Case-insensitive substring match on the display name.
     */
    @Value
    class NameContains implements SpaceFilter {
        String value;

        @JsonCreator
        public NameContains(@JsonProperty("value") String value) {
            this.value = value;
        }

        @Override
        public boolean matches(SpaceUser user) {
            if (value == null || user.getName() == null) {
                return false;
            }
            return user.getName().toLowerCase(Locale.ROOT).contains(value.toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Users currently sending audio or video, or speaking through the megaphone.
     */
    @Value
    class LiveStreaming implements SpaceFilter {
        @Override
        public boolean matches(SpaceUser user) {
            return user.isCameraState() || user.isMicrophoneState()
                || user.isScreenSharing() || user.isMegaphoneState();
        }
    }
}
