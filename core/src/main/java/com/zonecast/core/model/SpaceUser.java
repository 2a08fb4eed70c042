package com.zonecast.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

/**
 * The presence record a session publishes into the spaces it joined.
 * <p>
 * Registries never mutate a stored instance: updates produce a new copy through
 * {@link #toBuilder()} or {@link SpaceUserUpdate#applyTo(SpaceUser)}.
 * </p>
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SpaceUser {
    /**
     * Connection-scoped id of the publishing session.
     */
    long id;
    String uuid;
    String name;
    /**
     * Room URL the user is currently in.
     */
    String playUri;
    String roomName;
    AvailabilityStatus availabilityStatus;
    boolean logged;
    String color;
    List<String> tags;
    boolean cameraState;
    boolean microphoneState;
    boolean screenSharing;
    boolean megaphoneState;
    List<CharacterTexture> characterTextures;
    String visitCardUrl;
}
