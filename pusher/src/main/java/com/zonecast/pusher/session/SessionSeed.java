package com.zonecast.pusher.session;

import com.zonecast.core.model.AvailabilityStatus;
import com.zonecast.core.model.CharacterTexture;
import com.zonecast.core.model.CompanionTexture;
import com.zonecast.core.model.Position;
import com.zonecast.core.model.SpaceUser;
import com.zonecast.core.model.Viewport;
import com.zonecast.core.msg.ServerMessages;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything the gateway learned while accepting a connection. Opaque to the transport;
 * turned into a {@link Session} when the socket opens.
 */
@Value
@Builder(toBuilder = true)
public class SessionSeed {
    String token;
    String userUuid;
    String userIdentifier;
    String userJid;
    String ipAddress;
    String roomId;
    String name;
    @Singular
    List<String> tags;
    String visitCardUrl;
    String userRoomToken;
    @Singular
    List<CharacterTexture> characterTextures;
    CompanionTexture companionTexture;
    AvailabilityStatus availabilityStatus;
    String lastCommandId;
    Position position;
    Viewport viewport;
    boolean canEdit;
    boolean logged;
    String jabberId;
    String jabberPassword;
    /**
     * Messages the admin API asked to show the user right after joining.
     */
    @Singular
    List<ServerMessages.SendUserMessage> pendingMessages;
    /**
     * Initial presence record; its {@code id} is assigned when the session is created.
     */
    SpaceUser spaceUser;
}
