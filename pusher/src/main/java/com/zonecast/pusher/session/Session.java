package com.zonecast.pusher.session;

import com.zonecast.core.model.CharacterTexture;
import com.zonecast.core.model.CompanionTexture;
import com.zonecast.core.model.Position;
import com.zonecast.core.model.SpaceUser;
import com.zonecast.core.model.Viewport;
import com.zonecast.pusher.batch.OutboundChannel;
import com.zonecast.pusher.batch.PendingBatch;
import com.zonecast.pusher.zone.ZoneKey;
import lombok.Getter;
import lombok.Setter;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-connection state of a user inside a room.
 * <p>
 * Identity fields are fixed at creation. Position, viewport and the published {@link SpaceUser}
 * are written only by the connection's own inbound pipeline and read by other sessions'
 * notifications, hence volatile. {@link #getListenedZones()} is guarded by the monitor of the
 * room the session belongs to.
 * </p>
 */
@Getter
public class Session {
    private final SessionId id;
    private final String userUuid;
    private final String userIdentifier;
    private final String userJid;
    private final String ipAddress;
    private final String roomId;
    private final String name;
    private final List<String> tags;
    private final String userRoomToken;
    private final List<CharacterTexture> characterTextures;
    private final CompanionTexture companionTexture;
    private final boolean canEdit;
    private final boolean logged;
    private final String lastCommandId;
    private final String jabberId;
    private final String jabberPassword;

    private final OutboundChannel channel;
    private final PendingBatch batch = new PendingBatch();
    private final ConnectionStateMachine state;

    private final Set<ZoneKey> listenedZones = new HashSet<>();
    private final Set<String> joinedSpaces = ConcurrentHashMap.newKeySet();

    @Setter
    private volatile Position position;
    @Setter
    private volatile Viewport viewport;
    @Setter
    private volatile SpaceUser spaceUser;
    @Setter
    private volatile LivenessMonitor liveness;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean disconnecting = new AtomicBoolean(false);

    Session(SessionId id, SessionSeed seed, OutboundChannel channel, ConnectionStateMachine state) {
        this.state = state;
        this.id = id;
        this.userUuid = seed.getUserUuid();
        this.userIdentifier = seed.getUserIdentifier();
        this.userJid = seed.getUserJid();
        this.ipAddress = seed.getIpAddress();
        this.roomId = seed.getRoomId();
        this.name = seed.getName();
        this.tags = List.copyOf(seed.getTags());
        this.userRoomToken = seed.getUserRoomToken();
        this.characterTextures = List.copyOf(seed.getCharacterTextures());
        this.companionTexture = seed.getCompanionTexture();
        this.canEdit = seed.isCanEdit();
        this.logged = seed.isLogged();
        this.lastCommandId = seed.getLastCommandId();
        this.jabberId = seed.getJabberId();
        this.jabberPassword = seed.getJabberPassword();
        this.channel = channel;
        this.position = seed.getPosition();
        this.viewport = seed.getViewport();
        this.spaceUser = seed.getSpaceUser() == null ? null : seed.getSpaceUser().toBuilder().id(id.value()).build();
    }

    public long getUserId() {
        return id.value();
    }

    /**
     * Marks the session as leaving. Only the first caller gets {@code true}.
     */
    public boolean markDisconnecting() {
        return disconnecting.compareAndSet(false, true);
    }

    public boolean isDisconnecting() {
        return disconnecting.get();
    }

    @Override
    public String toString() {
        return id + "[" + userUuid + "@" + roomId + "]";
    }
}
