package com.zonecast.pusher.zone;

import com.zonecast.core.msg.ServerMessages;
import com.zonecast.pusher.batch.MessageBatcher;
import com.zonecast.pusher.session.Session;

import java.util.Collection;

/**
 * Turns zone membership changes into batched sub-messages for the sessions involved.
 */
public class ZoneNotifier implements ZoneEventListener {
    private final MessageBatcher batcher;

    public ZoneNotifier(MessageBatcher batcher) {
        this.batcher = batcher;
    }

    @Override
    public void onEnter(ZoneKey zone, Session entering, Collection<Session> occupants) {
        for (Session occupant : occupants) {
            batcher.enqueue(occupant, joined(entering, zone));
            batcher.enqueue(entering, joined(occupant, zone));
        }
    }

    @Override
    public void onLeave(ZoneKey zone, Session leaving, Collection<Session> occupants) {
        for (Session occupant : occupants) {
            batcher.enqueue(occupant, new ServerMessages.UserLeftZoneMessage(leaving.getUserId(), zone.x(), zone.y()));
            batcher.enqueue(leaving, new ServerMessages.UserLeftZoneMessage(occupant.getUserId(), zone.x(), zone.y()));
        }
    }

    @Override
    public void onMove(Session mover, Collection<Session> observers) {
        for (Session observer : observers) {
            batcher.enqueue(observer, new ServerMessages.UserMovedMessage(mover.getUserId(), mover.getPosition()));
        }
    }

    private static ServerMessages.UserJoinedZoneMessage joined(Session session, ZoneKey zone) {
        return ServerMessages.UserJoinedZoneMessage.builder()
            .userId(session.getUserId())
            .userUuid(session.getUserUuid())
            .name(session.getName())
            .position(session.getPosition())
            .characterTextures(session.getCharacterTextures())
            .companionTexture(session.getCompanionTexture())
            .availabilityStatus(session.getSpaceUser() == null ? null : session.getSpaceUser().getAvailabilityStatus())
            .tags(session.getTags())
            .visitCardUrl(session.getSpaceUser() == null ? null : session.getSpaceUser().getVisitCardUrl())
            .zoneX(zone.x())
            .zoneY(zone.y())
            .build();
    }
}
