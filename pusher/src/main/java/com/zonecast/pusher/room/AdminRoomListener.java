package com.zonecast.pusher.room;

import com.zonecast.pusher.session.Session;

/**
 * An admin connection listening to member changes of a room.
 */
public interface AdminRoomListener {
    void onMemberJoin(Session session);

    void onMemberLeave(Session session);
}
