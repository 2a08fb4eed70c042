package com.zonecast.pusher.admin;

import com.zonecast.core.msg.AdminMessages;

/**
 * Write side of an admin socket.
 */
public interface AdminConnection {
    void send(AdminMessages.AdminEvent event);

    void close(int code, String reason);
}
