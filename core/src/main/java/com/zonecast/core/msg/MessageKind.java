package com.zonecast.core.msg;

/**
 * Kinds of inbound room-socket messages. Each kind maps to exactly one handler in the
 * pusher's dispatch table.
 */
public enum MessageKind {
    VIEWPORT,
    USER_MOVES,
    REPORT_PLAYER,
    ADD_SPACE_FILTER,
    UPDATE_SPACE_FILTER,
    REMOVE_SPACE_FILTER,
    SET_PLAYER_DETAILS,
    WATCH_SPACE,
    UNWATCH_SPACE,
    CAMERA_STATE,
    MICROPHONE_STATE,
    SCREEN_SHARING_STATE,
    MEGAPHONE_STATE,
    PING
}
