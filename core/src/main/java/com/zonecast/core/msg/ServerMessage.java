package com.zonecast.core.msg;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A top-level frame sent by the pusher over the room socket.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ServerMessages.BatchMessage.class, name = "batchMessage"),
    @JsonSubTypes.Type(value = ServerMessages.RoomJoinedMessage.class, name = "roomJoinedMessage"),
    @JsonSubTypes.Type(value = ServerMessages.ErrorScreenMessage.class, name = "errorScreenMessage"),
    @JsonSubTypes.Type(value = ServerMessages.TokenExpiredMessage.class, name = "tokenExpiredMessage"),
    @JsonSubTypes.Type(value = ServerMessages.InvalidTextureMessage.class, name = "invalidTextureMessage"),
    @JsonSubTypes.Type(value = ServerMessages.ConnectionErrorMessage.class, name = "connectionErrorMessage"),
    @JsonSubTypes.Type(value = ServerMessages.SendUserMessage.class, name = "sendUserMessage"),
    @JsonSubTypes.Type(value = ServerMessages.BanUserMessage.class, name = "banUserMessage")
})
public interface ServerMessage {
}
