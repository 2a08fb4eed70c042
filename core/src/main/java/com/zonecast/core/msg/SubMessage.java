package com.zonecast.core.msg;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * An event carried inside a {@link ServerMessages.BatchMessage}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ServerMessages.UserJoinedZoneMessage.class, name = "userJoinedZone"),
    @JsonSubTypes.Type(value = ServerMessages.UserLeftZoneMessage.class, name = "userLeftZone"),
    @JsonSubTypes.Type(value = ServerMessages.UserMovedMessage.class, name = "userMoved"),
    @JsonSubTypes.Type(value = ServerMessages.AddSpaceUserMessage.class, name = "addSpaceUser"),
    @JsonSubTypes.Type(value = ServerMessages.UpdateSpaceUserMessage.class, name = "updateSpaceUser"),
    @JsonSubTypes.Type(value = ServerMessages.RemoveSpaceUserMessage.class, name = "removeSpaceUser"),
    @JsonSubTypes.Type(value = ServerMessages.PongMessage.class, name = "pong")
})
public interface SubMessage {
}
