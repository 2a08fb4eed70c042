package com.zonecast.core.msg;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A message sent by a game client over the room socket.
 * <p>
 * Frames are JSON objects whose {@code type} property names the variant,
 * e.g. {@code {"type":"viewportMessage","top":0,"right":640,"bottom":480,"left":0}}.
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ClientMessages.ViewportMessage.class, name = "viewportMessage"),
    @JsonSubTypes.Type(value = ClientMessages.UserMovesMessage.class, name = "userMovesMessage"),
    @JsonSubTypes.Type(value = ClientMessages.ReportPlayerMessage.class, name = "reportPlayerMessage"),
    @JsonSubTypes.Type(value = ClientMessages.AddSpaceFilterMessage.class, name = "addSpaceFilterMessage"),
    @JsonSubTypes.Type(value = ClientMessages.UpdateSpaceFilterMessage.class, name = "updateSpaceFilterMessage"),
    @JsonSubTypes.Type(value = ClientMessages.RemoveSpaceFilterMessage.class, name = "removeSpaceFilterMessage"),
    @JsonSubTypes.Type(value = ClientMessages.SetPlayerDetailsMessage.class, name = "setPlayerDetailsMessage"),
    @JsonSubTypes.Type(value = ClientMessages.WatchSpaceMessage.class, name = "watchSpaceMessage"),
    @JsonSubTypes.Type(value = ClientMessages.UnwatchSpaceMessage.class, name = "unwatchSpaceMessage"),
    @JsonSubTypes.Type(value = ClientMessages.CameraStateMessage.class, name = "cameraStateMessage"),
    @JsonSubTypes.Type(value = ClientMessages.MicrophoneStateMessage.class, name = "microphoneStateMessage"),
    @JsonSubTypes.Type(value = ClientMessages.ScreenSharingStateMessage.class, name = "screenSharingStateMessage"),
    @JsonSubTypes.Type(value = ClientMessages.MegaphoneStateMessage.class, name = "megaphoneStateMessage"),
    @JsonSubTypes.Type(value = ClientMessages.PingMessage.class, name = "pingMessage")
})
public interface ClientMessage {

    MessageKind kind();
}
