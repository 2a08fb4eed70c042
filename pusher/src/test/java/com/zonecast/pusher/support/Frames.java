package com.zonecast.pusher.support;

import com.zonecast.core.msg.ServerMessage;
import com.zonecast.core.msg.ServerMessages;
import com.zonecast.core.msg.SubMessage;
import com.zonecast.core.util.JsonUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes frames captured by a {@link RecordingChannel}.
 */
public final class Frames {
    private Frames() {
    }

    public static List<ServerMessage> decode(RecordingChannel channel) {
        List<ServerMessage> messages = new ArrayList<>();
        for (String frame : channel.frames()) {
            messages.add(JsonUtils.readValue(frame, ServerMessage.class));
        }
        return messages;
    }

    /**
     * Payloads of the batch frames, one list per frame.
     */
    public static List<List<SubMessage>> batches(RecordingChannel channel) {
        List<List<SubMessage>> batches = new ArrayList<>();
        for (ServerMessage message : decode(channel)) {
            if (message instanceof ServerMessages.BatchMessage) {
                batches.add(((ServerMessages.BatchMessage) message).getPayload());
            }
        }
        return batches;
    }

    /**
     * Every sub-message delivered so far, flattened across frames.
     */
    public static List<SubMessage> subMessages(RecordingChannel channel) {
        List<SubMessage> all = new ArrayList<>();
        batches(channel).forEach(all::addAll);
        return all;
    }
}
