package com.zonecast.pusher.space;

import com.zonecast.core.model.SpaceUser;
import com.zonecast.core.msg.ServerMessages;
import com.zonecast.pusher.batch.MessageBatcher;
import com.zonecast.pusher.session.Session;

import java.util.List;

/**
 * Delivers space events to watchers through the batcher.
 */
public class SpaceNotifier implements SpaceEventListener {
    private final MessageBatcher batcher;

    public SpaceNotifier(MessageBatcher batcher) {
        this.batcher = batcher;
    }

    @Override
    public void onAdd(Session watcher, String spaceName, String filterName, SpaceUser user) {
        batcher.enqueue(watcher, new ServerMessages.AddSpaceUserMessage(spaceName, filterName, user));
    }

    @Override
    public void onUpdate(Session watcher, String spaceName, String filterName, SpaceUser user,
                         List<String> updatedFields) {
        batcher.enqueue(watcher, new ServerMessages.UpdateSpaceUserMessage(spaceName, filterName, user, updatedFields));
    }

    @Override
    public void onRemove(Session watcher, String spaceName, String filterName, long userId) {
        batcher.enqueue(watcher, new ServerMessages.RemoveSpaceUserMessage(spaceName, filterName, userId));
    }
}
