package com.zonecast.pusher.space;

import com.zonecast.core.model.SpaceUser;
import com.zonecast.pusher.session.Session;

import java.util.List;

/**
 * Per-filter visibility changes of space users, addressed to one watcher.
 * Called while the space is locked.
 */
public interface SpaceEventListener {
    void onAdd(Session watcher, String spaceName, String filterName, SpaceUser user);

    /**
     * @param updatedFields names of the changed fields, empty when the whole record was replaced
     */
    void onUpdate(Session watcher, String spaceName, String filterName, SpaceUser user, List<String> updatedFields);

    void onRemove(Session watcher, String spaceName, String filterName, long userId);
}
