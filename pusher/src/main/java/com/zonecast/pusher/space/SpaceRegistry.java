package com.zonecast.pusher.space;

import com.zonecast.core.model.SpaceFilter;
import com.zonecast.core.model.SpaceUser;
import com.zonecast.core.model.SpaceUserUpdate;
import com.zonecast.pusher.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Node-wide registry of spaces.
 * <p>
 * A session joins a space by watching it: from then on its own {@link SpaceUser} is published
 * there and every filter it registers receives add, update and remove events for the other
 * users. Each filter is evaluated independently and a watcher never sees itself.
 * </p>
 * <p>
 * Spaces are created and destroyed inside {@link ConcurrentHashMap#compute}; everything else
 * runs under the space monitor, including listener calls.
 * </p>
 */
public class SpaceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SpaceRegistry.class);

    private final Map<String, Space> spaces = new ConcurrentHashMap<>();
    private final SpaceEventListener listener;

    public SpaceRegistry(SpaceEventListener listener) {
        this.listener = listener;
    }

    /**
     * Joins the space if needed, publishes the session's user there and registers the filter.
     *
     * @return users the filter lets through right now; each was also delivered as an add event
     */
    public List<SpaceUser> watch(Session session, String spaceName, String filterName, SpaceFilter filter) {
        Space space = spaces.compute(spaceName, (name, existing) -> {
            Space target = existing != null ? existing : new Space(name);
            target.addWatcher(session);
            return target;
        });
        session.getJoinedSpaces().add(spaceName);

        synchronized (space) {
            if (!space.usersById().containsKey(session.getId()) && session.getSpaceUser() != null) {
                publishLocked(space, session, session.getSpaceUser(), List.of());
            }
            return registerFilterLocked(space, space.watchers().get(session.getId()), filterName, filter);
        }
    }

    /**
     * Registers one more filter on a space the session already watches.
     *
     * @throws IllegalStateException when the session does not watch the space
     */
    public List<SpaceUser> addFilter(Session session, String spaceName, String filterName, SpaceFilter filter) {
        Space space = requireSpace(session, spaceName);
        synchronized (space) {
            return registerFilterLocked(space, requireWatcher(space, session), filterName, filter);
        }
    }

    /**
     * Replaces a filter. Users the new filter lets through and the old did not are added,
     * the reverse are removed; unknown filter names are registered from scratch.
     */
    public void updateFilter(Session session, String spaceName, String filterName, SpaceFilter filter) {
        Space space = requireSpace(session, spaceName);
        synchronized (space) {
            registerFilterLocked(space, requireWatcher(space, session), filterName, filter);
        }
    }

    /**
     * Drops one filter without emitting anything.
     */
    public void removeFilter(Session session, String spaceName, String filterName) {
        Space space = spaces.get(spaceName);
        if (space == null) {
            return;
        }
        synchronized (space) {
            Space.Watcher watcher = space.watchers().get(session.getId());
            if (watcher != null) {
                watcher.filters.remove(filterName);
            }
        }
    }

    /**
     * Leaves the space: the session's filters go away and its user is removed for the remaining watchers.
     */
    public void unwatch(Session session, String spaceName) {
        session.getJoinedSpaces().remove(spaceName);
        Space space = spaces.get(spaceName);
        if (space == null) {
            return;
        }
        synchronized (space) {
            space.watchers().remove(session.getId());
            unpublishLocked(space, session);
        }
        spaces.computeIfPresent(spaceName, (name, existing) -> {
            if (existing.isEmpty()) {
                log.debug("Space {} is empty, destroying it", name);
                return null;
            }
            return existing;
        });
    }

    /**
     * Replaces the session's user in every space it joined.
     */
    public void publish(Session session, SpaceUser user) {
        SpaceUser published = user.toBuilder().id(session.getUserId()).build();
        session.setSpaceUser(published);
        for (Space space : joinedSpaces(session)) {
            synchronized (space) {
                publishLocked(space, session, published, List.of());
            }
        }
    }

    /**
     * Applies a partial change to the session's user and re-evaluates every filter that can see it.
     * Only spaces the user is still published in are touched; an update that sets nothing is a no-op.
     */
    public void updatePublished(Session session, SpaceUserUpdate update) {
        if (update.isEmpty() || session.getSpaceUser() == null) {
            return;
        }
        SpaceUser updated = update.applyTo(session.getSpaceUser());
        session.setSpaceUser(updated);
        List<String> fields = update.updatedFields();
        for (Space space : joinedSpaces(session)) {
            synchronized (space) {
                if (space.usersById().containsKey(session.getId())) {
                    publishLocked(space, session, updated, fields);
                }
            }
        }
    }

    /**
     * Withdraws the session's user from every space it joined while keeping its filters.
     */
    public void unpublish(Session session) {
        for (Space space : joinedSpaces(session)) {
            synchronized (space) {
                unpublishLocked(space, session);
            }
        }
    }

    /**
     * Disconnect cleanup.
     */
    public void leaveAll(Session session) {
        for (String spaceName : List.copyOf(session.getJoinedSpaces())) {
            unwatch(session, spaceName);
        }
    }

    public Optional<Space> find(String spaceName) {
        return Optional.ofNullable(spaces.get(spaceName));
    }

    public int spaceCount() {
        return spaces.size();
    }

    private List<SpaceUser> registerFilterLocked(Space space, Space.Watcher watcher, String filterName,
                                                 SpaceFilter filter) {
        FilterRegistration registration = new FilterRegistration(filterName, filter);
        FilterRegistration replaced = watcher.filters.put(filterName, registration);
        List<SpaceUser> snapshot = new ArrayList<>();
        for (SpaceUser user : space.usersById().values()) {
            if (user.getId() != watcher.session.getUserId() && registration.matches(user)) {
                registration.getMatched().add(user.getId());
                snapshot.add(user);
                if (replaced == null || !replaced.getMatched().contains(user.getId())) {
                    listener.onAdd(watcher.session, space.getName(), filterName, user);
                }
            }
        }
        if (replaced != null) {
            for (Long userId : replaced.getMatched()) {
                if (!registration.getMatched().contains(userId)) {
                    listener.onRemove(watcher.session, space.getName(), filterName, userId);
                }
            }
        }
        return snapshot;
    }

    private void publishLocked(Space space, Session publisher, SpaceUser user, List<String> updatedFields) {
        space.usersById().put(publisher.getId(), user);
        for (Space.Watcher watcher : space.watchers().values()) {
            if (watcher.session == publisher) {
                continue;
            }
            for (FilterRegistration registration : watcher.filters.values()) {
                boolean was = registration.getMatched().contains(user.getId());
                boolean now = registration.matches(user);
                if (now && !was) {
                    registration.getMatched().add(user.getId());
                    listener.onAdd(watcher.session, space.getName(), registration.getName(), user);
                } else if (now) {
                    listener.onUpdate(watcher.session, space.getName(), registration.getName(), user, updatedFields);
                } else if (was) {
                    registration.getMatched().remove(user.getId());
                    listener.onRemove(watcher.session, space.getName(), registration.getName(), user.getId());
                }
            }
        }
    }

    private void unpublishLocked(Space space, Session publisher) {
        if (space.usersById().remove(publisher.getId()) == null) {
            return;
        }
        long userId = publisher.getUserId();
        for (Space.Watcher watcher : space.watchers().values()) {
            for (FilterRegistration registration : watcher.filters.values()) {
                if (registration.getMatched().remove(userId)) {
                    listener.onRemove(watcher.session, space.getName(), registration.getName(), userId);
                }
            }
        }
    }

    private List<Space> joinedSpaces(Session session) {
        List<Space> joined = new ArrayList<>();
        for (String spaceName : session.getJoinedSpaces()) {
            Space space = spaces.get(spaceName);
            if (space != null) {
                joined.add(space);
            }
        }
        return joined;
    }

    private Space requireSpace(Session session, String spaceName) {
        Space space = spaces.get(spaceName);
        if (space == null || !session.getJoinedSpaces().contains(spaceName)) {
            throw new IllegalStateException(session + " does not watch space " + spaceName);
        }
        return space;
    }

    private static Space.Watcher requireWatcher(Space space, Session session) {
        Space.Watcher watcher = space.watchers().get(session.getId());
        if (watcher == null) {
            throw new IllegalStateException(session + " does not watch space " + space.getName());
        }
        return watcher;
    }
}
