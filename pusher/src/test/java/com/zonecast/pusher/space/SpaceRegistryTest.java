package com.zonecast.pusher.space;

import com.zonecast.core.model.SpaceFilter;
import com.zonecast.core.model.SpaceUser;
import com.zonecast.core.model.SpaceUserUpdate;
import com.zonecast.pusher.session.Session;
import com.zonecast.pusher.session.SessionFactory;
import com.zonecast.pusher.support.TestSessions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpaceRegistryTest {

    private static final String LOBBY = "lobby";

    private RecordingSpaceListener events;
    private SpaceRegistry spaces;
    private SessionFactory factory;

    private Session vipWatcher;
    private Session staffWatcher;
    private Session alice;

    @BeforeEach
    void setUp() {
        events = new RecordingSpaceListener();
        spaces = new SpaceRegistry(events);
        factory = new SessionFactory();

        vipWatcher = TestSessions.session(factory, "vipWatcher", null);
        staffWatcher = TestSessions.session(factory, "staffWatcher", null);
        alice = TestSessions.session(factory, "alice", null, List.of("vip"));
    }

    @Test
    @DisplayName("A user tagged vip reaches the vip filter and not the staff filter")
    void publishReachesOnlyMatchingFilters() {
        spaces.watch(vipWatcher, LOBBY, "vips", new SpaceFilter.HasTag("vip"));
        spaces.watch(staffWatcher, LOBBY, "staff", new SpaceFilter.HasTag("staff"));
        events.clear();

        spaces.watch(alice, LOBBY, "all", new SpaceFilter.Everybody());

        assertEquals(List.of("add lobby/vips alice"), events.of(vipWatcher));
        assertTrue(events.of(staffWatcher).isEmpty());
    }

    @Test
    @DisplayName("A user that stops matching yields exactly one remove")
    void stoppingToMatchYieldsOneRemove() {
        spaces.watch(vipWatcher, LOBBY, "vips", new SpaceFilter.HasTag("vip"));
        spaces.watch(alice, LOBBY, "all", new SpaceFilter.Everybody());
        events.clear();

        spaces.updatePublished(alice, SpaceUserUpdate.builder().tags(List.of("staff")).build());

        assertEquals(List.of("remove lobby/vips " + alice.getUserId()), events.of(vipWatcher));
    }

    @Test
    void matchingUpdateCarriesChangedFields() {
        spaces.watch(vipWatcher, LOBBY, "vips", new SpaceFilter.HasTag("vip"));
        spaces.watch(alice, LOBBY, "all", new SpaceFilter.Everybody());
        events.clear();

        spaces.updatePublished(alice, SpaceUserUpdate.builder().cameraState(true).build());

        assertEquals(List.of("update lobby/vips alice [cameraState]"), events.of(vipWatcher));
        assertTrue(alice.getSpaceUser().isCameraState());
    }

    @Test
    void fullPublishIsAnUpdateWithoutFieldNames() {
        spaces.watch(vipWatcher, LOBBY, "vips", new SpaceFilter.HasTag("vip"));
        spaces.watch(alice, LOBBY, "all", new SpaceFilter.Everybody());
        events.clear();

        SpaceUser renamed = alice.getSpaceUser().toBuilder().name("Alice L.").build();
        spaces.publish(alice, renamed);

        assertEquals(List.of("update lobby/vips Alice L. []"), events.of(vipWatcher));
        assertEquals(alice.getUserId(), alice.getSpaceUser().getId());
    }

    @Test
    void watchReturnsCurrentMatchesAsSnapshot() {
        spaces.watch(alice, LOBBY, "all", new SpaceFilter.Everybody());

        List<SpaceUser> snapshot = spaces.watch(vipWatcher, LOBBY, "vips", new SpaceFilter.HasTag("vip"));

        assertEquals(1, snapshot.size());
        assertEquals("alice", snapshot.get(0).getName());
        assertEquals(List.of("add lobby/vips alice"), events.of(vipWatcher));
    }

    @Test
    @DisplayName("A watcher never receives its own user")
    void watcherNeverSeesItself() {
        spaces.watch(alice, LOBBY, "all", new SpaceFilter.Everybody());
        spaces.updatePublished(alice, SpaceUserUpdate.builder().microphoneState(true).build());

        assertTrue(events.of(alice).isEmpty());
    }

    @Test
    void updateFilterDiffsOldAndNewMatches() {
        spaces.watch(alice, LOBBY, "all", new SpaceFilter.Everybody());
        spaces.watch(vipWatcher, LOBBY, "f", new SpaceFilter.HasTag("vip"));
        events.clear();

        spaces.updateFilter(vipWatcher, LOBBY, "f", new SpaceFilter.HasTag("staff"));
        spaces.updateFilter(vipWatcher, LOBBY, "f", new SpaceFilter.NameContains("ALI"));
        spaces.updateFilter(vipWatcher, LOBBY, "f", new SpaceFilter.HasTag("vip"));

        assertEquals(List.of(
            "remove lobby/f " + alice.getUserId(),
            "add lobby/f alice"
        ), events.of(vipWatcher));
    }

    @Test
    void filtersAreEvaluatedIndependently() {
        spaces.watch(alice, LOBBY, "all", new SpaceFilter.Everybody());
        spaces.watch(vipWatcher, LOBBY, "vips", new SpaceFilter.HasTag("vip"));
        spaces.addFilter(vipWatcher, LOBBY, "everyone", new SpaceFilter.Everybody());

        assertEquals(List.of("add lobby/vips alice", "add lobby/everyone alice"), events.of(vipWatcher));
        assertEquals(List.of("vips", "everyone"), spaces.find(LOBBY).orElseThrow().filterNames(vipWatcher));
    }

    @Test
    void removeFilterIsSilent() {
        spaces.watch(alice, LOBBY, "all", new SpaceFilter.Everybody());
        spaces.watch(vipWatcher, LOBBY, "vips", new SpaceFilter.HasTag("vip"));
        events.clear();

        spaces.removeFilter(vipWatcher, LOBBY, "vips");
        spaces.updatePublished(alice, SpaceUserUpdate.builder().tags(List.of()).build());

        assertTrue(events.of(vipWatcher).isEmpty());
    }

    @Test
    void addFilterRequiresAWatch() {
        spaces.watch(alice, LOBBY, "all", new SpaceFilter.Everybody());

        assertThrows(IllegalStateException.class,
            () -> spaces.addFilter(vipWatcher, LOBBY, "vips", new SpaceFilter.HasTag("vip")));
        assertThrows(IllegalStateException.class,
            () -> spaces.updateFilter(vipWatcher, "nowhere", "vips", new SpaceFilter.HasTag("vip")));
    }

    @Test
    void unpublishRemovesTheUserButKeepsFilters() {
        spaces.watch(alice, LOBBY, "all", new SpaceFilter.Everybody());
        spaces.watch(vipWatcher, LOBBY, "vips", new SpaceFilter.HasTag("vip"));
        events.clear();

        spaces.unpublish(alice);

        assertEquals(List.of("remove lobby/vips " + alice.getUserId()), events.of(vipWatcher));
        assertEquals(List.of("all"), spaces.find(LOBBY).orElseThrow().filterNames(alice));
    }

    @Test
    @DisplayName("A presence change after unpublish does not bring the user back")
    void presenceChangeAfterUnpublishStaysHidden() {
        spaces.watch(vipWatcher, LOBBY, "all", new SpaceFilter.Everybody());
        spaces.watch(alice, LOBBY, "all", new SpaceFilter.Everybody());
        spaces.unpublish(alice);
        events.clear();

        spaces.updatePublished(alice, SpaceUserUpdate.builder().cameraState(true).build());

        assertTrue(events.of(vipWatcher).isEmpty());
        assertEquals(1, spaces.find(LOBBY).orElseThrow().users().size());
        assertTrue(alice.getSpaceUser().isCameraState());
    }

    @Test
    void updateSettingNothingEmitsNothing() {
        spaces.watch(vipWatcher, LOBBY, "vips", new SpaceFilter.HasTag("vip"));
        spaces.watch(alice, LOBBY, "all", new SpaceFilter.Everybody());
        events.clear();

        spaces.updatePublished(alice, SpaceUserUpdate.builder().build());

        assertTrue(events.of(vipWatcher).isEmpty());
    }

    @Test
    @DisplayName("Disconnect cleanup removes the user everywhere and destroys empty spaces")
    void leaveAllCleansUp() {
        spaces.watch(alice, LOBBY, "all", new SpaceFilter.Everybody());
        spaces.watch(alice, "garden", "all", new SpaceFilter.Everybody());
        spaces.watch(vipWatcher, LOBBY, "vips", new SpaceFilter.HasTag("vip"));
        events.clear();

        spaces.leaveAll(alice);

        assertEquals(List.of("remove lobby/vips " + alice.getUserId()), events.of(vipWatcher));
        assertTrue(alice.getJoinedSpaces().isEmpty());
        assertFalse(spaces.find("garden").isPresent());
        assertEquals(1, spaces.spaceCount());

        spaces.leaveAll(vipWatcher);
        assertEquals(0, spaces.spaceCount());
    }

    private static final class RecordingSpaceListener implements SpaceEventListener {
        private final List<Event> events = new ArrayList<>();

        @Override
        public void onAdd(Session watcher, String spaceName, String filterName, SpaceUser user) {
            events.add(new Event(watcher, "add " + spaceName + "/" + filterName + " " + user.getName()));
        }

        @Override
        public void onUpdate(Session watcher, String spaceName, String filterName, SpaceUser user,
                             List<String> updatedFields) {
            events.add(new Event(watcher,
                "update " + spaceName + "/" + filterName + " " + user.getName() + " " + updatedFields));
        }

        @Override
        public void onRemove(Session watcher, String spaceName, String filterName, long userId) {
            events.add(new Event(watcher, "remove " + spaceName + "/" + filterName + " " + userId));
        }

        List<String> of(Session watcher) {
            List<String> result = new ArrayList<>();
            for (Event event : events) {
                if (event.watcher == watcher) {
                    result.add(event.text);
                }
            }
            return result;
        }

        void clear() {
            events.clear();
        }

        private static final class Event {
            final Session watcher;
            final String text;

            Event(Session watcher, String text) {
                this.watcher = watcher;
                this.text = text;
            }
        }
    }
}
