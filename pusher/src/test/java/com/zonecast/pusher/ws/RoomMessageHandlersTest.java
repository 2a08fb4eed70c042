package com.zonecast.pusher.ws;

import com.zonecast.core.metrics.MetricsNames;
import com.zonecast.core.metrics.MetricsTags;
import com.zonecast.core.model.AvailabilityStatus;
import com.zonecast.core.model.Position;
import com.zonecast.core.model.SpaceFilter;
import com.zonecast.core.model.Viewport;
import com.zonecast.core.msg.ClientMessage;
import com.zonecast.core.msg.ClientMessages;
import com.zonecast.core.msg.MessageKind;
import com.zonecast.core.msg.ServerMessages;
import com.zonecast.core.msg.SubMessage;
import com.zonecast.core.util.JsonUtils;
import com.zonecast.pusher.batch.MessageBatcher;
import com.zonecast.pusher.config.PusherConfig;
import com.zonecast.pusher.external.MemberData;
import com.zonecast.pusher.external.MemberDataProvider;
import com.zonecast.pusher.external.MemberDataQuery;
import com.zonecast.pusher.metrics.MetricsService;
import com.zonecast.pusher.room.RoomRegistry;
import com.zonecast.pusher.session.LivenessMonitor;
import com.zonecast.pusher.session.Session;
import com.zonecast.pusher.session.SessionFactory;
import com.zonecast.pusher.space.SpaceNotifier;
import com.zonecast.pusher.space.SpaceRegistry;
import com.zonecast.pusher.support.Frames;
import com.zonecast.pusher.support.RecordingTelemetry;
import com.zonecast.pusher.support.TestSessions;
import com.zonecast.pusher.zone.ZoneGrid;
import com.zonecast.pusher.zone.ZoneKey;
import com.zonecast.pusher.zone.ZoneNotifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoomMessageHandlersTest {

    private PusherConfig config;
    private VirtualTimeScheduler scheduler;
    private SimpleMeterRegistry registry;
    private RoomRegistry rooms;
    private SpaceRegistry spaces;
    private RecordingProvider provider;
    private RecordingTelemetry telemetry;
    private MessageDispatcher dispatcher;
    private SessionFactory factory;

    @BeforeEach
    void setUp() {
        config = TestSessions.config();
        scheduler = VirtualTimeScheduler.create();
        registry = new SimpleMeterRegistry();
        MetricsService metrics = new MetricsService(registry, config);
        MessageBatcher batcher = new MessageBatcher(config, scheduler, metrics);
        rooms = new RoomRegistry(new ZoneGrid(config.getZoneWidth(), config.getZoneHeight()), new ZoneNotifier(batcher));
        spaces = new SpaceRegistry(new SpaceNotifier(batcher));
        provider = new RecordingProvider();
        telemetry = new RecordingTelemetry();
        dispatcher = new RoomMessageHandlers(rooms, spaces, batcher, provider, telemetry, metrics).dispatcher();
        factory = new SessionFactory();
    }

    private Session joined(String name, Viewport viewport) {
        Session session = TestSessions.session(factory, name, viewport);
        rooms.join(session);
        return session;
    }

    private void dispatch(Session session, ClientMessage message) {
        StepVerifier.create(dispatcher.dispatch(session, message)).verifyComplete();
    }

    private void dispatchJson(Session session, String json) {
        dispatch(session, JsonUtils.readValue(json, ClientMessage.class));
    }

    @Test
    void everyMessageKindHasAHandler() {
        assertEquals(EnumSet.allOf(MessageKind.class), dispatcher.kinds());
    }

    @Test
    void duplicateHandlersAreRejected() {
        MessageDispatcher.Builder builder = MessageDispatcher.builder(new MetricsService(registry, config))
            .on(MessageKind.PING, ClientMessages.PingMessage.class, (session, message) -> Mono.empty());

        assertThrows(IllegalStateException.class,
            () -> builder.on(MessageKind.PING, ClientMessages.PingMessage.class, (session, message) -> Mono.empty()));
    }

    @Test
    void viewportMessageMovesTheSessionBetweenZones() {
        Session alice = joined("alice", new Viewport(0, 100, 100, 0));

        dispatchJson(alice, "{\"type\":\"viewportMessage\",\"top\":400,\"right\":100,\"bottom\":500,\"left\":0}");

        assertEquals(Set.of(new ZoneKey(TestSessions.ROOM, 0, 1)), alice.getListenedZones());
        assertEquals(1.0, registry.get(MetricsNames.INBOUND_MESSAGES_TOTAL).tag(MetricsTags.TYPE, "viewport").counter().count());
    }

    @Test
    void userMovesReachesObserversInTheNextBatch() {
        Session alice = joined("alice", new Viewport(0, 100, 100, 0));
        Session bob = joined("bob", new Viewport(0, 100, 100, 0));
        scheduler.advanceTimeBy(config.getBatchDelay());

        Position position = Position.builder().x(30).y(40).direction(Position.Direction.UP).moving(true).build();
        dispatch(alice, new ClientMessages.UserMovesMessage(position, null));
        scheduler.advanceTimeBy(config.getBatchDelay());

        List<SubMessage> toBob = Frames.subMessages(TestSessions.channel(bob));
        ServerMessages.UserMovedMessage moved =
            assertInstanceOf(ServerMessages.UserMovedMessage.class, toBob.get(toBob.size() - 1));
        assertEquals(alice.getUserId(), moved.getUserId());
        assertEquals(30, moved.getPosition().getX());
    }

    @Test
    @DisplayName("Media state changes are published to space watchers")
    void mediaStateIsPublished() {
        Session alice = joined("alice", null);
        Session bob = joined("bob", null);
        dispatchJson(bob, "{\"type\":\"watchSpaceMessage\",\"spaceName\":\"campus\",\"filterName\":\"live\","
            + "\"filter\":{\"type\":\"liveStreaming\"}}");
        dispatch(alice, new ClientMessages.WatchSpaceMessage("campus", "all", new SpaceFilter.Everybody()));
        scheduler.advanceTimeBy(config.getBatchDelay());
        assertTrue(Frames.subMessages(TestSessions.channel(bob)).isEmpty());

        dispatch(alice, new ClientMessages.CameraStateMessage(true));
        dispatch(alice, new ClientMessages.MicrophoneStateMessage(true));
        scheduler.advanceTimeBy(config.getBatchDelay());

        List<SubMessage> toBob = Frames.subMessages(TestSessions.channel(bob));
        assertEquals(2, toBob.size());
        assertInstanceOf(ServerMessages.AddSpaceUserMessage.class, toBob.get(0));
        ServerMessages.UpdateSpaceUserMessage update =
            assertInstanceOf(ServerMessages.UpdateSpaceUserMessage.class, toBob.get(1));
        assertEquals(List.of("microphoneState"), update.getUpdatedFields());
    }

    @Test
    void unchangedAvailabilityIsNotPublished() {
        Session alice = joined("alice", null);
        dispatch(alice, new ClientMessages.SetPlayerDetailsMessage(AvailabilityStatus.UNCHANGED, "https://cards/alice"));

        assertEquals(AvailabilityStatus.ONLINE, alice.getSpaceUser().getAvailabilityStatus());
    }

    @Test
    void spaceFiltersCanBeAddedAndRemoved() {
        Session alice = joined("alice", null);
        dispatch(alice, new ClientMessages.WatchSpaceMessage("campus", "all", new SpaceFilter.Everybody()));
        dispatch(alice, new ClientMessages.AddSpaceFilterMessage("campus", "vips", new SpaceFilter.HasTag("vip")));
        dispatch(alice, new ClientMessages.UpdateSpaceFilterMessage("campus", "vips", new SpaceFilter.HasTag("staff")));
        dispatch(alice, new ClientMessages.RemoveSpaceFilterMessage("campus", "all"));

        assertEquals(List.of("vips"), spaces.find("campus").orElseThrow().filterNames(alice));

        dispatch(alice, new ClientMessages.UnwatchSpaceMessage("campus"));
        assertFalse(spaces.find("campus").isPresent());
    }

    @Test
    void filterOnAnUnwatchedSpaceFails() {
        Session alice = joined("alice", null);

        StepVerifier.create(dispatcher.dispatch(alice,
                new ClientMessages.AddSpaceFilterMessage("campus", "vips", new SpaceFilter.HasTag("vip"))))
            .expectError(IllegalStateException.class)
            .verify();
    }

    @Test
    @DisplayName("An application ping is answered right away and counts as a pong")
    void pingIsAnsweredImmediately() {
        Session alice = joined("alice", null);
        LivenessMonitor liveness = new LivenessMonitor(Duration.ofSeconds(29), Duration.ofSeconds(20), scheduler,
            () -> { }, () -> { });
        alice.setLiveness(liveness);
        liveness.start();
        scheduler.advanceTimeBy(Duration.ofSeconds(29));
        assertTrue(liveness.isAwaitingPong());

        dispatch(alice, new ClientMessages.PingMessage());

        assertFalse(liveness.isAwaitingPong());
        List<SubMessage> toAlice = Frames.subMessages(TestSessions.channel(alice));
        assertInstanceOf(ServerMessages.PongMessage.class, toAlice.get(0));
        liveness.stop();
    }

    @Test
    void reportIsForwardedAndFailuresAreOnlyReported() {
        Session alice = joined("alice", null);

        dispatch(alice, new ClientMessages.ReportPlayerMessage("uuid-bob", "spamming"));
        provider.failReports = true;
        dispatch(alice, new ClientMessages.ReportPlayerMessage("uuid-bob", "again"));

        assertEquals(List.of("uuid-bob:spamming:uuid-alice", "uuid-bob:again:uuid-alice"), provider.reports);
        assertEquals(1, telemetry.errors.size());
    }

    private static final class RecordingProvider implements MemberDataProvider {
        final List<String> reports = new ArrayList<>();
        boolean failReports;

        @Override
        public Mono<MemberData> fetchMemberData(MemberDataQuery query) {
            return Mono.just(MemberData.builder().build());
        }

        @Override
        public Mono<Void> reportPlayer(String reportedUserUuid, String reportComment, String reporterUserUuid,
                                       String roomId) {
            reports.add(reportedUserUuid + ":" + reportComment + ":" + reporterUserUuid);
            return failReports ? Mono.error(new IllegalStateException("admin API down")) : Mono.empty();
        }
    }
}
