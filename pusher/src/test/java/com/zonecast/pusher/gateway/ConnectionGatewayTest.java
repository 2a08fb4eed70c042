package com.zonecast.pusher.gateway;

import com.zonecast.core.auth.SignedToken;
import com.zonecast.core.model.AvailabilityStatus;
import com.zonecast.core.model.CharacterTexture;
import com.zonecast.core.model.ErrorApiData;
import com.zonecast.core.model.Viewport;
import com.zonecast.core.msg.ServerMessages;
import com.zonecast.pusher.config.PusherConfig;
import com.zonecast.pusher.external.MemberData;
import com.zonecast.pusher.external.MemberDataException;
import com.zonecast.pusher.external.MemberDataProvider;
import com.zonecast.pusher.external.MemberDataQuery;
import com.zonecast.pusher.external.SignedTokenIdentityVerifier;
import com.zonecast.pusher.session.ConnectionState;
import com.zonecast.pusher.session.ConnectionStateMachine;
import com.zonecast.pusher.session.SessionSeed;
import com.zonecast.pusher.support.RecordingTelemetry;
import com.zonecast.pusher.support.TestSessions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionGatewayTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private PusherConfig config;
    private StubMemberDataProvider provider;
    private RecordingTelemetry telemetry;

    @BeforeEach
    void setUp() {
        config = TestSessions.config();
        provider = new StubMemberDataProvider();
        telemetry = new RecordingTelemetry();
    }

    private ConnectionGateway gateway(PusherConfig config) {
        return new ConnectionGateway(config,
            new SignedTokenIdentityVerifier(config.getSecretKey(), CLOCK),
            provider,
            telemetry,
            new ChatCredentialIssuer(config.getChatDomain(), "chat-secret", CLOCK));
    }

    private UpgradeRequest.UpgradeRequestBuilder request() {
        return UpgradeRequest.builder()
            .roomId(TestSessions.ROOM)
            .name("alice")
            .characterTextureId("body-1")
            .x(100)
            .y(200)
            .viewport(new Viewport(0, 640, 480, 0))
            .availabilityStatus(AvailabilityStatus.ONLINE)
            .version("v2")
            .ipAddress("10.0.0.7")
            .locale("en-US");
    }

    private String token(String identifier) {
        return SignedToken.generate(
            Map.of(SignedTokenIdentityVerifier.IDENTIFIER, identifier,
                SignedTokenIdentityVerifier.ACCESS_TOKEN, "access-" + identifier),
            NOW.plus(Duration.ofHours(1)), config.getSecretKey());
    }

    private UpgradeResult.Rejected rejected(UpgradeRequest request) {
        ConnectionStateMachine state = new ConnectionStateMachine();
        UpgradeResult result = gateway(config).upgrade(request, state, () -> false).block();
        assertEquals(ConnectionState.REJECTED, state.current());
        return assertInstanceOf(UpgradeResult.Rejected.class, result);
    }

    @Test
    @DisplayName("An outdated client version is refused with a 419 error screen")
    void versionMismatchIsRefused() {
        UpgradeResult.Rejected rejected = rejected(request().version("v1").build());

        assertEquals(RejectionReason.ERROR, rejected.getReason());
        assertEquals(419, rejected.getStatus());
        assertEquals("NEW_VERSION", rejected.getError().getCode());
        assertEquals(4419, rejected.closeCode());
        assertInstanceOf(ServerMessages.ErrorScreenMessage.class, rejected.toClientMessage());
        assertTrue(provider.queries.isEmpty());
    }

    @Test
    void badTokenIsRefusedAsExpired() {
        UpgradeResult.Rejected rejected = rejected(request().token("not-a-token").build());

        assertEquals(RejectionReason.TOKEN_INVALID, rejected.getReason());
        assertEquals(4401, rejected.closeCode());
        assertInstanceOf(ServerMessages.TokenExpiredMessage.class, rejected.toClientMessage());
    }

    @Test
    void anonymousClientsCanBeDisabled() {
        config = config.toBuilder().disableAnonymous(true).build();

        UpgradeResult.Rejected rejected = rejected(request().build());

        assertNull(rejected.getReason());
        assertEquals(401, rejected.getStatus());
        assertEquals(ConnectionGateway.EXPECTING_TOKEN, rejected.getMessage());
        assertEquals(1, telemetry.messages.size());
    }

    @Test
    @DisplayName("A logged user is accepted with its member data")
    void acceptsLoggedUser() {
        provider.answer = query -> Mono.just(MemberData.builder()
            .userUuid("uuid-alice")
            .tags(List.of("vip"))
            .characterTextures(List.of(new CharacterTexture("body-1", "http://textures.test/body-1.png")))
            .messages(List.of(new MemberData.MemberMessage("message", "Welcome back")))
            .canEdit(true)
            .build());

        ConnectionStateMachine state = new ConnectionStateMachine();
        StepVerifier.create(gateway(config).upgrade(request().token(token("alice@example.com")).build(), state,
                () -> false))
            .assertNext(result -> {
                SessionSeed seed = assertInstanceOf(UpgradeResult.Accepted.class, result).getSeed();
                assertEquals("uuid-alice", seed.getUserUuid());
                assertEquals("alice@example.com", seed.getUserIdentifier());
                assertTrue(seed.isLogged());
                assertTrue(seed.isCanEdit());
                assertEquals(List.of("vip"), seed.getTags());
                assertEquals(100, seed.getPosition().getX());
                assertEquals(1, seed.getPendingMessages().size());
                assertEquals("Welcome back", seed.getPendingMessages().get(0).getMessage());
                assertTrue(seed.getJabberId().startsWith("alice@example.com@chat.test/"));
                assertEquals(List.of("vip"), seed.getSpaceUser().getTags());
            })
            .verifyComplete();
        assertEquals(ConnectionState.CONNECTING, state.current());

        MemberDataQuery query = provider.queries.get(0);
        assertEquals("access-alice@example.com", query.getAccessToken());
        assertEquals("10.0.0.7", query.getIpAddress());
    }

    @Test
    void structuredAdminErrorIsForwarded() {
        ErrorApiData error = ErrorApiData.builder().type("error").title("World full").code("WORLD_FULL").build();
        provider.answer = query -> Mono.error(new MemberDataException(403, error, "World full"));

        UpgradeResult.Rejected rejected = rejected(request().build());

        assertEquals(RejectionReason.ERROR, rejected.getReason());
        assertEquals(403, rejected.getStatus());
        assertEquals("WORLD_FULL", rejected.getError().getCode());
    }

    @Test
    void unstructuredAdminErrorIsA500() {
        provider.answer = query -> Mono.error(new MemberDataException("connection reset", new RuntimeException()));

        UpgradeResult.Rejected rejected = rejected(request().build());

        assertNull(rejected.getReason());
        assertEquals(500, rejected.getStatus());
        assertEquals(1, telemetry.errors.size());
    }

    @Test
    void unexpectedFailureRefusesAccess() {
        provider.answer = query -> Mono.error(new IllegalArgumentException("boom"));

        UpgradeResult.Rejected rejected = rejected(request().build());

        assertEquals(401, rejected.getStatus());
        assertEquals(ConnectionGateway.ACCESS_REFUSED, rejected.getMessage());
        assertInstanceOf(ServerMessages.ConnectionErrorMessage.class, rejected.toClientMessage());
    }

    @Test
    void unresolvedCharacterTextureIsRefused() {
        provider.answer = query -> Mono.just(MemberData.builder().build());

        UpgradeResult.Rejected rejected = rejected(request().build());

        assertEquals(RejectionReason.INVALID_TEXTURE, rejected.getReason());
        assertEquals(UpgradeResult.Rejected.CHARACTER, rejected.getEntityType());
        assertEquals(4422, rejected.closeCode());
    }

    @Test
    void unresolvedCompanionTextureIsRefused() {
        UpgradeResult.Rejected rejected = rejected(request().companionTextureId("dog-1").build());

        assertEquals(UpgradeResult.Rejected.COMPANION, rejected.getEntityType());
        ServerMessages.InvalidTextureMessage message =
            assertInstanceOf(ServerMessages.InvalidTextureMessage.class, rejected.toClientMessage());
        assertEquals("companion", message.getEntityType());
    }

    @Test
    @DisplayName("No decision is emitted once the client went away")
    void abortedUpgradeIsEmpty() {
        ConnectionStateMachine state = new ConnectionStateMachine();
        StepVerifier.create(gateway(config).upgrade(request().build(), state, () -> true))
            .verifyComplete();
        assertEquals(ConnectionState.CONNECTING, state.current());
    }

    private static final class StubMemberDataProvider implements MemberDataProvider {
        final List<MemberDataQuery> queries = new ArrayList<>();
        Function<MemberDataQuery, Mono<MemberData>> answer = query -> Mono.just(MemberData.builder()
            .userUuid("uuid-" + query.getUserIdentifier())
            .characterTextures(List.of(new CharacterTexture("body-1", "http://textures.test/body-1.png")))
            .build());

        @Override
        public Mono<MemberData> fetchMemberData(MemberDataQuery query) {
            queries.add(query);
            return answer.apply(query);
        }

        @Override
        public Mono<Void> reportPlayer(String reportedUserUuid, String reportComment, String reporterUserUuid,
                                       String roomId) {
            return Mono.empty();
        }
    }
}
