package com.zonecast.pusher.gateway;

import com.zonecast.core.model.CharacterTexture;
import com.zonecast.core.model.Colors;
import com.zonecast.core.model.ErrorApiData;
import com.zonecast.core.model.Position;
import com.zonecast.core.model.SpaceUser;
import com.zonecast.core.msg.ServerMessages;
import com.zonecast.pusher.config.PusherConfig;
import com.zonecast.pusher.external.Identity;
import com.zonecast.pusher.external.IdentityVerifier;
import com.zonecast.pusher.external.InvalidTokenException;
import com.zonecast.pusher.external.MemberData;
import com.zonecast.pusher.external.MemberDataException;
import com.zonecast.pusher.external.MemberDataProvider;
import com.zonecast.pusher.external.MemberDataQuery;
import com.zonecast.pusher.external.TelemetrySink;
import com.zonecast.pusher.session.ConnectionState;
import com.zonecast.pusher.session.ConnectionStateMachine;
import com.zonecast.pusher.session.SessionSeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Decides whether a room socket upgrade is accepted.
 * <p>
 * Checks run in order: protocol version, room token, anonymous policy, member data, textures.
 * Every refusal becomes an {@link UpgradeResult.Rejected}; nothing is thrown to the transport.
 * If the client went away while the decision was being made the result is empty.
 * </p>
 */
public class ConnectionGateway {
    private static final Logger log = LoggerFactory.getLogger(ConnectionGateway.class);

    static final String ACCESS_REFUSED = "User cannot access this world";
    static final String EXPECTING_TOKEN = "Expecting token";

    private final PusherConfig config;
    private final IdentityVerifier identityVerifier;
    private final MemberDataProvider memberDataProvider;
    private final TelemetrySink telemetry;
    private final ChatCredentialIssuer chatCredentials;

    public ConnectionGateway(
            PusherConfig config,
            IdentityVerifier identityVerifier,
            MemberDataProvider memberDataProvider,
            TelemetrySink telemetry,
            ChatCredentialIssuer chatCredentials
    ) {
        this.config = config;
        this.identityVerifier = identityVerifier;
        this.memberDataProvider = memberDataProvider;
        this.telemetry = telemetry;
        this.chatCredentials = chatCredentials;
    }

    /**
     * @param request validated upgrade request
     * @param state   lifecycle of the connection; moved to {@link ConnectionState#REJECTED} on refusal
     * @param aborted true once the client closed the underlying HTTP connection
     * @return the decision, or empty when the client aborted
     */
    public Mono<UpgradeResult> upgrade(UpgradeRequest request, ConnectionStateMachine state, BooleanSupplier aborted) {
        return Mono.defer(() -> decide(request))
                .filter(result -> {
                    if (aborted.getAsBoolean()) {
                        log.info("Client disconnected from {} before the upgrade completed", request.getRoomId());
                        return false;
                    }
                    return true;
                })
                .doOnNext(result -> {
                    if (result instanceof UpgradeResult.Rejected) {
                        state.transition(ConnectionState.REJECTED);
                    }
                });
    }

    private Mono<UpgradeResult> decide(UpgradeRequest request) {
        if (!config.getApiVersionHash().equals(request.getVersion())) {
            log.debug("Refusing client with version {} (expected {})", request.getVersion(), config.getApiVersionHash());
            return Mono.just(UpgradeResult.Rejected.error(419, newVersionError()));
        }

        Identity identity = null;
        if (request.getToken() != null) {
            try {
                identity = identityVerifier.verify(request.getToken());
            } catch (InvalidTokenException e) {
                log.debug("Invalid token for room {}: {}", request.getRoomId(), e.getMessage());
                return Mono.just(UpgradeResult.Rejected.tokenInvalid(e.getMessage()));
            }
        }
        if (identity == null && config.isDisableAnonymous()) {
            telemetry.report(EXPECTING_TOKEN + " for room " + request.getRoomId());
            return Mono.just(UpgradeResult.Rejected.generic(401, EXPECTING_TOKEN));
        }

        String identifier = identity != null ? identity.getIdentifier() : "";
        boolean logged = identity != null && identity.isLogged();
        MemberDataQuery query = MemberDataQuery.builder()
                .userIdentifier(identifier)
                .accessToken(identity != null ? identity.getAccessToken() : null)
                .roomId(request.getRoomId())
                .ipAddress(request.getIpAddress())
                .characterTextureIds(request.getCharacterTextureIds())
                .companionTextureId(request.getCompanionTextureId())
                .locale(request.getLocale())
                .build();

        return memberDataProvider.fetchMemberData(query)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("No member data for " + identifier)))
                .map(data -> accept(request, identifier, logged, data))
                .onErrorResume(MemberDataException.class, e -> Mono.just(refuse(request, identifier, e)))
                .onErrorResume(e -> !(e instanceof MemberDataException), e -> {
                    log.info("Access not granted for user {} and room {}",
                            identifier.isEmpty() ? "anonymous" : identifier, request.getRoomId());
                    telemetry.report(e);
                    return Mono.just(UpgradeResult.Rejected.generic(401, ACCESS_REFUSED));
                });
    }

    private UpgradeResult refuse(UpgradeRequest request, String identifier, MemberDataException e) {
        if (e.isStructured()) {
            int status = e.getStatus() > 0 ? e.getStatus() : 500;
            log.error("Admin API refused {} in room {} with status {}: {}",
                    identifier, request.getRoomId(), status, e.getErrorData());
            telemetry.report("Admin API error on room connection " + status + " " + e.getErrorData());
            return UpgradeResult.Rejected.error(status, e.getErrorData());
        }
        log.error("Unknown error on room connection to {}", request.getRoomId(), e);
        telemetry.report(e);
        return UpgradeResult.Rejected.generic(500, e.getMessage());
    }

    private UpgradeResult accept(UpgradeRequest request, String identifier, boolean logged, MemberData data) {
        List<CharacterTexture> resolved = data.getCharacterTextures() == null ? List.of() : data.getCharacterTextures();
        if (request.getCharacterTextureIds().size() != resolved.size()) {
            return UpgradeResult.Rejected.invalidTexture(UpgradeResult.Rejected.CHARACTER);
        }
        if (request.getCompanionTextureId() != null && data.getCompanionTexture() == null) {
            return UpgradeResult.Rejected.invalidTexture(UpgradeResult.Rejected.COMPANION);
        }

        ChatCredentialIssuer.ChatCredentials chat =
                chatCredentials.issue(identifier, data.getJabberId(), data.getJabberPassword());
        String userUuid = data.getUserUuid() != null && !data.getUserUuid().isEmpty()
                ? data.getUserUuid()
                : UUID.randomUUID().toString();
        List<String> tags = data.getTags() == null ? List.of() : data.getTags();

        SpaceUser spaceUser = SpaceUser.builder()
                .uuid(userUuid)
                .name(request.getName())
                .playUri(request.getRoomId())
                .roomName("")
                .availabilityStatus(request.getAvailabilityStatus())
                .logged(logged)
                .color(Colors.colorFor(request.getName()))
                .tags(tags)
                .characterTextures(resolved)
                .visitCardUrl(data.getVisitCardUrl())
                .build();

        SessionSeed.SessionSeedBuilder seed = SessionSeed.builder()
                .token(request.getToken() == null ? "" : request.getToken())
                .userUuid(userUuid)
                .userIdentifier(identifier)
                .userJid(chat.getJid())
                .ipAddress(request.getIpAddress())
                .roomId(request.getRoomId())
                .name(request.getName())
                .tags(tags)
                .visitCardUrl(data.getVisitCardUrl())
                .userRoomToken(data.getUserRoomToken())
                .characterTextures(resolved)
                .companionTexture(data.getCompanionTexture())
                .availabilityStatus(request.getAvailabilityStatus())
                .lastCommandId(request.getLastCommandId())
                .position(Position.builder()
                        .x(request.getX())
                        .y(request.getY())
                        .direction(Position.Direction.DOWN)
                        .moving(false)
                        .build())
                .viewport(request.getViewport())
                .canEdit(data.isCanEdit())
                .logged(logged)
                .jabberId(chat.getJid())
                .jabberPassword(chat.getPassword())
                .spaceUser(spaceUser);
        if (data.getMessages() != null) {
            for (MemberData.MemberMessage message : data.getMessages()) {
                seed.pendingMessage(new ServerMessages.SendUserMessage(message.getType(), message.getMessage()));
            }
        }
        return new UpgradeResult.Accepted(seed.build());
    }

    static ErrorApiData newVersionError() {
        return ErrorApiData.builder()
                .type("retry")
                .title("Please refresh")
                .subtitle("New version available")
                .image("/resources/icons/new_version.png")
                .code("NEW_VERSION")
                .details("A new version is available. Please refresh your window")
                .canRetryManual(true)
                .buttonTitle("Refresh")
                .timeToRetry(999999)
                .build();
    }
}
