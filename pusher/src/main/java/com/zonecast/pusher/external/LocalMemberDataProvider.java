package com.zonecast.pusher.external;

import com.zonecast.core.model.CharacterTexture;
import com.zonecast.core.model.CompanionTexture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Member data for nodes running without an admin API: every user is anonymous and every
 * non-blank texture id resolves to a file under the texture base URL.
 */
public class LocalMemberDataProvider implements MemberDataProvider {
    private static final Logger log = LoggerFactory.getLogger(LocalMemberDataProvider.class);

    private final String textureBaseUrl;

    public LocalMemberDataProvider(String textureBaseUrl) {
        this.textureBaseUrl = textureBaseUrl.endsWith("/") ? textureBaseUrl : textureBaseUrl + "/";
    }

    @Override
    public Mono<MemberData> fetchMemberData(MemberDataQuery query) {
        return Mono.fromSupplier(() -> {
            List<CharacterTexture> textures = new ArrayList<>();
            for (String id : query.getCharacterTextureIds()) {
                if (id != null && !id.isBlank()) {
                    textures.add(new CharacterTexture(id, textureBaseUrl + id + ".png"));
                }
            }
            String companionId = query.getCompanionTextureId();
            CompanionTexture companion = companionId == null || companionId.isBlank()
                ? null
                : new CompanionTexture(companionId, textureBaseUrl + "companions/" + companionId + ".png");

            String identifier = query.getUserIdentifier();
            return MemberData.builder()
                .email(identifier)
                .userUuid(identifier == null || identifier.isEmpty() ? UUID.randomUUID().toString() : identifier)
                .characterTextures(textures)
                .companionTexture(companion)
                .anonymous(query.getAccessToken() == null)
                .build();
        });
    }

    @Override
    public Mono<Void> reportPlayer(String reportedUserUuid, String reportComment, String reporterUserUuid,
                                   String roomId) {
        log.info("Player {} reported by {} in {}: {}", reportedUserUuid, reporterUserUuid, roomId, reportComment);
        return Mono.empty();
    }
}
