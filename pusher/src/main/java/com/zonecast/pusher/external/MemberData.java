package com.zonecast.pusher.external;

import com.zonecast.core.model.CharacterTexture;
import com.zonecast.core.model.CompanionTexture;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What the admin API knows about a member of a room.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MemberData {
    private String email;
    private String userUuid;
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    private String visitCardUrl;
    @Builder.Default
    private List<CharacterTexture> characterTextures = new ArrayList<>();
    private CompanionTexture companionTexture;
    @Builder.Default
    private List<MemberMessage> messages = new ArrayList<>();
    private boolean anonymous;
    private String userRoomToken;
    private String jabberId;
    private String jabberPassword;
    private boolean canEdit;

    /**
     * A message the admin API wants shown to the user once connected.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemberMessage {
        private String type;
        private String message;
    }
}
