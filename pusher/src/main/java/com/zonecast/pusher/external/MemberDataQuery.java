package com.zonecast.pusher.external;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Input of {@link MemberDataProvider#fetchMemberData(MemberDataQuery)}.
 */
@Value
@Builder
public class MemberDataQuery {
    String userIdentifier;
    String accessToken;
    String roomId;
    String ipAddress;
    List<String> characterTextureIds;
    String companionTextureId;
    String locale;
}
