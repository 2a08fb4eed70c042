package com.zonecast.pusher.external;

import reactor.core.publisher.Mono;

/**
 * Source of member data and sink of player reports.
 */
public interface MemberDataProvider {

    /**
     * Resolves tags, textures and permissions of a user for a room. Fails with
     * {@link MemberDataException} when the admin API refuses or cannot be reached.
     */
    Mono<MemberData> fetchMemberData(MemberDataQuery query);

    Mono<Void> reportPlayer(String reportedUserUuid, String reportComment, String reporterUserUuid, String roomId);
}
