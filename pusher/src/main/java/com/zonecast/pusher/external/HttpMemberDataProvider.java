package com.zonecast.pusher.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.zonecast.core.model.ErrorApiData;
import com.zonecast.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.QueryStringEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.Map;

/**
 * Member data fetched from the admin API using reactor-netty HttpClient.
 * <p>
 * Non-2xx answers whose body is a structured error ({@code type} and {@code title} present)
 * surface as a {@link MemberDataException} carrying it; other failures surface without one.
 * </p>
 */
public class HttpMemberDataProvider implements MemberDataProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpMemberDataProvider.class);

    private final HttpClient httpClient;

    public HttpMemberDataProvider(String adminApiUrl, String adminApiToken) {
        this.httpClient = HttpClient.create()
                .baseUrl(adminApiUrl)
                .headers(h -> {
                    h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON);
                    if (adminApiToken != null) {
                        h.set(HttpHeaderNames.AUTHORIZATION, adminApiToken);
                    }
                })
                .responseTimeout(Duration.ofSeconds(10));

        log.info("HttpMemberDataProvider initialized with {}", adminApiUrl);
    }

    @Override
    public Mono<MemberData> fetchMemberData(MemberDataQuery query) {
        QueryStringEncoder uri = new QueryStringEncoder("/api/room/access");
        uri.addParam("userIdentifier", query.getUserIdentifier());
        uri.addParam("playUri", query.getRoomId());
        if (query.getIpAddress() != null) {
            uri.addParam("ipAddress", query.getIpAddress());
        }
        for (String id : query.getCharacterTextureIds()) {
            uri.addParam("characterTextureIds[]", id);
        }
        if (query.getCompanionTextureId() != null) {
            uri.addParam("companionTextureId", query.getCompanionTextureId());
        }
        if (query.getAccessToken() != null) {
            uri.addParam("accessToken", query.getAccessToken());
        }

        return httpClient
                .headers(h -> {
                    if (query.getLocale() != null) {
                        h.set(HttpHeaderNames.ACCEPT_LANGUAGE, query.getLocale());
                    }
                })
                .get()
                .uri(uri.toString())
                .responseSingle((response, body) -> body.asString()
                        .defaultIfEmpty("")
                        .map(text -> {
                            int status = response.status().code();
                            if (status >= 200 && status < 300) {
                                return JsonUtils.readValue(text, MemberData.class);
                            }
                            throw toException(status, text);
                        }))
                .onErrorMap(err -> !(err instanceof MemberDataException),
                        err -> new MemberDataException("Admin API unreachable: " + err.getMessage(), err))
                .doOnError(err -> log.debug("Member data lookup failed for {} in {}: {}",
                        query.getUserIdentifier(), query.getRoomId(), err.getMessage()));
    }

    @Override
    public Mono<Void> reportPlayer(String reportedUserUuid, String reportComment, String reporterUserUuid,
                                   String roomId) {
        String json = JsonUtils.writeValueAsString(Map.of(
                "reportedUserUuid", reportedUserUuid,
                "reportedUserComment", reportComment == null ? "" : reportComment,
                "reporterUserUuid", reporterUserUuid,
                "reportWorldSlug", roomId
        ));
        return httpClient
                .headers(h -> h.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON))
                .post()
                .uri("/api/report")
                .send(ByteBufFlux.fromString(Mono.just(json)))
                .responseSingle((response, body) -> {
                    if (response.status().code() >= 300) {
                        return Mono.error(new MemberDataException(response.status().code(), null,
                                "Report rejected with status " + response.status().code()));
                    }
                    return Mono.<Void>empty();
                });
    }

    static MemberDataException toException(int status, String body) {
        try {
            JsonNode node = JsonUtils.mapper().readTree(body);
            if (node != null && node.hasNonNull("type") && node.hasNonNull("title")) {
                ErrorApiData error = JsonUtils.mapper().treeToValue(node, ErrorApiData.class);
                return new MemberDataException(status, error, "Admin API refused access: " + error.getCode());
            }
        } catch (Exception e) {
            log.debug("Admin API error body is not structured: {}", e.getMessage());
        }
        return new MemberDataException(status, null, body.isEmpty() ? "Admin API answered " + status : body);
    }
}
