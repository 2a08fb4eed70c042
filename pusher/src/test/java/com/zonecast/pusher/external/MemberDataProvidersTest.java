package com.zonecast.pusher.external;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemberDataProvidersTest {

    @Test
    void localProviderResolvesNonBlankTextures() {
        LocalMemberDataProvider provider = new LocalMemberDataProvider("http://textures.test");
        MemberDataQuery query = MemberDataQuery.builder()
            .userIdentifier("alice@example.com")
            .characterTextureIds(Arrays.asList("body-1", " ", "hair-2"))
            .companionTextureId("dog")
            .build();

        StepVerifier.create(provider.fetchMemberData(query))
            .assertNext(data -> {
                assertEquals(2, data.getCharacterTextures().size());
                assertEquals("http://textures.test/body-1.png", data.getCharacterTextures().get(0).getUrl());
                assertEquals("http://textures.test/companions/dog.png", data.getCompanionTexture().getUrl());
                assertEquals("alice@example.com", data.getUserUuid());
                assertTrue(data.isAnonymous());
            })
            .verifyComplete();
    }

    @Test
    void localProviderGivesAnonymousUsersARandomUuid() {
        LocalMemberDataProvider provider = new LocalMemberDataProvider("/textures/");
        MemberDataQuery query = MemberDataQuery.builder()
            .userIdentifier("")
            .characterTextureIds(List.of("body-1"))
            .build();

        MemberData data = provider.fetchMemberData(query).block();

        assertFalse(data.getUserUuid().isEmpty());
        assertNull(data.getCompanionTexture());
    }

    @Test
    void structuredAdminErrorBodyIsKept() {
        MemberDataException e = HttpMemberDataProvider.toException(403,
            "{\"type\":\"unauthorized\",\"title\":\"Private world\",\"code\":\"PRIVATE\",\"extra\":1}");

        assertTrue(e.isStructured());
        assertEquals(403, e.getStatus());
        assertEquals("PRIVATE", e.getErrorData().getCode());
    }

    @Test
    void plainAdminErrorBodyIsUnstructured() {
        MemberDataException e = HttpMemberDataProvider.toException(502, "Bad gateway");

        assertFalse(e.isStructured());
        assertEquals("Bad gateway", e.getMessage());
        assertEquals("Admin API answered 500", HttpMemberDataProvider.toException(500, "").getMessage());
    }
}
