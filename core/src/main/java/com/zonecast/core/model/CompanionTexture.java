package com.zonecast.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A resolved companion (pet) texture.
 */
@Value
public class CompanionTexture {
    String id;
    String url;

    @JsonCreator
    public CompanionTexture(@JsonProperty("id") String id, @JsonProperty("url") String url) {
        this.id = id;
        this.url = url;
    }
}
