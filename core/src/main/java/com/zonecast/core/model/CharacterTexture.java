package com.zonecast.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A resolved character ("woka") layer: the id the client asked for and the URL to load it from.
 */
@Value
public class CharacterTexture {
    String id;
    String url;

    @JsonCreator
    public CharacterTexture(@JsonProperty("id") String id, @JsonProperty("url") String url) {
        this.id = id;
        this.url = url;
    }
}
