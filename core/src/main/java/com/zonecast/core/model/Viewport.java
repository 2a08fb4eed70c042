package com.zonecast.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Visible rectangle of a client, in room pixel coordinates.
 * <p>
 * Edges are inclusive. A viewport whose {@code right < left} or {@code bottom < top}
 * is empty and overlaps no zone.
 * </p>
 */
@Value
public class Viewport {
    int top;
    int right;
    int bottom;
    int left;

    @JsonCreator
    public Viewport(
        @JsonProperty("top") int top,
        @JsonProperty("right") int right,
        @JsonProperty("bottom") int bottom,
        @JsonProperty("left") int left
    ) {
        this.top = top;
        this.right = right;
        this.bottom = bottom;
        this.left = left;
    }

    public boolean isEmpty() {
        return right < left || bottom < top;
    }
}
