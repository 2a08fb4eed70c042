package com.zonecast.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Player position in room pixel coordinates.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Position {
    int x;
    int y;
    Direction direction = Direction.DOWN;
    boolean moving;

    public enum Direction {
        UP, DOWN, LEFT, RIGHT
    }
}
