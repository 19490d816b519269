package org.permafrost.runtime.model;

/**
 * Facing of a placed entity.
 */
public enum Rotation {
    NORTH,
    EAST,
    SOUTH,
    WEST
}
