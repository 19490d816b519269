package org.permafrost.runtime.model;

/**
 * How the world registry currently tracks a creature.
 */
public enum WorldSituation {
    NONE,
    ALIVE,
    DEAD
}
