package org.permafrost.runtime.model;

/**
 * Retention policy of a creature held by the world registry.
 */
public enum Retention {
    /** Never garbage-collected. */
    KEEP_FOREVER,
    /** May be collected once nothing references it. */
    DISCARDABLE
}
