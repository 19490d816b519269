package org.permafrost.runtime.model;

/**
 * Coarse category of an entity; drives archive eligibility and decay rules.
 */
public enum EntityCategory {
    /** Loose items: resources, food, weapons. */
    ITEM,
    /** Constructed or natural structures. */
    BUILDING,
    PLANT,
    CREATURE,
    CORPSE,
    /** Placement plan that has not been started. */
    BLUEPRINT,
    /** Structure under construction. */
    FRAME,
    /** Transient visual effect. */
    MOTE,
    /** Invisible helper objects (gas, glow, sound emitters). */
    ETHEREAL,
    /** In-flight projectile. */
    PROJECTILE,
    /** Object falling onto the region from above. */
    FALLING
}
