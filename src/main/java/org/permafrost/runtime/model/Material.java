package org.permafrost.runtime.model;

/**
 * Primary construction material of an entity.
 */
public enum Material {
    WOOD,
    METAL,
    STONE,
    /** Entity without any material (e.g. abstract devices). */
    NONE,
    /** Material the decay tables do not know. */
    OTHER
}
