package org.permafrost.runtime.model;

/**
 * Definition of a terrain type. Constructed floors sit on top of natural terrain
 * and can erode away.
 *
 * @param id Stable 16-bit id used in grid layers.
 * @param name Definition name.
 * @param constructedFloor True for player-built floors.
 */
public record TerrainDef(int id, String name, boolean constructedFloor) {
}
