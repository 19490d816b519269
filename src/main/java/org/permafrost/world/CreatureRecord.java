package org.permafrost.world;

import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.model.Creature;

/**
 * A creature extracted from a region with the position it stood at.
 *
 * @param creature The creature.
 * @param position Saved position.
 */
public record CreatureRecord(Creature creature, Cell position) {
}
