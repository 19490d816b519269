package org.permafrost.world;

import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.model.Creature;

/**
 * A creature pulled out of a container before archiving, with the cell of that container.
 *
 * @param creature The occupant; tracked by the world registry while the region is archived.
 * @param containerCell Where the container stood.
 */
public record ContainerOccupantRecord(Creature creature, Cell containerCell) {
}
