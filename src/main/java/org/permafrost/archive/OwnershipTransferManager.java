package org.permafrost.archive;

import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.model.Container;
import org.permafrost.runtime.model.Corpse;
import org.permafrost.runtime.model.Creature;
import org.permafrost.runtime.model.Entity;
import org.permafrost.runtime.model.GroupController;
import org.permafrost.runtime.model.Region;
import org.permafrost.runtime.model.Retention;
import org.permafrost.runtime.model.WorldRegistry;
import org.permafrost.world.ContainerOccupantRecord;
import org.permafrost.world.CreatureRecord;
import org.permafrost.world.SideRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Moves entities that must not be written into a region archive to where they can survive the
 * region's absence: the world registry or the region's {@link SideRegistry}.
 * <p>
 * The extraction passes run in a fixed order before the archived entity list is captured;
 * each pass relies on the world registry state the previous one left. All passes iterate
 * snapshots, never live collections.
 * </p>
 */
public final class OwnershipTransferManager {

    private static final Logger log = LoggerFactory.getLogger(OwnershipTransferManager.class);

    /**
     * Empties every container in the region. Occupants the world registry does not track yet are
     * registered there to be kept forever, then recorded by affiliation with the container cell.
     *
     * @param region Region being archived.
     * @param side The region's cleared side registry.
     * @return number of extracted occupants
     */
    public int extractContainerOccupants(Region region, SideRegistry side) {
        WorldRegistry worldRegistry = region.getWorld().getWorldRegistry();
        int sleeping = 0;
        int other = 0;
        for (Entity entity : region.snapshotEntities()) {
            if (!(entity instanceof Container) || entity.isDestroyed()) {
                continue;
            }
            Container container = (Container) entity;
            for (Entity held : new ArrayList<>(container.getContents())) {
                if (!(held instanceof Creature)) {
                    continue;
                }
                Creature occupant = (Creature) held;
                container.remove(occupant);
                if (!worldRegistry.isTracked(occupant)) {
                    worldRegistry.passToWorld(occupant, Retention.KEEP_FOREVER);
                }
                ContainerOccupantRecord record = new ContainerOccupantRecord(occupant, container.getPosition());
                if (occupant.isPlayerAffiliated()) {
                    side.getSleepingOccupants().add(record);
                    sleeping++;
                } else {
                    side.getContainerOccupants().add(record);
                    other++;
                }
            }
        }
        if (sleeping > 0) {
            log.info("Moved {} sleeping occupant(s) of region {} to the world registry", sleeping, region.getId());
        }
        if (other > 0) {
            log.info("Moved {} container occupant(s) of region {} to the world registry", other, region.getId());
        }
        return sleeping + other;
    }

    /**
     * Despawns player-affiliated non-human creatures, keeps them in the world registry forever
     * and records where they stood.
     *
     * @param region Region being archived.
     * @param side The region's side registry.
     * @return number of extracted animals
     */
    public int extractOwnedAnimals(Region region, SideRegistry side) {
        WorldRegistry worldRegistry = region.getWorld().getWorldRegistry();
        int count = 0;
        for (Entity entity : region.snapshotEntities()) {
            if (!(entity instanceof Creature)) {
                continue;
            }
            Creature creature = (Creature) entity;
            if (creature.isHumanlike() || !creature.isPlayerAffiliated() || !creature.isSpawned()) {
                continue;
            }
            Cell position = creature.getPosition();
            region.despawn(creature);
            worldRegistry.passToWorld(creature, Retention.KEEP_FOREVER);
            side.getOwnedAnimals().add(new CreatureRecord(creature, position));
            count++;
        }
        if (count > 0) {
            log.info("Moved {} player animal(s) of region {} to the world registry", count, region.getId());
        }
        return count;
    }

    /**
     * Takes non-human, non-player creatures that the world registry tracks while they are
     * spawned, removes them from the world registry and hands full ownership to the side registry.
     *
     * @param region Region being archived.
     * @param side The region's side registry.
     * @return number of extracted creatures
     */
    public int extractTrackedCreatures(Region region, SideRegistry side) {
        WorldRegistry worldRegistry = region.getWorld().getWorldRegistry();
        int count = 0;
        for (Entity entity : region.snapshotEntities()) {
            if (!(entity instanceof Creature)) {
                continue;
            }
            Creature creature = (Creature) entity;
            if (creature.isHumanlike() || creature.isPlayerAffiliated() || !creature.isSpawned()
                    || !worldRegistry.isTracked(creature)) {
                continue;
            }
            Cell position = creature.getPosition();
            region.despawn(creature);
            worldRegistry.remove(creature);
            side.getTrackedCreatures().add(new CreatureRecord(creature, position));
            count++;
        }
        if (count > 0) {
            log.info("Moved {} world-tracked creature(s) of region {} into the side registry", count, region.getId());
        }
        return count;
    }

    /**
     * @param region Region being archived.
     * @return group controllers owning at least one spawned non-human, non-player creature
     */
    public List<GroupController> collectGroupLeaders(Region region) {
        List<GroupController> leaders = new ArrayList<>();
        for (GroupController controller : region.getGroupManager().getControllers()) {
            for (Creature owned : controller.getOwnedCreatures()) {
                if (owned != null && owned.isSpawned() && !owned.isHumanlike() && !owned.isPlayerAffiliated()) {
                    leaders.add(controller);
                    break;
                }
            }
        }
        if (!leaders.isEmpty()) {
            log.info("Saving {} group controller(s) with their creatures for region {}", leaders.size(), region.getId());
        }
        return leaders;
    }

    /**
     * Runs after the archive is written: despawns archived non-human creatures and clears their
     * affiliation so the host's teardown neither kills them into the dead store nor parks them in
     * the world registry. Creatures owned by a saved group controller keep their affiliation.
     *
     * @param region The archived region.
     * @param archived Archived entities.
     * @param leaders Saved group controllers.
     * @return number of detached creatures
     */
    public int detachArchivedCreatures(Region region, Collection<Entity> archived, Collection<GroupController> leaders) {
        Set<Creature> groupOwned = new LinkedHashSet<>();
        for (GroupController controller : leaders) {
            for (Creature owned : controller.getOwnedCreatures()) {
                if (owned != null) {
                    groupOwned.add(owned);
                }
            }
        }
        int detached = 0;
        for (Entity entity : archived) {
            if (!(entity instanceof Creature) || ((Creature) entity).isHumanlike()) {
                continue;
            }
            Creature creature = (Creature) entity;
            region.despawn(creature);
            if (!groupOwned.contains(creature)) {
                creature.setFaction(null);
            }
            detached++;
        }
        for (Creature owned : groupOwned) {
            if (owned.getRegion() == region) {
                region.despawn(owned);
                detached++;
            }
        }
        return detached;
    }

    /**
     * World registry state taken before the extraction passes of a save, so a save that fails
     * before its archive is written can be undone.
     */
    public static final class RegistrySnapshot {

        private final Map<Creature, Retention> retention = new IdentityHashMap<>();
        private final Set<Creature> forced = Collections.newSetFromMap(new IdentityHashMap<>());

        private RegistrySnapshot(WorldRegistry registry) {
            for (Creature creature : registry.allAliveOrDead()) {
                retention.put(creature, registry.getRetention(creature));
            }
            forced.addAll(registry.getForcedRetention());
        }
    }

    /**
     * @param registry Registry of the world being saved.
     * @return its current tracking state
     */
    public RegistrySnapshot snapshot(WorldRegistry registry) {
        return new RegistrySnapshot(registry);
    }

    /**
     * Undoes the extraction passes of a failed save. Occupants go back into the container at their
     * recorded cell (or stand on that cell if it is gone), extracted creatures respawn where they
     * stood, and the world registry returns to its state before the save.
     *
     * @param region The region whose save failed.
     * @param extracted Side registry the passes filled; not the one held by the world.
     * @param before Registry state taken before the passes ran.
     * @return number of creatures put back into the region
     */
    public int rollbackExtraction(Region region, SideRegistry extracted, RegistrySnapshot before) {
        int restored = 0;
        List<ContainerOccupantRecord> occupants = new ArrayList<>(extracted.getSleepingOccupants());
        occupants.addAll(extracted.getContainerOccupants());
        for (ContainerOccupantRecord record : occupants) {
            Creature occupant = record.creature();
            Optional<Container> container = region.firstAt(record.containerCell(), Container.class);
            if (container.isEmpty() || !container.get().tryAccept(occupant)) {
                log.warn("Container at {} no longer takes {}; standing it on that cell", record.containerCell(), occupant);
                region.spawn(occupant, record.containerCell(), occupant.getRotation());
            }
            restored++;
        }
        List<CreatureRecord> standing = new ArrayList<>(extracted.getOwnedAnimals());
        standing.addAll(extracted.getTrackedCreatures());
        for (CreatureRecord record : standing) {
            if (!record.creature().isSpawned()) {
                region.spawn(record.creature(), record.position(), record.creature().getRotation());
                restored++;
            }
        }
        extracted.clear();

        WorldRegistry registry = region.getWorld().getWorldRegistry();
        for (Creature creature : registry.allAliveOrDead()) {
            if (!before.retention.containsKey(creature)) {
                registry.remove(creature);
            }
        }
        for (Map.Entry<Creature, Retention> entry : before.retention.entrySet()) {
            if (registry.getRetention(entry.getKey()) != entry.getValue()) {
                registry.passToWorld(entry.getKey(), entry.getValue());
            }
        }
        registry.getForcedRetention().retainAll(before.forced);
        registry.getForcedRetention().addAll(before.forced);
        return restored;
    }

    /**
     * Pins the inner creatures of archived corpses in the world registry's forced-retention set so
     * they are not garbage collected while the region is archived.
     *
     * @param world Registry of the owning world.
     * @param archived Archived entities.
     * @return number of protected creatures
     */
    public int protectCorpseOccupants(WorldRegistry world, Collection<Entity> archived) {
        int count = 0;
        for (Creature inner : corpseOccupants(archived)) {
            if (!world.isTracked(inner)) {
                inner.setDead(true);
                world.passToWorld(inner, Retention.DISCARDABLE);
            }
            if (world.getForcedRetention().add(inner)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Removes the forced-retention pins of restored corpses; their presence in the region
     * protects the inner creatures from here on.
     *
     * @param world Registry of the owning world.
     * @param restored Restored entities.
     * @return number of released pins
     */
    public int releaseCorpseOccupants(WorldRegistry world, Collection<Entity> restored) {
        int count = 0;
        for (Creature inner : corpseOccupants(restored)) {
            if (world.getForcedRetention().remove(inner)) {
                count++;
            }
        }
        return count;
    }

    /**
     * @param entities Entities to scan.
     * @return inner creatures of standalone corpses and of corpses held in containers
     */
    public static List<Creature> corpseOccupants(Collection<Entity> entities) {
        List<Creature> result = new ArrayList<>();
        for (Entity entity : entities) {
            if (entity instanceof Corpse) {
                Creature inner = ((Corpse) entity).getInnerCreature();
                if (inner != null) {
                    result.add(inner);
                }
            } else if (entity instanceof Container) {
                for (Entity held : ((Container) entity).getContents()) {
                    if (held instanceof Corpse && ((Corpse) held).getInnerCreature() != null) {
                        result.add(((Corpse) held).getInnerCreature());
                    }
                }
            }
        }
        return result;
    }
}
