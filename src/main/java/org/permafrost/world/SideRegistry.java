package org.permafrost.world;

import org.permafrost.runtime.model.Creature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Per-region holding area for entities extracted before the region is archived.
 * <p>
 * Occupants, owned animals and legacy parked creatures stay tracked by the world registry
 * and are only referenced here. Tracked creatures are owned exclusively by this registry.
 * </p>
 */
public class SideRegistry {

    private final int regionId;
    private final List<ContainerOccupantRecord> sleepingOccupants = new ArrayList<>();
    private final List<ContainerOccupantRecord> containerOccupants = new ArrayList<>();
    private final List<CreatureRecord> ownedAnimals = new ArrayList<>();
    private final List<CreatureRecord> trackedCreatures = new ArrayList<>();
    private final List<Creature> legacyParked = new ArrayList<>();

    public SideRegistry(int regionId) {
        this.regionId = regionId;
    }

    public int getRegionId() {
        return regionId;
    }

    public List<ContainerOccupantRecord> getSleepingOccupants() {
        return sleepingOccupants;
    }

    public List<ContainerOccupantRecord> getContainerOccupants() {
        return containerOccupants;
    }

    public List<CreatureRecord> getOwnedAnimals() {
        return ownedAnimals;
    }

    public List<CreatureRecord> getTrackedCreatures() {
        return trackedCreatures;
    }

    /**
     * Creatures parked in the world registry by the older archive layout; each carries its own position.
     *
     * @return the legacy list
     */
    public List<Creature> getLegacyParked() {
        return legacyParked;
    }

    /**
     * Empties every list.
     */
    public void clear() {
        sleepingOccupants.clear();
        containerOccupants.clear();
        ownedAnimals.clear();
        trackedCreatures.clear();
        legacyParked.clear();
    }

    /**
     * Adds the entries of a later extraction. Entries already held for a creature that is spawned
     * again, or that the later extraction records anew, are replaced.
     *
     * @param later Entries extracted by a later save of the same region.
     */
    public void mergeFrom(SideRegistry later) {
        Set<Creature> renewed = Collections.newSetFromMap(new IdentityHashMap<>());
        renewed.addAll(later.allCreatures());
        sleepingOccupants.removeIf(r -> isStale(r.creature(), renewed));
        containerOccupants.removeIf(r -> isStale(r.creature(), renewed));
        ownedAnimals.removeIf(r -> isStale(r.creature(), renewed));
        trackedCreatures.removeIf(r -> isStale(r.creature(), renewed));
        legacyParked.removeIf(c -> isStale(c, renewed));

        sleepingOccupants.addAll(later.sleepingOccupants);
        containerOccupants.addAll(later.containerOccupants);
        ownedAnimals.addAll(later.ownedAnimals);
        trackedCreatures.addAll(later.trackedCreatures);
        legacyParked.addAll(later.legacyParked);
    }

    private static boolean isStale(Creature creature, Set<Creature> renewed) {
        return creature == null || creature.isSpawned() || renewed.contains(creature);
    }

    public boolean isEmpty() {
        return totalCount() == 0;
    }

    public int totalCount() {
        return sleepingOccupants.size() + containerOccupants.size() + ownedAnimals.size()
            + trackedCreatures.size() + legacyParked.size();
    }

    /**
     * @return every creature referenced or owned by this registry
     */
    public List<Creature> allCreatures() {
        List<Creature> all = new ArrayList<>();
        sleepingOccupants.forEach(r -> all.add(r.creature()));
        containerOccupants.forEach(r -> all.add(r.creature()));
        ownedAnimals.forEach(r -> all.add(r.creature()));
        trackedCreatures.forEach(r -> all.add(r.creature()));
        all.addAll(legacyParked);
        return all;
    }

    @Override
    public String toString() {
        return "SideRegistry{region=" + regionId
            + ", sleeping=" + sleepingOccupants.size()
            + ", container=" + containerOccupants.size()
            + ", animals=" + ownedAnimals.size()
            + ", tracked=" + trackedCreatures.size()
            + (legacyParked.isEmpty() ? "" : ", legacy=" + legacyParked.size())
            + "}";
    }
}
