package org.permafrost.runtime.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Long-lived store of creatures that are not owned by any region: travellers, parked
 * occupants and the "remembered dead" referenced by corpses.
 * <p>
 * A creature may be tracked here while it is also spawned (spawned event creatures).
 * Every tracked creature holds an identity registration in the world.
 * </p>
 */
public class WorldRegistry {

    private final World world;
    private final Map<Creature, Retention> alive = new LinkedHashMap<>();
    private final Map<Creature, Retention> dead = new LinkedHashMap<>();
    private final Set<Creature> forcedRetention = new LinkedHashSet<>();

    WorldRegistry(World world) {
        this.world = world;
    }

    /**
     * @param creature The creature.
     * @return how the registry tracks it
     */
    public WorldSituation getSituation(Creature creature) {
        if (alive.containsKey(creature)) {
            return WorldSituation.ALIVE;
        }
        if (dead.containsKey(creature)) {
            return WorldSituation.DEAD;
        }
        return WorldSituation.NONE;
    }

    public boolean isTracked(Creature creature) {
        return getSituation(creature) != WorldSituation.NONE;
    }

    /**
     * Starts tracking a creature, or updates the retention of an already tracked one.
     *
     * @param creature The creature; dead creatures go to the dead store.
     * @param retention Retention policy.
     */
    public void passToWorld(Creature creature, Retention retention) {
        boolean tracked = isTracked(creature);
        alive.remove(creature);
        dead.remove(creature);
        if (creature.isDead()) {
            dead.put(creature, retention);
        } else {
            alive.put(creature, retention);
        }
        if (!tracked) {
            world.getIdentities().register(creature);
        }
    }

    /**
     * Stops tracking a creature.
     *
     * @param creature The creature.
     * @return true if it was tracked
     */
    public boolean remove(Creature creature) {
        boolean removed = alive.remove(creature) != null | dead.remove(creature) != null;
        if (removed) {
            world.getIdentities().remove(creature);
        }
        return removed;
    }

    public Retention getRetention(Creature creature) {
        Retention r = alive.get(creature);
        return r != null ? r : dead.get(creature);
    }

    public List<Creature> getAlive() {
        return new ArrayList<>(alive.keySet());
    }

    public List<Creature> getDead() {
        return new ArrayList<>(dead.keySet());
    }

    /**
     * @return snapshot of every tracked creature, alive first
     */
    public List<Creature> allAliveOrDead() {
        List<Creature> all = new ArrayList<>(alive.keySet());
        all.addAll(dead.keySet());
        return all;
    }

    /**
     * The mutable set of creatures that garbage collection must keep regardless of retention.
     *
     * @return the forced-retention set
     */
    public Set<Creature> getForcedRetention() {
        return forcedRetention;
    }

    public int size() {
        return alive.size() + dead.size();
    }

    /**
     * Removes discardable dead creatures that are neither force-retained nor referenced by a
     * corpse spawned in some region (directly or inside a container).
     *
     * @return number of collected creatures
     */
    public int collectGarbage() {
        Set<Creature> referenced = new HashSet<>();
        for (Region region : world.getRegions()) {
            for (Entity entity : region.getEntities()) {
                collectCorpseReferences(entity, referenced);
            }
        }
        List<Creature> collected = new ArrayList<>();
        for (Map.Entry<Creature, Retention> entry : dead.entrySet()) {
            Creature c = entry.getKey();
            if (entry.getValue() == Retention.DISCARDABLE && !forcedRetention.contains(c) && !referenced.contains(c)) {
                collected.add(c);
            }
        }
        collected.forEach(this::remove);
        return collected.size();
    }

    private static void collectCorpseReferences(Entity entity, Set<Creature> out) {
        if (entity instanceof Corpse) {
            Creature inner = ((Corpse) entity).getInnerCreature();
            if (inner != null) {
                out.add(inner);
            }
        } else if (entity instanceof Container) {
            for (Entity held : ((Container) entity).getContents()) {
                collectCorpseReferences(held, out);
            }
        }
    }
}
