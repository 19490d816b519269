package org.permafrost.archive;

import org.permafrost.runtime.model.Container;
import org.permafrost.runtime.model.Creature;
import org.permafrost.runtime.model.Entity;
import org.permafrost.runtime.model.WorldRegistry;

import java.util.Collection;
import java.util.Set;

/**
 * Decides which live entities belong in a region archive. The same predicate selects what is
 * written on save and what is wiped before restoring, so both sides always agree.
 */
public final class EligibilityClassifier {

    public static final String DEFAULT_EXCLUDED_DEF = "VoidMonolith";

    private final Set<String> excludedDefNames;

    /**
     * @param excludedDefNames Definitions that regenerate with the region and are never archived.
     */
    public EligibilityClassifier(Collection<String> excludedDefNames) {
        this.excludedDefNames = Set.copyOf(excludedDefNames);
    }

    public EligibilityClassifier() {
        this(Set.of(DEFAULT_EXCLUDED_DEF));
    }

    /**
     * @param entity Any entity.
     * @return true if the entity is archived with its region
     */
    public boolean shouldPersist(Entity entity) {
        if (entity.isDestroyed() || !entity.isSpawned()) {
            return false;
        }
        WorldRegistry worldRegistry = entity.getRegion().getWorld().getWorldRegistry();
        if (entity instanceof Creature) {
            Creature creature = (Creature) entity;
            // world-tracked creatures would collide with the world copy on restore
            if (creature.isHumanlike() || worldRegistry.isTracked(creature)) {
                return false;
            }
        }
        if (entity instanceof Container) {
            for (Entity held : ((Container) entity).getContents()) {
                if (held instanceof Creature && worldRegistry.isTracked((Creature) held)) {
                    return false;
                }
            }
        }
        switch (entity.getCategory()) {
            case BLUEPRINT:
            case FRAME:
            case MOTE:
            case ETHEREAL:
            case PROJECTILE:
            case FALLING:
                return false;
            default:
                break;
        }
        return !excludedDefNames.contains(entity.getDefName());
    }

    public Set<String> getExcludedDefNames() {
        return excludedDefNames;
    }
}
