package org.permafrost.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A structure holding other entities: sleep caskets, graves, sarcophagi.
 */
public class Container extends Entity {

    private final int capacity;
    private final List<Entity> contents = new ArrayList<>();

    /**
     * @param id Unique entity id.
     * @param defName Definition name.
     * @param capacity Maximum number of held entities.
     */
    public Container(long id, String defName, int capacity) {
        super(id, defName, EntityCategory.BUILDING);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }

    public List<Entity> getContents() {
        return Collections.unmodifiableList(contents);
    }

    /**
     * Tries to put an entity into this container.
     *
     * @param entity The entity; must not be spawned.
     * @return true if accepted
     */
    public boolean tryAccept(Entity entity) {
        if (isDestroyed() || entity.isSpawned() || contents.size() >= capacity || contents.contains(entity)) {
            return false;
        }
        contents.add(entity);
        return true;
    }

    /**
     * Removes an entity without side effects.
     *
     * @param entity The held entity.
     * @return true if it was held
     */
    public boolean remove(Entity entity) {
        return contents.remove(entity);
    }

    /**
     * Removes all contents without side effects.
     *
     * @return the removed entities
     */
    public List<Entity> drain() {
        List<Entity> removed = new ArrayList<>(contents);
        contents.clear();
        return removed;
    }

    /**
     * Destroys the container together with its contents. Held creatures are killed and
     * handed to the world registry's dead store, which is what the host does when a
     * container is destroyed with occupants still inside.
     */
    @Override
    public void destroy() {
        if (isDestroyed()) {
            return;
        }
        Region current = getRegion();
        for (Entity held : drain()) {
            if (held instanceof Creature && current != null) {
                Creature creature = (Creature) held;
                creature.setDead(true);
                current.getWorld().getWorldRegistry().passToWorld(creature, Retention.DISCARDABLE);
            } else {
                held.destroy();
            }
        }
        super.destroy();
    }
}
