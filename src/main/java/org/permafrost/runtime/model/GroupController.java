package org.permafrost.runtime.model;

import org.permafrost.runtime.spi.IPostLoadInit;
import org.permafrost.runtime.spi.IReferenceable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * AI coordination object that owns a set of creatures as a unit (a squad, a cluster).
 */
public class GroupController implements IReferenceable, IPostLoadInit {

    private final long id;
    private final String label;
    private final List<Creature> ownedCreatures = new ArrayList<>();
    private GroupManager manager;
    private int droppedReferences;

    /**
     * @param id Unique group id.
     * @param label Descriptive label (e.g. "assault", "defend-cluster").
     */
    public GroupController(long id, String label) {
        this.id = id;
        this.label = label;
    }

    public long getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return the live list of owned creatures
     */
    public List<Creature> getOwnedCreatures() {
        return ownedCreatures;
    }

    public void addOwned(Creature creature) {
        ownedCreatures.add(creature);
    }

    public boolean owns(Entity entity) {
        return ownedCreatures.contains(entity);
    }

    public GroupManager getManager() {
        return manager;
    }

    public void setManager(GroupManager manager) {
        this.manager = manager;
    }

    /**
     * @return the region of the attached manager, or null
     */
    public Region getRegion() {
        return manager != null ? manager.getRegion() : null;
    }

    /**
     * @return number of owned-creature references that resolved to nothing on the last load
     */
    public int getDroppedReferences() {
        return droppedReferences;
    }

    /**
     * Requires the manager back-reference; drops owned references that did not resolve.
     */
    @Override
    public void postLoadInit() {
        if (manager == null) {
            throw new IllegalStateException("Group " + getUniqueLoadId() + " has no group manager at post-load init");
        }
        int before = ownedCreatures.size();
        ownedCreatures.removeIf(Objects::isNull);
        droppedReferences = before - ownedCreatures.size();
    }

    @Override
    public String getUniqueLoadId() {
        return "Group_" + id;
    }

    @Override
    public String toString() {
        return "GroupController{" + label + "#" + id + ", owned=" + ownedCreatures.size() + "}";
    }
}
