package org.permafrost.runtime.model;

/**
 * Remains of a dead creature. The inner creature is owned by the world registry's dead store;
 * the corpse only references it.
 */
public class Corpse extends Entity {

    private Creature innerCreature;

    /**
     * @param id Unique entity id.
     * @param defName Definition name.
     */
    public Corpse(long id, String defName) {
        super(id, defName, EntityCategory.CORPSE);
    }

    public Creature getInnerCreature() {
        return innerCreature;
    }

    public void setInnerCreature(Creature innerCreature) {
        this.innerCreature = innerCreature;
    }
}
