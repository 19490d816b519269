package org.permafrost.runtime.model;

/**
 * A living (or dead) creature: animal, mechanoid, insect or human-like agent.
 */
public class Creature extends Entity {

    private final boolean humanlike;
    private boolean dead;
    private String currentTask;
    private String duty;

    /**
     * @param id Unique entity id.
     * @param defName Race definition name.
     * @param humanlike True for human-like agents.
     */
    public Creature(long id, String defName, boolean humanlike) {
        super(id, defName, EntityCategory.CREATURE);
        this.humanlike = humanlike;
    }

    public boolean isHumanlike() {
        return humanlike;
    }

    public boolean isDead() {
        return dead;
    }

    public void setDead(boolean dead) {
        this.dead = dead;
    }

    public String getCurrentTask() {
        return currentTask;
    }

    public void setCurrentTask(String currentTask) {
        this.currentTask = currentTask;
    }

    public String getDuty() {
        return duty;
    }

    public void setDuty(String duty) {
        this.duty = duty;
    }

    /**
     * Stops the current task and clears the group duty.
     */
    public void clearTasks() {
        this.currentTask = null;
        this.duty = null;
    }
}
