package org.permafrost.runtime.model;

import org.permafrost.runtime.spi.IReferenceable;

/**
 * A long-lived world faction. Entities refer to it as their affiliation.
 */
public final class Faction implements IReferenceable {

    private final long id;
    private final String name;
    private final boolean player;

    /**
     * @param id Unique faction id.
     * @param name Display name.
     * @param player True for the player's own faction.
     */
    public Faction(long id, String name, boolean player) {
        this.id = id;
        this.name = name;
        this.player = player;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isPlayer() {
        return player;
    }

    @Override
    public String getUniqueLoadId() {
        return "Faction_" + id;
    }

    @Override
    public String toString() {
        return "Faction{" + name + "}";
    }
}
