package org.permafrost.runtime.model;

import org.permafrost.runtime.internal.services.IdentityRegistry;
import org.permafrost.runtime.spi.IIdentityRegistry;
import org.permafrost.world.RegionSideTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The long-lived world: factions, the world registry, the live regions and the
 * per-region side table. Owns the identity registry that every live object is registered in.
 */
public class World {

    private final String worldId;
    private final ManualTickClock clock;
    private final IIdentityRegistry identities;
    private final WorldRegistry worldRegistry;
    private final RegionSideTable sideTable = new RegionSideTable();
    private final List<Faction> factions = new ArrayList<>();
    private final Map<Integer, Region> regions = new LinkedHashMap<>();
    private long nextEntityId = 1;

    /**
     * @param worldId Persistent id of this world; names the archive folder.
     * @param clock Simulation clock.
     */
    public World(String worldId, ManualTickClock clock) {
        this(worldId, clock, new IdentityRegistry("world " + worldId));
    }

    /**
     * @param worldId Persistent id of this world.
     * @param clock Simulation clock.
     * @param identities Identity registry for live objects.
     */
    public World(String worldId, ManualTickClock clock, IIdentityRegistry identities) {
        this.worldId = worldId;
        this.clock = clock;
        this.identities = identities;
        this.worldRegistry = new WorldRegistry(this);
    }

    public String getWorldId() {
        return worldId;
    }

    public ManualTickClock getClock() {
        return clock;
    }

    public IIdentityRegistry getIdentities() {
        return identities;
    }

    public WorldRegistry getWorldRegistry() {
        return worldRegistry;
    }

    public RegionSideTable getSideTable() {
        return sideTable;
    }

    /**
     * @return a fresh entity id
     */
    public long nextEntityId() {
        return nextEntityId++;
    }

    public long peekNextEntityId() {
        return nextEntityId;
    }

    public void setNextEntityId(long nextEntityId) {
        this.nextEntityId = nextEntityId;
    }

    // ---------------------------------------------------------------------
    // Factions
    // ---------------------------------------------------------------------

    public void addFaction(Faction faction) {
        identities.register(faction);
        factions.add(faction);
    }

    public List<Faction> getFactions() {
        return Collections.unmodifiableList(factions);
    }

    /**
     * @return the player faction, or null if none exists
     */
    public Faction getPlayerFaction() {
        for (Faction f : factions) {
            if (f.isPlayer()) {
                return f;
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // Regions
    // ---------------------------------------------------------------------

    /**
     * Generates a fresh region and makes it live.
     *
     * @param id Region id.
     * @param tileId World-map tile.
     * @param width Columns.
     * @param height Rows.
     * @param pollutionActive Whether the pollution layer exists.
     * @return the new region
     */
    public Region createRegion(int id, int tileId, int width, int height, boolean pollutionActive) {
        if (regions.containsKey(id)) {
            throw new IllegalStateException("Region " + id + " is already live");
        }
        Region region = new Region(this, id, tileId, width, height, pollutionActive);
        regions.put(id, region);
        return region;
    }

    public Optional<Region> getRegion(int id) {
        return Optional.ofNullable(regions.get(id));
    }

    public List<Region> getRegions() {
        return new ArrayList<>(regions.values());
    }

    /**
     * Tears a region down the way the host does on deactivation: creatures still spawned are
     * killed into the world registry's dead store, everything else is discarded.
     *
     * @param region The live region.
     */
    public void removeRegion(Region region) {
        for (Entity entity : region.snapshotEntities()) {
            region.despawn(entity);
            if (entity instanceof Creature) {
                Creature creature = (Creature) entity;
                creature.setDead(true);
                worldRegistry.passToWorld(creature, Retention.DISCARDABLE);
            }
        }
        for (GroupController controller : new ArrayList<>(region.getGroupManager().getControllers())) {
            region.getGroupManager().remove(controller);
        }
        regions.remove(region.getId());
    }
}
