package org.permafrost.runtime.model;

import org.permafrost.runtime.spi.IReferenceable;

/**
 * A persisted simulated object: structure, item, plant, creature or corpse.
 * <p>
 * An entity is <em>spawned</em> while it is placed in a region. Its identity is its
 * numeric id; {@link #getUniqueLoadId()} derives the load id used by persistence sessions.
 * </p>
 */
public class Entity implements IReferenceable {

    private final long id;
    private final String defName;
    private final EntityCategory category;
    private Material material = Material.NONE;
    private Cell position = Cell.ORIGIN;
    private Rotation rotation = Rotation.NORTH;
    private int hitPoints;
    private int maxHitPoints;
    private Faction faction;
    private boolean naturalRock;
    private boolean blocksMovement;
    private boolean ingestible;
    private double rotProgress;
    private double rotThreshold;
    private boolean destroyed;
    private Region region;

    /**
     * Creates a new, unspawned entity.
     *
     * @param id Unique entity id.
     * @param defName Definition name (e.g. "Steel", "WoodWall").
     * @param category Coarse category.
     */
    public Entity(long id, String defName, EntityCategory category) {
        this.id = id;
        this.defName = defName;
        this.category = category;
    }

    public long getId() {
        return id;
    }

    public String getDefName() {
        return defName;
    }

    public EntityCategory getCategory() {
        return category;
    }

    public Material getMaterial() {
        return material;
    }

    public void setMaterial(Material material) {
        this.material = material != null ? material : Material.NONE;
    }

    public Cell getPosition() {
        return position;
    }

    /**
     * Sets the stored position without spawning. Only meaningful while unspawned.
     *
     * @param position The new position.
     */
    public void setPosition(Cell position) {
        this.position = position;
    }

    public Rotation getRotation() {
        return rotation;
    }

    public void setRotation(Rotation rotation) {
        this.rotation = rotation;
    }

    public int getHitPoints() {
        return hitPoints;
    }

    /**
     * Sets hit points, clamped to [0, maxHitPoints].
     *
     * @param hitPoints The new value.
     */
    public void setHitPoints(int hitPoints) {
        this.hitPoints = Math.max(0, Math.min(maxHitPoints, hitPoints));
    }

    public int getMaxHitPoints() {
        return maxHitPoints;
    }

    /**
     * Sets maximum and current hit points in one step.
     *
     * @param maxHitPoints The maximum; current hit points are reset to it.
     */
    public void setMaxHitPoints(int maxHitPoints) {
        this.maxHitPoints = Math.max(0, maxHitPoints);
        this.hitPoints = this.maxHitPoints;
    }

    public Faction getFaction() {
        return faction;
    }

    public void setFaction(Faction faction) {
        this.faction = faction;
    }

    /**
     * @return true if the entity belongs to the player's faction
     */
    public boolean isPlayerAffiliated() {
        return faction != null && faction.isPlayer();
    }

    public boolean isNaturalRock() {
        return naturalRock;
    }

    public void setNaturalRock(boolean naturalRock) {
        this.naturalRock = naturalRock;
    }

    public boolean blocksMovement() {
        return blocksMovement;
    }

    public void setBlocksMovement(boolean blocksMovement) {
        this.blocksMovement = blocksMovement;
    }

    public boolean isIngestible() {
        return ingestible;
    }

    public void setIngestible(boolean ingestible) {
        this.ingestible = ingestible;
    }

    public double getRotProgress() {
        return rotProgress;
    }

    public void setRotProgress(double rotProgress) {
        this.rotProgress = rotProgress;
    }

    /**
     * @return rot progress at which the entity is spoiled; 0 if it never rots
     */
    public double getRotThreshold() {
        return rotThreshold;
    }

    public void setRotThreshold(double rotThreshold) {
        this.rotThreshold = rotThreshold;
    }

    /**
     * @return true for food that rots away
     */
    public boolean isPerishable() {
        return ingestible && rotThreshold > 0;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public boolean isSpawned() {
        return region != null;
    }

    /**
     * @return the region this entity is placed in, or null when unspawned
     */
    public Region getRegion() {
        return region;
    }

    void setRegion(Region region) {
        this.region = region;
    }

    /**
     * Destroys the entity without leaving remains. A spawned entity is removed from its region.
     */
    public void destroy() {
        if (destroyed) {
            return;
        }
        destroyed = true;
        Region current = region;
        if (current != null) {
            current.despawn(this);
            if (category == EntityCategory.BUILDING) {
                current.notifyStructureRemoved(position);
            }
        }
    }

    @Override
    public String getUniqueLoadId() {
        return "Thing_" + id;
    }

    @Override
    public String toString() {
        return defName + "#" + id;
    }
}
