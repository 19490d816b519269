package org.permafrost.runtime.model;

import org.permafrost.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A bounded rectangular simulation area: the entities placed in it plus its per-cell
 * layers (terrain, roof, snow, pollution, fog).
 * <p>
 * Cells are addressed row-major: {@code index = z * width + x}.
 * </p>
 */
public class Region {

    private static final Logger LOG = LoggerFactory.getLogger(Region.class);

    public static final int ROOF_NONE = 0;
    public static final int ROOF_CONSTRUCTED = 1;
    public static final int ROOF_ROCK_THIN = 2;
    public static final int ROOF_ROCK_THICK = 3;

    /** Constructed roofs need a supporting structure within this distance. */
    public static final int ROOF_SUPPORT_RADIUS = 6;

    private final World world;
    private final int id;
    private final int tileId;
    private final int width;
    private final int height;

    private final List<Entity> entities = new ArrayList<>();
    private final TerrainDef[] terrain;
    private final TerrainDef[] underTerrain;
    private final int[] roof;
    private final int[] snow;
    private final boolean[] fog;
    private final boolean[] pollution;

    private final GroupManager groupManager = new GroupManager(this);
    private final List<RegionComponent> components = new ArrayList<>();
    private final Deque<Cell> collapseQueue = new ArrayDeque<>();

    private boolean restoring;
    private int revealNotifications;
    private int collapseChecks;

    /**
     * Creates a freshly generated region: soil everywhere, no roofs, no snow, no fog.
     *
     * @param world Owning world.
     * @param id Region id.
     * @param tileId World-map tile the region sits on.
     * @param width Number of columns.
     * @param height Number of rows.
     * @param pollutionActive Whether the optional pollution layer exists.
     */
    Region(World world, int id, int tileId, int width, int height, boolean pollutionActive) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Region size must be positive: " + width + "x" + height);
        }
        this.world = world;
        this.id = id;
        this.tileId = tileId;
        this.width = width;
        this.height = height;
        int size = width * height;
        this.terrain = new TerrainDef[size];
        Arrays.fill(this.terrain, TerrainCatalog.SOIL);
        this.underTerrain = new TerrainDef[size];
        this.roof = new int[size];
        this.snow = new int[size];
        this.fog = new boolean[size];
        this.pollution = pollutionActive ? new boolean[size] : null;
    }

    public World getWorld() {
        return world;
    }

    public int getId() {
        return id;
    }

    public int getTileId() {
        return tileId;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int cellCount() {
        return width * height;
    }

    public boolean inBounds(Cell cell) {
        return cell.x() >= 0 && cell.x() < width && cell.z() >= 0 && cell.z() < height;
    }

    /**
     * @param cell An in-bounds cell.
     * @return its row-major index
     */
    public int indexOf(Cell cell) {
        if (!inBounds(cell)) {
            throw new IllegalArgumentException("Cell " + cell + " outside region " + id + " (" + width + "x" + height + ")");
        }
        return cell.z() * width + cell.x();
    }

    /**
     * @param index Row-major index.
     * @return the cell at that index
     */
    public Cell cellAt(int index) {
        return new Cell(index % width, index / width);
    }

    /**
     * Visits every cell in row-major order.
     *
     * @param action Cell consumer.
     */
    public void forEachCell(Consumer<Cell> action) {
        for (int z = 0; z < height; z++) {
            for (int x = 0; x < width; x++) {
                action.accept(new Cell(x, z));
            }
        }
    }

    // ---------------------------------------------------------------------
    // Entities
    // ---------------------------------------------------------------------

    /**
     * @return read-only view of spawned entities in spawn order
     */
    public List<Entity> getEntities() {
        return Collections.unmodifiableList(entities);
    }

    /**
     * @return a copy of the spawned entity list, safe to iterate while entities move
     */
    public List<Entity> snapshotEntities() {
        return new ArrayList<>(entities);
    }

    public List<Entity> entitiesAt(Cell cell) {
        List<Entity> result = new ArrayList<>();
        for (Entity e : entities) {
            if (e.getPosition().equals(cell)) {
                result.add(e);
            }
        }
        return result;
    }

    /**
     * @param cell Cell to search.
     * @param type Entity subtype.
     * @return the first spawned entity of that type at the cell
     */
    public <T extends Entity> Optional<T> firstAt(Cell cell, Class<T> type) {
        for (Entity e : entities) {
            if (type.isInstance(e) && e.getPosition().equals(cell)) {
                return Optional.of(type.cast(e));
            }
        }
        return Optional.empty();
    }

    /**
     * Places an entity into this region and registers its identity with the world.
     *
     * @param entity The unspawned entity.
     * @param cell Target cell.
     * @param rotation Facing.
     * @throws IllegalArgumentException if the entity is destroyed, already spawned or the cell is out of bounds
     * @throws org.permafrost.runtime.spi.IdentityCollisionException if another live object owns the entity's id
     */
    public void spawn(Entity entity, Cell cell, Rotation rotation) {
        if (entity.isDestroyed()) {
            throw new IllegalArgumentException("Cannot spawn destroyed entity " + entity);
        }
        if (entity.isSpawned()) {
            throw new IllegalArgumentException("Entity " + entity + " is already spawned in region " + entity.getRegion().getId());
        }
        if (!inBounds(cell)) {
            throw new IllegalArgumentException("Cannot spawn " + entity + " outside region bounds at " + cell);
        }
        world.getIdentities().register(entity);
        entity.setPosition(cell);
        entity.setRotation(rotation != null ? rotation : Rotation.NORTH);
        entity.setRegion(this);
        entities.add(entity);
    }

    /**
     * Removes an entity from this region without destroying it.
     *
     * @param entity The entity.
     * @return true if it was spawned here
     */
    public boolean despawn(Entity entity) {
        if (entity.getRegion() != this) {
            return false;
        }
        entities.remove(entity);
        world.getIdentities().remove(entity);
        entity.setRegion(null);
        return true;
    }

    /**
     * @param cell The cell.
     * @return true if in bounds and not blocked by an impassable entity
     */
    public boolean isStandable(Cell cell) {
        if (!inBounds(cell)) {
            return false;
        }
        for (Entity e : entities) {
            if (e.blocksMovement() && e.getPosition().equals(cell)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Picks a random standable cell within {@code radius} of {@code center}.
     *
     * @param center Search centre; may be out of bounds.
     * @param radius Search radius in cells.
     * @param random Random source.
     * @return a cell, or empty if none is standable
     */
    public Optional<Cell> findStandableCellNear(Cell center, int radius, IRandomProvider random) {
        List<Cell> candidates = new ArrayList<>();
        for (int dz = -radius; dz <= radius; dz++) {
            for (int dx = -radius; dx <= radius; dx++) {
                Cell c = center.offset(dx, dz);
                if (center.distanceTo(c) <= radius && isStandable(c)) {
                    candidates.add(c);
                }
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(random.pick(candidates));
    }

    /**
     * @param random Random source.
     * @return a random standable cell anywhere in the region, or empty if none exists
     */
    public Optional<Cell> randomStandableCell(IRandomProvider random) {
        List<Cell> candidates = new ArrayList<>();
        forEachCell(c -> {
            if (isStandable(c)) {
                candidates.add(c);
            }
        });
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(random.pick(candidates));
    }

    public GroupManager getGroupManager() {
        return groupManager;
    }

    public List<RegionComponent> getComponents() {
        return Collections.unmodifiableList(components);
    }

    public void addComponent(RegionComponent component) {
        components.add(component);
    }

    // ---------------------------------------------------------------------
    // Terrain
    // ---------------------------------------------------------------------

    public TerrainDef getTerrain(Cell cell) {
        return terrain[indexOf(cell)];
    }

    /**
     * Sets the terrain of a cell. Laying a constructed floor over natural terrain remembers
     * the natural terrain underneath so the floor can later be removed.
     *
     * @param cell The cell.
     * @param def The new terrain.
     */
    public void setTerrain(Cell cell, TerrainDef def) {
        int i = indexOf(cell);
        TerrainDef current = terrain[i];
        if (def.constructedFloor()) {
            if (!current.constructedFloor()) {
                underTerrain[i] = current;
            }
        } else {
            underTerrain[i] = null;
        }
        terrain[i] = def;
    }

    public boolean hasConstructedFloor(Cell cell) {
        return terrain[indexOf(cell)].constructedFloor();
    }

    /**
     * Removes a constructed floor, exposing the terrain beneath (soil if unknown).
     *
     * @param cell The cell.
     * @return true if a floor was removed
     */
    public boolean removeFloor(Cell cell) {
        int i = indexOf(cell);
        if (!terrain[i].constructedFloor()) {
            return false;
        }
        terrain[i] = underTerrain[i] != null ? underTerrain[i] : TerrainCatalog.SOIL;
        underTerrain[i] = null;
        return true;
    }

    // ---------------------------------------------------------------------
    // Roof and structural support
    // ---------------------------------------------------------------------

    public int getRoof(Cell cell) {
        return roof[indexOf(cell)];
    }

    public boolean isRoofed(Cell cell) {
        return roof[indexOf(cell)] != ROOF_NONE;
    }

    public void setRoof(Cell cell, int roofId) {
        roof[indexOf(cell)] = roofId;
    }

    /**
     * Re-evaluates support of every constructed roof cell. Unsupported cells are queued for collapse.
     *
     * @return number of unsupported roof cells
     */
    public int recomputeStructuralSupport() {
        int unsupported = 0;
        for (int i = 0; i < roof.length; i++) {
            if (roof[i] == ROOF_CONSTRUCTED) {
                Cell c = cellAt(i);
                if (!isSupported(c)) {
                    collapseQueue.add(c);
                    unsupported++;
                }
            }
        }
        return unsupported;
    }

    private boolean isSupported(Cell cell) {
        for (Entity e : entities) {
            if (e.getCategory() == EntityCategory.BUILDING && e.blocksMovement()
                    && e.getPosition().distanceTo(cell) <= ROOF_SUPPORT_RADIUS) {
                return true;
            }
        }
        return false;
    }

    /**
     * Proactive collapse check triggered when a structure disappears. Suppressed while restoring.
     */
    void notifyStructureRemoved(Cell cell) {
        if (restoring) {
            return;
        }
        collapseChecks++;
        for (int dz = -ROOF_SUPPORT_RADIUS; dz <= ROOF_SUPPORT_RADIUS; dz++) {
            for (int dx = -ROOF_SUPPORT_RADIUS; dx <= ROOF_SUPPORT_RADIUS; dx++) {
                Cell c = cell.offset(dx, dz);
                if (inBounds(c) && roof[indexOf(c)] == ROOF_CONSTRUCTED && !isSupported(c) && !collapseQueue.contains(c)) {
                    collapseQueue.add(c);
                }
            }
        }
    }

    public List<Cell> getCollapseQueue() {
        return new ArrayList<>(collapseQueue);
    }

    public void clearCollapseQueue() {
        collapseQueue.clear();
    }

    /**
     * @return how many proactive collapse checks ran since creation
     */
    public int getCollapseCheckCount() {
        return collapseChecks;
    }

    // ---------------------------------------------------------------------
    // Snow, pollution, fog
    // ---------------------------------------------------------------------

    public int getSnowDepth(Cell cell) {
        return snow[indexOf(cell)];
    }

    public void setSnowDepth(Cell cell, int depth) {
        snow[indexOf(cell)] = Math.max(0, Math.min(255, depth));
    }

    public boolean isPollutionActive() {
        return pollution != null;
    }

    public boolean isPolluted(Cell cell) {
        return pollution != null && pollution[indexOf(cell)];
    }

    public void setPolluted(Cell cell, boolean polluted) {
        if (pollution == null) {
            LOG.debug("Ignoring pollution update on region {} without pollution layer", id);
            return;
        }
        pollution[indexOf(cell)] = polluted;
    }

    public boolean isFogged(Cell cell) {
        return fog[indexOf(cell)];
    }

    /**
     * Covers the whole region in fog.
     */
    public void refogAll() {
        Arrays.fill(fog, true);
    }

    public void setFogged(Cell cell, boolean fogged) {
        fog[indexOf(cell)] = fogged;
    }

    /**
     * Reveals a cell. Revealing a fogged cell raises a notification unless restoring.
     *
     * @param cell The cell.
     */
    public void unfog(Cell cell) {
        int i = indexOf(cell);
        if (!fog[i]) {
            return;
        }
        fog[i] = false;
        if (!restoring) {
            revealNotifications++;
        }
    }

    /**
     * @return how many "newly revealed area" notifications were raised
     */
    public int getRevealNotificationCount() {
        return revealNotifications;
    }

    // ---------------------------------------------------------------------
    // Restoration flag
    // ---------------------------------------------------------------------

    public boolean isRestoring() {
        return restoring;
    }

    /**
     * While set, proactive collapse checks and reveal notifications are suppressed.
     *
     * @param restoring The new flag value.
     */
    public void setRestoring(boolean restoring) {
        this.restoring = restoring;
    }

    @Override
    public String toString() {
        return "Region{" + id + ", tile=" + tileId + ", " + width + "x" + height + ", entities=" + entities.size() + "}";
    }
}
