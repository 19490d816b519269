package org.permafrost.runtime.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Registry of known terrain definitions keyed by their grid id.
 */
public final class TerrainCatalog {

    public static final TerrainDef SOIL = new TerrainDef(1, "Soil", false);
    public static final TerrainDef GRAVEL = new TerrainDef(2, "Gravel", false);
    public static final TerrainDef SAND = new TerrainDef(3, "Sand", false);
    public static final TerrainDef MARSH = new TerrainDef(4, "Marsh", false);
    public static final TerrainDef WOOD_FLOOR = new TerrainDef(20, "WoodPlankFloor", true);
    public static final TerrainDef STONE_TILE = new TerrainDef(21, "TileGranite", true);
    public static final TerrainDef CONCRETE = new TerrainDef(22, "Concrete", true);

    private static final Map<Integer, TerrainDef> registry = new HashMap<>();

    static {
        register(SOIL);
        register(GRAVEL);
        register(SAND);
        register(MARSH);
        register(WOOD_FLOOR);
        register(STONE_TILE);
        register(CONCRETE);
    }

    private TerrainCatalog() {}

    /**
     * Registers a terrain definition.
     * @param def The definition; replaces any existing one with the same id.
     */
    public static void register(TerrainDef def) {
        registry.put(def.id(), def);
    }

    /**
     * @param id Grid id.
     * @return the definition, or null if unknown
     */
    public static TerrainDef byId(int id) {
        return registry.get(id);
    }
}
