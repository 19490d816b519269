package org.permafrost.testutils;

import org.permafrost.archive.EligibilityClassifier;
import org.permafrost.archive.RegionArchiver;
import org.permafrost.archive.storage.ArchiveStore;
import org.permafrost.decay.DecayEngine;
import org.permafrost.decay.DecaySettings;
import org.permafrost.runtime.internal.services.RowMajorGridCodec;
import org.permafrost.runtime.internal.services.SeasonalClimateModel;
import org.permafrost.runtime.internal.services.SeededRandomProvider;
import org.permafrost.runtime.model.Container;
import org.permafrost.runtime.model.Creature;
import org.permafrost.runtime.model.Entity;
import org.permafrost.runtime.model.EntityCategory;
import org.permafrost.runtime.model.Faction;
import org.permafrost.runtime.model.ManualTickClock;
import org.permafrost.runtime.model.Material;
import org.permafrost.runtime.model.World;
import org.permafrost.utils.compression.ICompressionCodec;
import org.permafrost.utils.compression.NoneCodec;

import java.nio.file.Path;

/**
 * Builders for worlds, entities and archivers used across tests.
 */
public final class WorldFixtures {

    public static final int TILE_TEMPERATE = 1;
    public static final int TILE_FROZEN = 2;

    private WorldFixtures() {
    }

    /**
     * A world at tick 0 with a player faction (id 1) and a hostile faction (id 2).
     */
    public static World newWorld(String worldId) {
        World world = new World(worldId, new ManualTickClock());
        world.addFaction(new Faction(1, "Colony", true));
        world.addFaction(new Faction(2, "Raiders", false));
        return world;
    }

    public static Faction player(World world) {
        return world.getPlayerFaction();
    }

    public static Faction hostile(World world) {
        return world.getFactions().stream().filter(f -> !f.isPlayer()).findFirst().orElseThrow();
    }

    public static Entity item(World world, String def, int hitPoints) {
        Entity item = new Entity(world.nextEntityId(), def, EntityCategory.ITEM);
        item.setMaxHitPoints(hitPoints);
        item.setHitPoints(hitPoints);
        return item;
    }

    public static Entity food(World world, double rotThreshold) {
        Entity food = item(world, "MealSimple", 50);
        food.setIngestible(true);
        food.setRotThreshold(rotThreshold);
        return food;
    }

    public static Entity wall(World world, Material material, int hitPoints) {
        Entity wall = new Entity(world.nextEntityId(), "Wall", EntityCategory.BUILDING);
        wall.setMaterial(material);
        wall.setMaxHitPoints(hitPoints);
        wall.setHitPoints(hitPoints);
        wall.setBlocksMovement(true);
        return wall;
    }

    public static Container bed(World world) {
        Container bed = new Container(world.nextEntityId(), "Bed", 1);
        bed.setMaterial(Material.WOOD);
        bed.setMaxHitPoints(140);
        bed.setHitPoints(140);
        return bed;
    }

    public static Creature animal(World world, String def) {
        Creature creature = new Creature(world.nextEntityId(), def, false);
        creature.setMaxHitPoints(80);
        creature.setHitPoints(80);
        return creature;
    }

    public static Creature colonist(World world) {
        Creature colonist = new Creature(world.nextEntityId(), "Human", true);
        colonist.setFaction(player(world));
        colonist.setMaxHitPoints(100);
        colonist.setHitPoints(100);
        return colonist;
    }

    /**
     * Temperate default tile (10 °C mean, 1000 mm) and a frozen tile that never thaws.
     */
    public static SeasonalClimateModel climate() {
        return new SeasonalClimateModel(10.0, 12.0, 4.0, 1000.0,
            DecaySettings.DEFAULT_TICKS_PER_YEAR, DecaySettings.DEFAULT_TICKS_PER_DAY)
            .withTile(TILE_FROZEN, 300.0, -40.0);
    }

    public static RegionArchiver archiver(Path root) {
        return archiver(root, new NoneCodec(), 42L);
    }

    public static RegionArchiver archiver(Path root, ICompressionCodec codec, long seed) {
        return new RegionArchiver(
            new ArchiveStore(root, codec),
            new RowMajorGridCodec(),
            new EligibilityClassifier(),
            new DecayEngine(climate(), DecaySettings.defaults()),
            new SeededRandomProvider(seed));
    }
}
