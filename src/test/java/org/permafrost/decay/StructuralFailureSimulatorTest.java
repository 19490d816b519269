package org.permafrost.decay;

import org.permafrost.runtime.internal.services.SeededRandomProvider;
import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.model.Entity;
import org.permafrost.runtime.model.Material;
import org.permafrost.runtime.model.Region;
import org.permafrost.runtime.model.Rotation;
import org.permafrost.runtime.model.TerrainCatalog;
import org.permafrost.runtime.model.World;
import org.permafrost.testutils.WorldFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

@Tag("unit")
class StructuralFailureSimulatorTest {

    private static final long YEAR = DecaySettings.DEFAULT_TICKS_PER_YEAR;

    private final StructuralFailureSimulator simulator = new StructuralFailureSimulator();
    private World world;
    private Region region;

    @BeforeEach
    void setUp() {
        world = WorldFixtures.newWorld("failures");
        region = world.createRegion(1, WorldFixtures.TILE_TEMPERATE, 24, 24, false);
    }

    private DecayContext context(long elapsed, boolean freezeThaw) {
        return new DecayContext(region, 0L, elapsed, WorldFixtures.TILE_TEMPERATE, 1000.0, freezeThaw, DecaySettings.defaults());
    }

    private List<Entity> buildCompound() {
        List<Entity> walls = new ArrayList<>();
        for (int x = 2; x < 22; x += 2) {
            for (int z = 2; z < 22; z += 4) {
                Entity wall = WorldFixtures.wall(world, Material.WOOD, 300);
                region.spawn(wall, new Cell(x, z), Rotation.NORTH);
                walls.add(wall);
            }
        }
        region.forEachCell(c -> region.setTerrain(c, TerrainCatalog.STONE_TILE));
        return walls;
    }

    @Test
    void absurdlyLongAbandonmentStillYieldsTheCap() {
        int count = simulator.eventCount(context(Long.MAX_VALUE / 4, true), 0.0, new SeededRandomProvider(1));

        assertEquals(DecaySettings.defaults().getMaxFailureEvents(), count);
    }

    @Test
    void noEventsBeforeMinimumInterval() {
        buildCompound();

        assertEquals(0, simulator.eventCount(context(YEAR / 10, true), 0.0, new SeededRandomProvider(1)));
        assertSame(StructuralFailureSimulator.FailureReport.NONE,
            simulator.simulate(region, context(YEAR / 10, true), new SeededRandomProvider(1)));
    }

    @Test
    void eventCountIsCapped() {
        int count = simulator.eventCount(context(YEAR * 500, true), 0.0, new SeededRandomProvider(1));

        assertEquals(DecaySettings.defaults().getMaxFailureEvents(), count);
    }

    @Test
    void mtbfShrinksWithRainAndFreezeAndGrowsUnderRoof() {
        // 300 / (1 + 0.25)
        assertThat(simulator.adjustedMtbfDays(context(YEAR, false), 1.0)).isCloseTo(240.0, within(1e-9));
        assertThat(simulator.adjustedMtbfDays(context(YEAR, false), 0.0)).isCloseTo(120.0, within(1e-9));
        assertThat(simulator.adjustedMtbfDays(context(YEAR, true), 1.0)).isCloseTo(168.0, within(1e-9));
    }

    @Test
    void severitySaturates() {
        assertEquals(0.0, simulator.severity(context(0L, false)));
        assertThat(simulator.severity(context(YEAR * 5, false))).isCloseTo(1.0 - Math.exp(-1.0), within(1e-9));
        assertThat(simulator.severity(context(YEAR * 200, false))).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void falloffIsOneAtCenterAndZeroAtRadius() {
        assertEquals(1.0, StructuralFailureSimulator.falloff(0.0, 4.0, 1.8));
        assertEquals(0.0, StructuralFailureSimulator.falloff(4.0, 4.0, 1.8));
        assertEquals(0.0, StructuralFailureSimulator.falloff(9.0, 4.0, 1.8));
    }

    @Test
    void emptyRegionHasNoFailures() {
        assertSame(StructuralFailureSimulator.FailureReport.NONE,
            simulator.simulate(region, context(YEAR * 50, true), new SeededRandomProvider(1)));
    }

    @Test
    void longAbandonmentDamagesStructuresWithinCap() {
        List<Entity> walls = buildCompound();

        StructuralFailureSimulator.FailureReport report = simulator.simulate(region, context(YEAR * 50, true), new SeededRandomProvider(5));

        assertThat(report.events()).isBetween(1, DecaySettings.defaults().getMaxFailureEvents());
        assertThat(report.structuresDamaged()).isPositive().isLessThanOrEqualTo(walls.size());
        assertThat(report.structuresDestroyed()).isLessThanOrEqualTo(report.structuresDamaged());
        long damaged = walls.stream().filter(w -> w.isDestroyed() || w.getHitPoints() < 300).count();
        assertEquals(report.structuresDamaged(), damaged);
    }

    @Test
    void sameSeedSameOutcome() {
        buildCompound();
        StructuralFailureSimulator.FailureReport first = simulator.simulate(region, context(YEAR * 20, false), new SeededRandomProvider(77));

        setUp();
        buildCompound();
        StructuralFailureSimulator.FailureReport second = simulator.simulate(region, context(YEAR * 20, false), new SeededRandomProvider(77));

        assertEquals(first, second);
    }
}
