package org.permafrost.decay;

import org.permafrost.runtime.internal.services.SeededRandomProvider;
import org.permafrost.runtime.model.Region;
import org.permafrost.runtime.model.TerrainCatalog;
import org.permafrost.runtime.model.World;
import org.permafrost.testutils.WorldFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class FloorErosionTest {

    private static final long YEAR = DecaySettings.DEFAULT_TICKS_PER_YEAR;

    private final FloorErosion erosion = new FloorErosion();
    private Region region;

    @BeforeEach
    void setUp() {
        World world = WorldFixtures.newWorld("floors");
        region = world.createRegion(1, WorldFixtures.TILE_TEMPERATE, 20, 20, false);
        region.forEachCell(c -> region.setTerrain(c, TerrainCatalog.WOOD_FLOOR));
    }

    private DecayContext context(long elapsed, boolean freezeThaw) {
        return new DecayContext(region, 0L, elapsed, WorldFixtures.TILE_TEMPERATE, 1000.0, freezeThaw, DecaySettings.defaults());
    }

    @Test
    void probabilityIsCumulativeOverYears() {
        // base 0.06, rain modifier 0.5 + 1.5 * 0.25
        double perYear = 0.06 * 0.875;

        assertThat(erosion.removalProbability(context(YEAR, false))).isCloseTo(perYear, within(1e-9));
        assertThat(erosion.removalProbability(context(YEAR * 2, false)))
            .isCloseTo(1.0 - Math.pow(1.0 - perYear, 2), within(1e-9));
        assertThat(erosion.removalProbability(context(YEAR, true))).isCloseTo(perYear * 1.5, within(1e-9));
        assertEquals(0.0, erosion.removalProbability(context(0L, false)));
    }

    @Test
    void probabilityConvergesToOne() {
        double previous = 0.0;
        for (int years = 1; years <= 200; years *= 2) {
            double p = erosion.removalProbability(context(YEAR * years, true));
            assertTrue(p > previous);
            previous = p;
        }
        assertThat(erosion.removalProbability(context(YEAR * 1000, true))).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void roofedFloorsAreKept() {
        region.forEachCell(c -> region.setRoof(c, Region.ROOF_CONSTRUCTED));

        int removed = erosion.apply(region, context(YEAR * 1000, true), new SeededRandomProvider(3));

        assertEquals(0, removed);
    }

    @Test
    void centuryRemovesAlmostAllUnroofedFloors() {
        int removed = erosion.apply(region, context(YEAR * 100, false), new SeededRandomProvider(3));

        assertThat(removed).isGreaterThan(380);
        region.forEachCell(c -> {
            if (!region.hasConstructedFloor(c)) {
                assertEquals(TerrainCatalog.SOIL, region.getTerrain(c));
            }
        });
    }

    @Test
    void sameSeedErodesSameCells() {
        int first = erosion.apply(region, context(YEAR * 5, false), new SeededRandomProvider(9));
        boolean[] kept = new boolean[region.cellCount()];
        for (int i = 0; i < kept.length; i++) {
            kept[i] = region.hasConstructedFloor(region.cellAt(i));
        }

        setUp();
        int second = erosion.apply(region, context(YEAR * 5, false), new SeededRandomProvider(9));

        assertEquals(first, second);
        for (int i = 0; i < kept.length; i++) {
            assertEquals(kept[i], region.hasConstructedFloor(region.cellAt(i)));
        }
    }
}
