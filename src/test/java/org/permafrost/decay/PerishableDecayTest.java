package org.permafrost.decay;

import org.permafrost.junit.extensions.logging.LogWatchExtension;
import org.permafrost.runtime.model.Entity;
import org.permafrost.runtime.model.Region;
import org.permafrost.runtime.model.World;
import org.permafrost.runtime.spi.IClimateSampler;
import org.permafrost.testutils.WorldFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class PerishableDecayTest {

    @Mock
    private IClimateSampler climate;

    private World world;
    private Region region;
    private PerishableDecay decay;

    @BeforeEach
    void setUp() {
        world = WorldFixtures.newWorld("rot");
        region = world.createRegion(1, WorldFixtures.TILE_TEMPERATE, 4, 4, false);
        lenient().when(climate.seasonalTemperature(anyLong(), anyInt())).thenReturn(20.0);
        lenient().when(climate.diurnalOffset(anyLong(), anyInt())).thenReturn(0.0);
        decay = new PerishableDecay(climate);
    }

    private DecayContext context(long start, long elapsed) {
        return new DecayContext(region, start, elapsed, WorldFixtures.TILE_TEMPERATE, 1000.0, false, DecaySettings.defaults());
    }

    @Test
    void reportsTheExactTickTheThresholdIsCrossed() {
        when(climate.rotRateAtTemperature(anyDouble())).thenReturn(1.0);
        Entity meal = WorldFixtures.food(world, 3000.0);

        RotOutcome outcome = decay.simulate(meal, context(0L, 5000L));

        assertTrue(outcome.spoiled());
        assertEquals(3000L, outcome.spoiledAtTick());
        assertEquals(3000.0, outcome.rotProgress(), 1e-9);
    }

    @Test
    void crossingTickIsAbsolute() {
        when(climate.rotRateAtTemperature(anyDouble())).thenReturn(1.0);
        Entity meal = WorldFixtures.food(world, 3000.0);

        RotOutcome outcome = decay.simulate(meal, context(1_000_000L, 5000L));

        assertEquals(1_003_000L, outcome.spoiledAtTick());
    }

    @Test
    void accumulatesRotBelowThreshold() {
        when(climate.rotRateAtTemperature(anyDouble())).thenReturn(0.5);
        Entity meal = WorldFixtures.food(world, 10_000.0);
        meal.setRotProgress(100.0);

        RotOutcome outcome = decay.apply(meal, context(0L, 5000L));

        assertFalse(outcome.spoiled());
        assertEquals(-1L, outcome.spoiledAtTick());
        assertEquals(2600.0, meal.getRotProgress(), 1e-9);
        assertFalse(meal.isDestroyed());
    }

    @Test
    void frozenFoodNeverSpoils() {
        when(climate.rotRateAtTemperature(anyDouble())).thenReturn(0.0);
        Entity meal = WorldFixtures.food(world, 1.0);

        RotOutcome outcome = decay.apply(meal, context(0L, DecaySettings.DEFAULT_TICKS_PER_YEAR * 100));

        assertFalse(outcome.spoiled());
        assertThat(meal.getRotProgress()).isZero();
    }

    @Test
    void alreadyRottenIsSpoiledAtStart() {
        Entity meal = WorldFixtures.food(world, 500.0);
        meal.setRotProgress(500.0);

        RotOutcome outcome = decay.apply(meal, context(42L, 10L));

        assertTrue(outcome.spoiled());
        assertEquals(42L, outcome.spoiledAtTick());
        assertTrue(meal.isDestroyed());
    }

    @Test
    void zeroElapsedLeavesProgressUnchanged() {
        Entity meal = WorldFixtures.food(world, 500.0);
        meal.setRotProgress(120.0);

        RotOutcome outcome = decay.apply(meal, context(0L, 0L));

        assertFalse(outcome.spoiled());
        assertEquals(120.0, meal.getRotProgress(), 1e-9);
    }
}
