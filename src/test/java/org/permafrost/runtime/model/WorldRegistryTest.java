package org.permafrost.runtime.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.permafrost.testutils.WorldFixtures.TILE_TEMPERATE;
import static org.permafrost.testutils.WorldFixtures.animal;
import static org.permafrost.testutils.WorldFixtures.bed;
import static org.permafrost.testutils.WorldFixtures.colonist;
import static org.permafrost.testutils.WorldFixtures.newWorld;

@Tag("unit")
class WorldRegistryTest {

    private World world;
    private WorldRegistry registry;

    @BeforeEach
    void setUp() {
        world = newWorld("registry");
        registry = world.getWorldRegistry();
    }

    @Test
    void aliveAndDeadAreTrackedSeparately() {
        Creature traveller = colonist(world);
        Creature fallen = animal(world, "Boar");
        fallen.setDead(true);

        registry.passToWorld(traveller, Retention.KEEP_FOREVER);
        registry.passToWorld(fallen, Retention.DISCARDABLE);

        assertEquals(WorldSituation.ALIVE, registry.getSituation(traveller));
        assertEquals(WorldSituation.DEAD, registry.getSituation(fallen));
        assertThat(registry.allAliveOrDead()).containsExactly(traveller, fallen);
        assertTrue(world.getIdentities().contains(traveller.getUniqueLoadId()));
    }

    @Test
    void repeatedPassUpdatesWithoutExtraRegistration() {
        Creature traveller = colonist(world);
        registry.passToWorld(traveller, Retention.DISCARDABLE);
        registry.passToWorld(traveller, Retention.KEEP_FOREVER);

        assertEquals(Retention.KEEP_FOREVER, registry.getRetention(traveller));
        assertEquals(1, registry.size());

        assertTrue(registry.remove(traveller));
        assertFalse(registry.remove(traveller));
        assertFalse(world.getIdentities().contains(traveller.getUniqueLoadId()));
        assertEquals(WorldSituation.NONE, registry.getSituation(traveller));
    }

    @Test
    void garbageCollectionKeepsReferencedAndRetainedDead() {
        Region region = world.createRegion(1, TILE_TEMPERATE, 4, 4, false);
        Creature pinned = dead("Boar");
        Creature buried = dead("Human");
        Creature remembered = dead("Thrumbo");
        Creature forgotten = dead("Hare");
        registry.passToWorld(pinned, Retention.DISCARDABLE);
        registry.passToWorld(buried, Retention.DISCARDABLE);
        registry.passToWorld(remembered, Retention.KEEP_FOREVER);
        registry.passToWorld(forgotten, Retention.DISCARDABLE);
        registry.getForcedRetention().add(pinned);

        Corpse corpse = new Corpse(world.nextEntityId(), "Corpse_Human");
        corpse.setInnerCreature(buried);
        Container grave = bed(world);
        grave.tryAccept(corpse);
        region.spawn(grave, Cell.ORIGIN, Rotation.NORTH);

        assertEquals(1, registry.collectGarbage());
        assertThat(registry.getDead()).containsExactly(pinned, buried, remembered);
        assertFalse(world.getIdentities().contains(forgotten.getUniqueLoadId()));
    }

    private Creature dead(String def) {
        Creature creature = animal(world, def);
        creature.setDead(true);
        return creature;
    }
}
