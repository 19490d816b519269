package org.permafrost.world;

import org.permafrost.archive.RegionArchiver;
import org.permafrost.archive.RestoreResult;
import org.permafrost.archive.session.ArchiveException;
import org.permafrost.archive.storage.ArchiveStore;
import org.permafrost.junit.extensions.logging.LogWatchExtension;
import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.model.Container;
import org.permafrost.runtime.model.Corpse;
import org.permafrost.runtime.model.Creature;
import org.permafrost.runtime.model.ManualTickClock;
import org.permafrost.runtime.model.Region;
import org.permafrost.runtime.model.Retention;
import org.permafrost.runtime.model.Rotation;
import org.permafrost.runtime.model.World;
import org.permafrost.runtime.model.WorldRegistry;
import org.permafrost.utils.compression.NoneCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.permafrost.testutils.WorldFixtures.TILE_TEMPERATE;
import static org.permafrost.testutils.WorldFixtures.animal;
import static org.permafrost.testutils.WorldFixtures.archiver;
import static org.permafrost.testutils.WorldFixtures.bed;
import static org.permafrost.testutils.WorldFixtures.colonist;
import static org.permafrost.testutils.WorldFixtures.newWorld;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class WorldStateStoreTest {

    @TempDir
    Path root;

    private WorldStateStore worldStore;

    @BeforeEach
    void setUp() {
        worldStore = new WorldStateStore(new ArchiveStore(root, new NoneCodec()));
    }

    @Test
    @DisplayName("World registry, factions and clock survive a restart")
    void worldStateRoundTrip() throws ArchiveException {
        World world = newWorld("alpha");
        world.getClock().setTick(123_456);
        Creature traveller = colonist(world);
        Creature remembered = animal(world, "Thrumbo");
        remembered.setDead(true);
        world.getWorldRegistry().passToWorld(traveller, Retention.KEEP_FOREVER);
        world.getWorldRegistry().passToWorld(remembered, Retention.DISCARDABLE);
        world.getWorldRegistry().getForcedRetention().add(remembered);
        long nextId = world.peekNextEntityId();

        assertThat(worldStore.save(world)).isPositive();
        assertTrue(worldStore.exists("alpha"));

        World restarted = new World("alpha", new ManualTickClock());
        assertTrue(worldStore.load(restarted));

        assertEquals(123_456, restarted.getClock().currentTick());
        assertEquals(nextId, restarted.peekNextEntityId());
        assertThat(restarted.getFactions()).extracting(f -> f.getUniqueLoadId()).containsExactly("Faction_1", "Faction_2");
        WorldRegistry registry = restarted.getWorldRegistry();
        assertThat(registry.getAlive()).singleElement().satisfies(c -> {
            assertEquals(traveller.getUniqueLoadId(), c.getUniqueLoadId());
            assertEquals(Retention.KEEP_FOREVER, registry.getRetention(c));
            assertTrue(c.getFaction().isPlayer());
        });
        assertThat(registry.getDead()).singleElement().satisfies(c -> assertTrue(c.isDead()));
        assertThat(registry.getForcedRetention()).containsExactlyElementsOf(registry.getDead());
    }

    @Test
    @DisplayName("A region archived in one session restores in the next")
    void crossSessionRegionRestore() throws ArchiveException {
        World world = newWorld("alpha");
        Region region = world.createRegion(1, TILE_TEMPERATE, 12, 12, false);
        Container bedroom = bed(world);
        Creature sleeper = colonist(world);
        bedroom.tryAccept(sleeper);
        region.spawn(bedroom, new Cell(4, 4), Rotation.NORTH);
        Creature deceased = colonist(world);
        Corpse corpse = new Corpse(world.nextEntityId(), "Corpse_Human");
        corpse.setInnerCreature(deceased);
        region.spawn(corpse, new Cell(8, 8), Rotation.NORTH);
        String sleeperId = sleeper.getUniqueLoadId();
        String deceasedId = deceased.getUniqueLoadId();

        RegionArchiver regions = archiver(root);
        assertTrue(regions.save(region, 1));
        world.removeRegion(region);
        worldStore.save(world);

        World restarted = new World("alpha", new ManualTickClock());
        assertTrue(worldStore.load(restarted));
        assertThat(restarted.getSideTable().tryGet(1)).isPresent();
        Region fresh = restarted.createRegion(1, TILE_TEMPERATE, 12, 12, false);

        Optional<RestoreResult> result = archiver(root).load(fresh, 1);

        assertTrue(result.isPresent());
        Container restoredBed = fresh.firstAt(new Cell(4, 4), Container.class).orElseThrow();
        assertThat(restoredBed.getContents()).singleElement().satisfies(e -> {
            assertEquals(sleeperId, e.getUniqueLoadId());
            assertNotSame(sleeper, e);
        });
        Corpse restoredCorpse = fresh.firstAt(new Cell(8, 8), Corpse.class).orElseThrow();
        Creature inner = restoredCorpse.getInnerCreature();
        assertNotNull(inner);
        assertEquals(deceasedId, inner.getUniqueLoadId());
        assertThat(restarted.getWorldRegistry().getDead()).containsExactly(inner);

        WorldRegistry registry = restarted.getWorldRegistry();
        assertThat(registry.getForcedRetention()).isEmpty();
        assertEquals(0, registry.collectGarbage());
        assertThat(registry.getAlive()).noneMatch(c -> c.getUniqueLoadId().equals(sleeperId));
        assertFalse(restarted.getSideTable().tryGet(1).isPresent());
    }

    @Test
    void loadRequiresFreshWorld() throws ArchiveException {
        worldStore.save(newWorld("alpha"));

        assertThatThrownBy(() -> worldStore.load(newWorld("alpha")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void missingWorldFileIsNotAnError() throws ArchiveException {
        World world = new World("nowhere", new ManualTickClock());

        assertFalse(worldStore.exists("nowhere"));
        assertFalse(worldStore.load(world));
    }

    @Test
    void corruptWorldFileLeavesWorldUntouched() throws ArchiveException {
        worldStore.getStore().writeWorldState("alpha",
            "{\"format\":1,\"factions\":[{\"id\":\"x\"}]".getBytes(StandardCharsets.UTF_8));
        World world = new World("alpha", new ManualTickClock());

        assertThatThrownBy(() -> worldStore.load(world)).isInstanceOf(ArchiveException.class);
        assertThat(world.getFactions()).isEmpty();
        assertEquals(0, world.getClock().currentTick());
    }
}
