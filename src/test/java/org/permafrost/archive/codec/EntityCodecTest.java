package org.permafrost.archive.codec;

import org.permafrost.archive.session.ArchiveFormatException;
import org.permafrost.archive.session.IArchiveReader;
import org.permafrost.archive.session.IArchiveWriter;
import org.permafrost.archive.session.JsonArchiveSession;
import org.permafrost.junit.extensions.logging.ExpectLog;
import org.permafrost.junit.extensions.logging.LogLevel;
import org.permafrost.junit.extensions.logging.LogWatchExtension;
import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.model.Container;
import org.permafrost.runtime.model.Corpse;
import org.permafrost.runtime.model.Creature;
import org.permafrost.runtime.model.Entity;
import org.permafrost.runtime.model.EntityCategory;
import org.permafrost.runtime.model.GroupController;
import org.permafrost.runtime.model.Material;
import org.permafrost.testutils.WorldFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class EntityCodecTest {

    private JsonArchiveSession session;

    @BeforeEach
    void setUp() {
        session = new JsonArchiveSession();
    }

    private List<Entity> roundTrip(List<Entity> entities) throws Exception {
        IArchiveWriter out = session.beginSave();
        out.writeDeepList("entities", entities, EntityCodec.INSTANCE);
        byte[] document = session.finalizeSaving();
        IArchiveReader in = session.beginLoad(document);
        List<Entity> loaded = in.readDeepList("entities", EntityCodec.INSTANCE);
        session.closeReadCursor();
        session.resolveAllCrossReferences();
        session.runPostLoadInit();
        return loaded;
    }

    @Test
    void containerKeepsItsContentsDeep() throws Exception {
        Container shelf = new Container(1, "Shelf", 3);
        shelf.setMaterial(Material.METAL);
        Entity steel = new Entity(2, "Steel", EntityCategory.ITEM);
        steel.setMaxHitPoints(100);
        steel.setHitPoints(55);
        shelf.tryAccept(steel);

        Container loaded = (Container) roundTrip(List.of(shelf)).get(0);

        assertEquals(3, loaded.getCapacity());
        assertEquals(Material.METAL, loaded.getMaterial());
        assertThat(loaded.getContents()).hasSize(1);
        Entity held = loaded.getContents().get(0);
        assertEquals("Steel", held.getDefName());
        assertEquals(55, held.getHitPoints());
    }

    @Test
    void corpseInnerCreatureIsAReference() throws Exception {
        Creature boar = new Creature(5, "Boar", false);
        boar.setDead(true);
        Corpse corpse = new Corpse(6, "Corpse_Boar");
        corpse.setInnerCreature(boar);

        List<Entity> loaded = roundTrip(List.of(boar, corpse));

        Creature loadedBoar = assertInstanceOf(Creature.class, loaded.get(0));
        Corpse loadedCorpse = assertInstanceOf(Corpse.class, loaded.get(1));
        assertTrue(loadedBoar.isDead());
        assertSame(loadedBoar, loadedCorpse.getInnerCreature());
    }

    @Test
    void creatureKeepsTasksAndPerishableKeepsRot() throws Exception {
        Creature muffalo = new Creature(8, "Muffalo", false);
        muffalo.setCurrentTask("Graze");
        muffalo.setDuty("Wander");
        Entity meal = new Entity(9, "MealSimple", EntityCategory.ITEM);
        meal.setIngestible(true);
        meal.setRotThreshold(1000.0);
        meal.setRotProgress(250.0);
        meal.setPosition(new Cell(2, 3));

        List<Entity> loaded = roundTrip(List.of(muffalo, meal));

        Creature c = (Creature) loaded.get(0);
        assertEquals("Graze", c.getCurrentTask());
        assertEquals("Wander", c.getDuty());
        assertTrue(loaded.get(1).isPerishable());
        assertEquals(250.0, loaded.get(1).getRotProgress());
        assertEquals(new Cell(2, 3), loaded.get(1).getPosition());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "1 cross reference\\(s\\) could not be resolved.*")
    void groupControllerDropsUnresolvedCreatures() throws Exception {
        GroupController group = new GroupController(3, "raid");
        group.addOwned(new Creature(11, "Warg", false));
        IArchiveWriter out = session.beginSave();
        out.writeDeep("group", group, GroupControllerCodec.INSTANCE);
        byte[] document = session.finalizeSaving();

        IArchiveReader in = session.beginLoad(document);
        GroupController loaded = in.readDeep("group", GroupControllerCodec.INSTANCE);
        loaded.setManager(WorldFixtures.newWorld("groups").createRegion(1, WorldFixtures.TILE_TEMPERATE, 4, 4, false).getGroupManager());
        session.closeReadCursor();
        assertEquals(1, session.resolveAllCrossReferences());
        session.runPostLoadInit();

        assertEquals("raid", loaded.getLabel());
        assertThat(loaded.getOwnedCreatures()).isEmpty();
        assertEquals(1, loaded.getDroppedReferences());
    }

    @Test
    void unknownKindIsAFormatError() throws Exception {
        IArchiveReader in = session.beginLoad(
            "{\"format\":1,\"e\":{\"kind\":\"spaceship\",\"id\":1,\"def\":\"Ship\"}}".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> in.readDeep("e", EntityCodec.INSTANCE))
            .isInstanceOf(ArchiveFormatException.class)
            .hasMessageContaining("spaceship");
    }

    @Test
    void missingOptionalFieldsFallBackToDefaults() throws Exception {
        IArchiveReader in = session.beginLoad(
            "{\"format\":1,\"e\":{\"id\":4,\"def\":\"Thing\"},\"bad\":{\"id\":5,\"def\":\"Ore\",\"material\":\"UNOBTAINIUM\"}}"
                .getBytes(StandardCharsets.UTF_8));

        Entity e = in.readDeep("e", EntityCodec.INSTANCE);

        assertEquals(EntityCategory.ITEM, e.getCategory());
        assertEquals(Material.OTHER, e.getMaterial());
        assertEquals(Cell.ORIGIN, e.getPosition());
        assertNull(e.getFaction());
        assertThatThrownBy(() -> in.readDeep("bad", EntityCodec.INSTANCE))
            .isInstanceOf(ArchiveFormatException.class)
            .hasMessageContaining("UNOBTAINIUM");
    }

    @Test
    void containerOverCapacityIsAFormatError() throws Exception {
        Container crate = new Container(20, "Crate", 2);
        crate.tryAccept(new Entity(21, "Steel", EntityCategory.ITEM));
        crate.tryAccept(new Entity(22, "Jade", EntityCategory.ITEM));
        IArchiveWriter out = session.beginSave();
        out.writeDeep("crate", crate, EntityCodec.INSTANCE);
        String json = new String(session.finalizeSaving(), StandardCharsets.UTF_8)
            .replaceFirst("\"capacity\"\\s*:\\s*2", "\"capacity\":1");

        IArchiveReader in = session.beginLoad(json.getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> in.readDeep("crate", EntityCodec.INSTANCE))
            .isInstanceOf(ArchiveFormatException.class)
            .hasMessageContaining("Crate#20")
            .hasMessageContaining("capacity 1");
    }
}
