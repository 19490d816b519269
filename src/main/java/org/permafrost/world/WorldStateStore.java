package org.permafrost.world;

import org.permafrost.archive.codec.EntityCodec;
import org.permafrost.archive.codec.FactionCodec;
import org.permafrost.archive.session.ArchiveException;
import org.permafrost.archive.session.ArchiveFormatException;
import org.permafrost.archive.session.IArchiveReader;
import org.permafrost.archive.session.IArchiveWriter;
import org.permafrost.archive.session.IDeepCodec;
import org.permafrost.archive.session.IPersistenceSession;
import org.permafrost.archive.session.JsonArchiveSession;
import org.permafrost.archive.storage.ArchiveStore;
import org.permafrost.runtime.model.Creature;
import org.permafrost.runtime.model.Entity;
import org.permafrost.runtime.model.Faction;
import org.permafrost.runtime.model.Retention;
import org.permafrost.runtime.model.World;
import org.permafrost.runtime.model.WorldRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Persists the world-scoped state that outlives individual regions: factions, the world
 * registry with retention, the forced-retention set, the region side table, the clock and
 * the entity id counter.
 * <p>
 * Loading fills a freshly constructed {@link World}. The document is fully read and resolved
 * before anything is applied, so a corrupt file leaves the target world untouched.
 * </p>
 */
public class WorldStateStore {

    private static final Logger log = LoggerFactory.getLogger(WorldStateStore.class);

    private final ArchiveStore store;
    private final Supplier<IPersistenceSession> sessionFactory;

    public WorldStateStore(ArchiveStore store) {
        this(store, JsonArchiveSession::new);
    }

    public WorldStateStore(ArchiveStore store, Supplier<IPersistenceSession> sessionFactory) {
        this.store = store;
        this.sessionFactory = sessionFactory;
    }

    /**
     * @param world The world to write.
     * @return bytes written
     * @throws ArchiveException if encoding or writing fails
     */
    public long save(World world) throws ArchiveException {
        IPersistenceSession session = sessionFactory.get();
        try {
            IArchiveWriter root = session.beginSave();
            root.writeLong("tick", world.getClock().currentTick());
            root.writeLong("nextEntityId", world.peekNextEntityId());
            root.writeDeepList("factions", world.getFactions(), FactionCodec.INSTANCE);

            WorldRegistry registry = world.getWorldRegistry();
            List<TrackedEntry> entries = new ArrayList<>();
            for (Creature creature : registry.allAliveOrDead()) {
                entries.add(new TrackedEntry(creature, registry.getRetention(creature)));
            }
            root.writeDeepList("worldRegistry", entries, TrackedEntry.CODEC);
            root.writeReferenceList("forcedRetention", new ArrayList<>(registry.getForcedRetention()));
            root.writeDeepList("sideTable", world.getSideTable().all(), SideRegistryCodec.INSTANCE);

            long size = store.writeWorldState(world.getWorldId(), session.finalizeSaving());
            log.info("Saved world {}: {} faction(s), {} tracked creature(s), {} side registry entr(ies)",
                world.getWorldId(), world.getFactions().size(), entries.size(), world.getSideTable().size());
            return size;
        } finally {
            session.reset();
        }
    }

    /**
     * @param worldId The world id.
     * @return true if a world file exists
     */
    public boolean exists(String worldId) {
        return store.locateWorldState(worldId).isPresent();
    }

    /**
     * Reads the world file into a freshly constructed world.
     *
     * @param world Target world; must have no factions and an empty world registry.
     * @return false if no world file exists
     * @throws ArchiveException if the file is unreadable or malformed
     * @throws IllegalStateException if the target world already holds state
     */
    public boolean load(World world) throws ArchiveException {
        if (!world.getFactions().isEmpty() || world.getWorldRegistry().size() > 0 || world.getSideTable().size() > 0) {
            throw new IllegalStateException("World " + world.getWorldId() + " already holds state; load needs a fresh world");
        }
        if (!exists(world.getWorldId())) {
            log.debug("No world file for {}", world.getWorldId());
            return false;
        }
        IPersistenceSession session = sessionFactory.get();
        try {
            IArchiveReader root = session.beginLoad(store.readWorldState(world.getWorldId()));
            long tick = root.readLong("tick", 0L);
            long nextEntityId = root.readLong("nextEntityId", 1L);
            List<Faction> factions = root.readDeepList("factions", FactionCodec.INSTANCE);
            List<TrackedEntry> entries = root.readDeepList("worldRegistry", TrackedEntry.CODEC);
            List<Creature> forced = new ArrayList<>();
            root.readReferenceList("forcedRetention", Creature.class, list -> list.stream()
                .filter(c -> c != null)
                .forEach(forced::add));
            List<SideRegistry> sideTable = root.readDeepList("sideTable", SideRegistryCodec.INSTANCE);
            session.closeReadCursor();
            int unresolved = session.resolveAllCrossReferences();
            session.runPostLoadInit();

            world.getClock().setTick(tick);
            world.setNextEntityId(nextEntityId);
            factions.forEach(world::addFaction);
            for (TrackedEntry entry : entries) {
                world.getWorldRegistry().passToWorld(entry.creature, entry.retention);
            }
            world.getWorldRegistry().getForcedRetention().addAll(forced);
            sideTable.forEach(world.getSideTable()::put);

            log.info("Loaded world {}: {} faction(s), {} tracked creature(s), {} side registry entr(ies), {} unresolved reference(s)",
                world.getWorldId(), factions.size(), entries.size(), sideTable.size(), unresolved);
            return true;
        } catch (ArchiveFormatException e) {
            throw new ArchiveException("Malformed world file for " + world.getWorldId() + ": " + e.getMessage(), e);
        } finally {
            session.reset();
        }
    }

    public ArchiveStore getStore() {
        return store;
    }

    private static final class TrackedEntry {

        static final IDeepCodec<TrackedEntry> CODEC = new IDeepCodec<>() {
            @Override
            public void write(TrackedEntry entry, IArchiveWriter out) {
                out.writeDeep("creature", entry.creature, EntityCodec.INSTANCE);
                out.writeString("retention", entry.retention.name());
            }

            @Override
            public TrackedEntry read(IArchiveReader in) {
                Entity entity = in.readDeep("creature", EntityCodec.INSTANCE);
                if (!(entity instanceof Creature)) {
                    throw new ArchiveFormatException("World registry entry does not hold a creature");
                }
                String retention = in.readString("retention", Retention.DISCARDABLE.name());
                try {
                    return new TrackedEntry((Creature) entity, Retention.valueOf(retention));
                } catch (IllegalArgumentException e) {
                    throw new ArchiveFormatException("Unknown retention " + retention, e);
                }
            }
        };

        private final Creature creature;
        private final Retention retention;

        private TrackedEntry(Creature creature, Retention retention) {
            this.creature = creature;
            this.retention = retention != null ? retention : Retention.DISCARDABLE;
        }
    }
}
