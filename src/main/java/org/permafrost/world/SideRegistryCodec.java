package org.permafrost.world;

import org.permafrost.archive.codec.EntityCodec;
import org.permafrost.archive.session.ArchiveFormatException;
import org.permafrost.archive.session.IArchiveReader;
import org.permafrost.archive.session.IArchiveWriter;
import org.permafrost.archive.session.IDeepCodec;
import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.model.Creature;
import org.permafrost.runtime.model.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Deep codec for a region's side registry inside the world file.
 * <p>
 * Creatures the world registry keeps are written as references; world-tracked creatures are
 * owned by the side registry and written deep. Records are rebuilt after cross references
 * are resolved; records whose creature did not resolve are dropped with a warning.
 * </p>
 */
public final class SideRegistryCodec implements IDeepCodec<SideRegistry> {

    private static final Logger log = LoggerFactory.getLogger(SideRegistryCodec.class);

    public static final SideRegistryCodec INSTANCE = new SideRegistryCodec();

    private SideRegistryCodec() {
    }

    @Override
    public void write(SideRegistry side, IArchiveWriter out) {
        out.writeInt("region", side.getRegionId());
        out.writeDeepList("sleeping", occupantSlots(side.getSleepingOccupants()), Slot.REFERENCED);
        out.writeDeepList("containerOccupants", occupantSlots(side.getContainerOccupants()), Slot.REFERENCED);
        out.writeDeepList("ownedAnimals", creatureSlots(side.getOwnedAnimals()), Slot.REFERENCED);
        out.writeDeepList("tracked", creatureSlots(side.getTrackedCreatures()), Slot.OWNED);
        if (!side.getLegacyParked().isEmpty()) {
            out.writeReferenceList("legacy", side.getLegacyParked());
        }
    }

    @Override
    public SideRegistry read(IArchiveReader in) {
        int regionId = in.readInt("region", -1);
        if (regionId < 0) {
            throw new ArchiveFormatException("Side registry record without region id");
        }
        SideRegistry side = new SideRegistry(regionId);
        List<Slot> sleeping = in.readDeepList("sleeping", Slot.REFERENCED);
        List<Slot> occupants = in.readDeepList("containerOccupants", Slot.REFERENCED);
        List<Slot> animals = in.readDeepList("ownedAnimals", Slot.REFERENCED);
        List<Slot> tracked = in.readDeepList("tracked", Slot.OWNED);
        in.readReferenceList("legacy", Creature.class, list -> list.stream()
            .filter(c -> c != null)
            .forEach(side.getLegacyParked()::add));

        in.onPostLoadInit(() -> {
            int dropped = fill(side.getSleepingOccupants(), sleeping, ContainerOccupantRecord::new)
                + fill(side.getContainerOccupants(), occupants, ContainerOccupantRecord::new)
                + fill(side.getOwnedAnimals(), animals, CreatureRecord::new)
                + fill(side.getTrackedCreatures(), tracked, CreatureRecord::new);
            if (dropped > 0) {
                log.warn("Side registry of region {} dropped {} record(s) whose creature could not be resolved", regionId, dropped);
            }
        });
        return side;
    }

    private static <R> int fill(List<R> target, List<Slot> slots, BiFunction<Creature, Cell, R> factory) {
        int dropped = 0;
        for (Slot slot : slots) {
            if (slot.creature == null) {
                dropped++;
            } else {
                target.add(factory.apply(slot.creature, slot.cell));
            }
        }
        return dropped;
    }

    private static List<Slot> occupantSlots(List<ContainerOccupantRecord> records) {
        List<Slot> slots = new ArrayList<>(records.size());
        records.forEach(r -> slots.add(new Slot(r.creature(), r.containerCell())));
        return slots;
    }

    private static List<Slot> creatureSlots(List<CreatureRecord> records) {
        List<Slot> slots = new ArrayList<>(records.size());
        records.forEach(r -> slots.add(new Slot(r.creature(), r.position())));
        return slots;
    }

    /**
     * Mutable creature/cell pair; the creature arrives once references are resolved.
     */
    private static final class Slot {

        static final IDeepCodec<Slot> REFERENCED = new IDeepCodec<>() {
            @Override
            public void write(Slot slot, IArchiveWriter out) {
                out.writeReference("creature", slot.creature);
                out.writeCell("cell", slot.cell);
            }

            @Override
            public Slot read(IArchiveReader in) {
                Slot slot = new Slot(null, in.readCell("cell"));
                in.readReference("creature", Creature.class, c -> slot.creature = c);
                return slot;
            }
        };

        static final IDeepCodec<Slot> OWNED = new IDeepCodec<>() {
            @Override
            public void write(Slot slot, IArchiveWriter out) {
                out.writeDeep("creature", slot.creature, EntityCodec.INSTANCE);
                out.writeCell("cell", slot.cell);
            }

            @Override
            public Slot read(IArchiveReader in) {
                Entity entity = in.readDeep("creature", EntityCodec.INSTANCE);
                if (entity != null && !(entity instanceof Creature)) {
                    throw new ArchiveFormatException("Tracked side registry entry is not a creature: " + entity);
                }
                return new Slot((Creature) entity, in.readCell("cell"));
            }
        };

        private Creature creature;
        private final Cell cell;

        private Slot(Creature creature, Cell cell) {
            this.creature = creature;
            this.cell = cell;
        }
    }
}
