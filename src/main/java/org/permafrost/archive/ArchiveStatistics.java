package org.permafrost.archive;

import org.permafrost.archive.codec.EntityCodec;
import org.permafrost.archive.session.ArchiveException;
import org.permafrost.archive.session.IArchiveWriter;
import org.permafrost.archive.session.JsonArchiveSession;
import org.permafrost.runtime.model.Creature;
import org.permafrost.runtime.model.Entity;
import org.permafrost.world.SideRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Logs what a saved region costs on disk and what the world keeps in memory while it is archived.
 * <p>
 * Memory figures are estimated by serializing each creature group the same way archives are
 * written and measuring the result.
 * </p>
 */
public final class ArchiveStatistics {

    private static final Logger log = LoggerFactory.getLogger(ArchiveStatistics.class);

    private final long fileBytes;
    private final long gridBytes;
    private final int entityCount;
    private final List<Creature> worldReferences;
    private final List<Creature> ownedCreatures;
    private final List<Creature> protectedOccupants;
    private final String worldDetail;

    private ArchiveStatistics(long fileBytes, ArchiveRecord record, SideRegistry side) {
        this.fileBytes = fileBytes;
        this.gridBytes = record.gridBytes();
        this.entityCount = record.getEntities().size();
        this.worldReferences = new ArrayList<>();
        side.getSleepingOccupants().forEach(r -> worldReferences.add(r.creature()));
        side.getContainerOccupants().forEach(r -> worldReferences.add(r.creature()));
        side.getOwnedAnimals().forEach(r -> worldReferences.add(r.creature()));
        worldReferences.addAll(side.getLegacyParked());
        this.ownedCreatures = new ArrayList<>();
        side.getTrackedCreatures().forEach(r -> ownedCreatures.add(r.creature()));
        this.protectedOccupants = OwnershipTransferManager.corpseOccupants(record.getEntities());
        this.worldDetail = "sleeping=" + side.getSleepingOccupants().size()
            + " container=" + side.getContainerOccupants().size()
            + " animals=" + side.getOwnedAnimals().size()
            + (side.getLegacyParked().isEmpty() ? "" : " legacy=" + side.getLegacyParked().size());
    }

    /**
     * @param fileBytes Size of the written archive file.
     * @param record The saved record.
     * @param side The region's side registry after extraction.
     * @return the statistics
     */
    public static ArchiveStatistics of(long fileBytes, ArchiveRecord record, SideRegistry side) {
        return new ArchiveStatistics(fileBytes, record, side);
    }

    /**
     * Logs the two-line disk/memory breakdown at INFO.
     *
     * @param regionId Region id.
     */
    public void logBreakdown(int regionId) {
        long worldRefBytes = estimateSerializedBytes(worldReferences);
        long ownedBytes = estimateSerializedBytes(ownedCreatures);
        long protectedBytes = estimateSerializedBytes(protectedOccupants);
        log.info("Region {} save breakdown:\n  Disk : {} - grids (raw)={}, entities={}\n"
                + "  RAM  : {} - world registry refs={} ({}) ~{} | owned creatures={} ~{} | retention-protected occupants={} ~{}",
            regionId, formatBytes(fileBytes), formatBytes(gridBytes), entityCount,
            formatBytes(worldRefBytes + ownedBytes + protectedBytes),
            worldReferences.size(), worldDetail, formatBytes(worldRefBytes),
            ownedCreatures.size(), formatBytes(ownedBytes),
            protectedOccupants.size(), formatBytes(protectedBytes));
    }

    public long getFileBytes() {
        return fileBytes;
    }

    public long getGridBytes() {
        return gridBytes;
    }

    public int getEntityCount() {
        return entityCount;
    }

    public int getWorldReferenceCount() {
        return worldReferences.size();
    }

    public int getOwnedCreatureCount() {
        return ownedCreatures.size();
    }

    public int getProtectedOccupantCount() {
        return protectedOccupants.size();
    }

    /**
     * @param creatures Creatures to measure.
     * @return size of their serialized form, 0 if empty or if encoding fails
     */
    static long estimateSerializedBytes(List<Creature> creatures) {
        if (creatures.isEmpty()) {
            return 0;
        }
        JsonArchiveSession session = new JsonArchiveSession();
        try {
            IArchiveWriter root = session.beginSave();
            root.writeDeepList("p", new ArrayList<Entity>(creatures), EntityCodec.INSTANCE);
            return session.finalizeSaving().length;
        } catch (ArchiveException | RuntimeException e) {
            log.warn("Size estimate failed: {}", e.getMessage());
            return 0;
        } finally {
            session.reset();
        }
    }

    public static String formatBytes(long bytes) {
        if (bytes >= 1024 * 1024) {
            return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
        }
        if (bytes >= 1024) {
            return String.format("%.1f KB", bytes / 1024.0);
        }
        return bytes + " B";
    }
}
