package org.permafrost.archive;

import org.permafrost.archive.codec.ArchiveRecordCodec;
import org.permafrost.archive.session.ArchiveException;
import org.permafrost.archive.session.ArchiveFormatException;
import org.permafrost.archive.session.IArchiveReader;
import org.permafrost.archive.session.IArchiveWriter;
import org.permafrost.archive.session.IPersistenceSession;
import org.permafrost.archive.session.JsonArchiveSession;
import org.permafrost.archive.storage.ArchiveStore;
import org.permafrost.decay.DecayContext;
import org.permafrost.decay.DecayEngine;
import org.permafrost.decay.DecayReport;
import org.permafrost.decay.RotOutcome;
import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.model.Container;
import org.permafrost.runtime.model.Creature;
import org.permafrost.runtime.model.Entity;
import org.permafrost.runtime.model.Faction;
import org.permafrost.runtime.model.GroupController;
import org.permafrost.runtime.model.Region;
import org.permafrost.runtime.model.RegionComponent;
import org.permafrost.runtime.model.Rotation;
import org.permafrost.runtime.model.TerrainCatalog;
import org.permafrost.runtime.model.TerrainDef;
import org.permafrost.runtime.model.World;
import org.permafrost.runtime.model.WorldRegistry;
import org.permafrost.runtime.spi.IGridCodec;
import org.permafrost.runtime.spi.IRandomProvider;
import org.permafrost.runtime.spi.IdentityCollisionException;
import org.permafrost.world.ContainerOccupantRecord;
import org.permafrost.world.CreatureRecord;
import org.permafrost.world.SideRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Archives a region when it is deactivated and restores it, aged, when it is activated again.
 * <p>
 * Save and load follow fixed step sequences. On load, cross references are resolved exactly
 * once, after both the archived objects and the live world targets are registered and
 * before any post-load initialization runs. While a load is in progress the region's
 * restoring flag is set, which suppresses collapse checks and reveal notifications; the flag
 * is always cleared, also on failure.
 * </p>
 * <p>
 * Neither operation throws: failures are logged and leave the simulation playable.
 * </p>
 */
public class RegionArchiver {

    private static final Logger log = LoggerFactory.getLogger(RegionArchiver.class);

    /** Root node name of the main region record. */
    public static final String RECORD_KEY = "RegionData";

    private static final int FALLBACK_SEARCH_RADIUS = 8;

    private final ArchiveStore store;
    private final IGridCodec gridCodec;
    private final EligibilityClassifier classifier;
    private final OwnershipTransferManager transfers = new OwnershipTransferManager();
    private final DecayEngine decayEngine;
    private final IRandomProvider random;
    private final Supplier<IPersistenceSession> sessionFactory;

    /**
     * @param store Archive file store; null disables archiving.
     * @param gridCodec Codec for per-cell layers.
     * @param classifier Eligibility predicate shared by save and wipe.
     * @param decayEngine Offline decay engine.
     * @param random Root random source; sub-streams are derived per region.
     * @param sessionFactory Creates one persistence session per operation.
     */
    public RegionArchiver(ArchiveStore store, IGridCodec gridCodec, EligibilityClassifier classifier,
                          DecayEngine decayEngine, IRandomProvider random, Supplier<IPersistenceSession> sessionFactory) {
        this.store = store;
        this.gridCodec = gridCodec;
        this.classifier = classifier;
        this.decayEngine = decayEngine;
        this.random = random;
        this.sessionFactory = sessionFactory;
    }

    /**
     * Uses {@link JsonArchiveSession} for every operation.
     */
    public RegionArchiver(ArchiveStore store, IGridCodec gridCodec, EligibilityClassifier classifier,
                          DecayEngine decayEngine, IRandomProvider random) {
        this(store, gridCodec, classifier, decayEngine, random, JsonArchiveSession::new);
    }

    /**
     * @param region The region.
     * @param regionId Its id.
     * @return true if an archive file exists for the region
     */
    public boolean archiveExists(Region region, int regionId) {
        if (store == null || regionId < 0 || region == null) {
            return false;
        }
        String worldId = region.getWorld().getWorldId();
        return worldId != null && !worldId.isBlank() && store.regionExists(worldId, regionId);
    }

    // ---------------------------------------------------------------------
    // Save
    // ---------------------------------------------------------------------

    /**
     * Writes the region to its archive file and moves everything that must not be archived
     * into the world registry or the region's side registry.
     *
     * @param region The live region about to be deactivated.
     * @param regionId Region id naming the archive file.
     * @return true if the archive was written
     */
    public boolean save(Region region, int regionId) {
        if (!checkPrerequisites(region, regionId, "save")) {
            return false;
        }
        World world = region.getWorld();
        IPersistenceSession session = sessionFactory.get();
        // the region's side entry only sees the extraction once the archive is on disk
        SideRegistry extracted = new SideRegistry(regionId);
        OwnershipTransferManager.RegistrySnapshot before = transfers.snapshot(world.getWorldRegistry());
        boolean written = false;
        try {
            ArchiveRecord record = new ArchiveRecord();
            record.setAbandonedAtTick(world.getClock().currentTick());
            flattenGrids(region, record);

            transfers.extractContainerOccupants(region, extracted);
            transfers.extractOwnedAnimals(region, extracted);
            transfers.extractTrackedCreatures(region, extracted);

            List<GroupController> leaders = transfers.collectGroupLeaders(region);
            record.setGroupLeaders(leaders);

            List<Entity> archived = new ArrayList<>();
            for (Entity entity : region.snapshotEntities()) {
                if (classifier.shouldPersist(entity)) {
                    archived.add(entity);
                }
            }
            record.setEntities(archived);

            int pinned = transfers.protectCorpseOccupants(world.getWorldRegistry(), record.getEntities());
            if (pinned > 0) {
                log.debug("Pinned {} corpse occupant(s) of region {} in forced retention", pinned, regionId);
            }

            IArchiveWriter root = session.beginSave();
            root.writeDeep(RECORD_KEY, record, ArchiveRecordCodec.INSTANCE);
            int components = saveComponents(region, root);
            byte[] document = session.finalizeSaving();
            long size = store.writeRegion(world.getWorldId(), regionId, document);
            written = true;

            SideRegistry side = world.getSideTable().getOrCreate(regionId);
            side.mergeFrom(extracted);
            transfers.detachArchivedCreatures(region, record.getEntities(), leaders);

            if (components > 0) {
                log.info("Saved {} opt-in component(s) of region {}", components, regionId);
            }
            log.info("Saved region {} of world {} to {}", regionId, world.getWorldId(), store.regionPath(world.getWorldId(), regionId));
            ArchiveStatistics.of(size, record, side).logBreakdown(regionId);
            return true;
        } catch (ArchiveException | RuntimeException e) {
            log.error("Failed saving region {}: {}", regionId, e.getMessage(), e);
            if (!written) {
                rollBack(region, regionId, extracted, before);
            }
            return false;
        } finally {
            session.reset();
        }
    }

    private void rollBack(Region region, int regionId, SideRegistry extracted,
                          OwnershipTransferManager.RegistrySnapshot before) {
        try {
            int restored = transfers.rollbackExtraction(region, extracted, before);
            log.warn("Rolled back the failed save of region {}: {} creature(s) returned to the region", regionId, restored);
        } catch (RuntimeException e) {
            log.error("Rolling back the failed save of region {} failed; {} still hold(s) the extracted creatures",
                regionId, extracted, e);
        }
    }

    private void flattenGrids(Region region, ArchiveRecord record) {
        record.setTerrain(gridCodec.serializeShorts(region, c -> region.getTerrain(c).id()));
        record.setRoof(gridCodec.serializeShorts(region, region::getRoof));
        record.setSnow(gridCodec.serializeBytes(region, region::getSnowDepth));
        if (region.isPollutionActive()) {
            record.setPollution(gridCodec.serializeBytes(region, c -> region.isPolluted(c) ? 1 : 0));
        }
        record.setFog(gridCodec.serializeBytes(region, c -> region.isFogged(c) ? 1 : 0));
    }

    private int saveComponents(Region region, IArchiveWriter root) {
        int count = 0;
        for (IPersistableRegionComponent component : persistableComponents(region)) {
            component.save(root.child(IPersistableRegionComponent.archiveKey(component.getClass())));
            count++;
        }
        return count;
    }

    // ---------------------------------------------------------------------
    // Load
    // ---------------------------------------------------------------------

    /**
     * Restores an archived region into its freshly generated live counterpart. Does nothing if
     * no archive exists.
     *
     * @param region The freshly generated live region.
     * @param regionId Region id naming the archive file.
     * @return a summary, or empty if nothing was restored
     */
    public Optional<RestoreResult> load(Region region, int regionId) {
        if (!checkPrerequisites(region, regionId, "load")) {
            return Optional.empty();
        }
        World world = region.getWorld();
        if (!store.regionExists(world.getWorldId(), regionId)) {
            log.debug("No archive for region {} of world {}", regionId, world.getWorldId());
            return Optional.empty();
        }
        IPersistenceSession session = sessionFactory.get();
        IRandomProvider placementRandom = random.deriveFor("placement", regionId);
        try {
            // everything that can reject the archive runs before the region is touched
            IArchiveReader root = session.beginLoad(store.readRegion(world.getWorldId(), regionId));
            ArchiveRecord record = root.readDeep(RECORD_KEY, ArchiveRecordCodec.INSTANCE);
            if (record == null) {
                log.error("Archive of region {} has no {} record", regionId, RECORD_KEY);
                return Optional.empty();
            }
            List<Creature> ghosts = findWorldGhosts(world.getWorldRegistry(), record.getEntities());
            preRegisterWorldTargets(world, session, ghosts);

            region.setRestoring(true);
            wipeArchivableEntities(region);

            int components = loadComponents(region, root);
            if (components > 0) {
                log.info("Loaded {} opt-in component(s) of region {}", components, regionId);
            }

            applyTerrain(region, record);

            for (Creature ghost : ghosts) {
                world.getWorldRegistry().remove(ghost);
            }
            if (!ghosts.isEmpty()) {
                log.info("Removed {} world registry ghost(s) colliding with archived creatures of region {}", ghosts.size(), regionId);
            }

            for (GroupController controller : record.getGroupLeaders()) {
                controller.setManager(region.getGroupManager());
            }

            session.closeReadCursor();
            int unresolved = session.resolveAllCrossReferences();
            session.runPostLoadInit();

            DecayContext context = decayEngine.buildContext(region, record.getAbandonedAtTick(), world.getClock().currentTick());
            DecayReport report = new DecayReport();

            List<Entity> placed = placeArchivedEntities(region, record.getEntities(), context, report, placementRandom);
            int leaders = attachGroupLeaders(region, record.getGroupLeaders());

            int sideRestored = drainSideRegistry(region, regionId, placementRandom);

            applyRemainingGrids(region, record);

            decayEngine.run(region, placed, context, random.deriveFor("decay", regionId), report);
            region.setRestoring(false);

            transfers.releaseCorpseOccupants(world.getWorldRegistry(), record.getEntities());

            log.info("Restored region {} after {} ticks: placed={}, rotted={}, groups={}, side registry={}",
                regionId, context.getElapsedTicks(), placed.size(), report.getRotted(), leaders, sideRestored);
            return Optional.of(new RestoreResult(placed.size(), report.getRotted(), leaders, sideRestored, unresolved, report));
        } catch (IdentityCollisionException e) {
            log.error("Identity collision while restoring region {}: {} [{}, world identities={}, world registry={}]",
                regionId, e.getMessage(), describeSession(session), world.getIdentities().size(), world.getWorldRegistry().size());
            return Optional.empty();
        } catch (ArchiveException | ArchiveFormatException e) {
            log.error("Corrupt archive for region {}, restoration skipped: {}", regionId, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Failed restoring region {}: {}", regionId, e.getMessage(), e);
            return Optional.empty();
        } finally {
            region.setRestoring(false);
            session.reset();
        }
    }

    /**
     * Clears everything the classifier would archive so fresh generation does not conflict with
     * the restored state. Creatures are despawned, not killed, and containers are emptied before
     * they are destroyed so no occupant ends up in the world's dead store.
     */
    private void wipeArchivableEntities(Region region) {
        int wiped = 0;
        for (Entity entity : region.snapshotEntities()) {
            if (!classifier.shouldPersist(entity)) {
                continue;
            }
            if (entity instanceof Creature) {
                region.despawn(entity);
            } else {
                if (entity instanceof Container) {
                    ((Container) entity).drain();
                }
                entity.destroy();
            }
            wiped++;
        }
        log.debug("Wiped {} generated entities from region {}", wiped, region.getId());
    }

    private int loadComponents(Region region, IArchiveReader root) {
        int count = 0;
        for (IPersistableRegionComponent component : persistableComponents(region)) {
            Optional<IArchiveReader> node = root.child(IPersistableRegionComponent.archiveKey(component.getClass()));
            if (node.isPresent()) {
                component.load(node.get());
                count++;
            }
        }
        return count;
    }

    private void applyTerrain(Region region, ArchiveRecord record) {
        if (record.getTerrain() == null) {
            return;
        }
        int[] unknown = {0};
        gridCodec.deserializeShorts(record.getTerrain(), region, (c, id) -> {
            TerrainDef def = TerrainCatalog.byId(id);
            if (def != null) {
                region.setTerrain(c, def);
            } else {
                unknown[0]++;
            }
        });
        if (unknown[0] > 0) {
            log.debug("{} cell(s) of region {} reference unknown terrain and keep the generated terrain", unknown[0], region.getId());
        }
    }

    /**
     * Finds world registry entries that carry the identity of an archived creature. Creatures can
     * drift into the world registry between save and load; leaving them would collide with the
     * archived copy during resolution.
     */
    private static List<Creature> findWorldGhosts(WorldRegistry worldRegistry, List<Entity> archived) {
        Map<String, Entity> archivedCreatures = new HashMap<>();
        for (Entity entity : archived) {
            if (entity instanceof Creature) {
                archivedCreatures.put(entity.getUniqueLoadId(), entity);
            }
        }
        List<Creature> ghosts = new ArrayList<>();
        for (Creature tracked : worldRegistry.allAliveOrDead()) {
            Entity copy = archivedCreatures.get(tracked.getUniqueLoadId());
            if (copy != null && copy != tracked) {
                ghosts.add(tracked);
            }
        }
        return ghosts;
    }

    private static void preRegisterWorldTargets(World world, IPersistenceSession session, List<Creature> ghosts) {
        for (Faction faction : world.getFactions()) {
            session.preRegister(faction);
        }
        Set<Creature> skipped = Collections.newSetFromMap(new IdentityHashMap<>());
        skipped.addAll(ghosts);
        for (Creature creature : world.getWorldRegistry().allAliveOrDead()) {
            if (!skipped.contains(creature)) {
                session.preRegister(creature);
            }
        }
    }

    private List<Entity> placeArchivedEntities(Region region, List<Entity> archived, DecayContext context,
                                               DecayReport report, IRandomProvider placementRandom) {
        List<Entity> placed = new ArrayList<>();
        Set<Entity> restored = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Entity entity : archived) {
            if (entity.isDestroyed()) {
                continue;
            }
            if (entity.isPerishable()) {
                RotOutcome outcome = decayEngine.applyRot(entity, context, report);
                if (outcome.spoiled()) {
                    continue;
                }
            }
            Cell target = entity.getPosition();
            if (!region.inBounds(target)) {
                Cell fallback = findFallbackCell(region, target, placementRandom);
                log.warn("Saved position {} of {} is outside region {}; placing at {}", target, entity, region.getId(), fallback);
                target = fallback;
            }
            if (entity instanceof Container) {
                drainConflictingContainers(region, target, restored);
            }
            region.spawn(entity, target, entity.getRotation());
            restored.add(entity);
            placed.add(entity);
        }
        return placed;
    }

    private static void drainConflictingContainers(Region region, Cell cell, Set<Entity> restored) {
        for (Entity existing : region.entitiesAt(cell)) {
            if (existing instanceof Container && !restored.contains(existing)) {
                ((Container) existing).drain();
                existing.destroy();
            }
        }
    }

    private static int attachGroupLeaders(Region region, List<GroupController> leaders) {
        int attached = 0;
        for (GroupController controller : leaders) {
            if (controller.getDroppedReferences() > 0) {
                log.warn("{} lost {} owned creature reference(s) that were not restored", controller, controller.getDroppedReferences());
            }
            region.getGroupManager().add(controller);
            attached++;
        }
        if (attached > 0) {
            log.info("Restored {} group controller(s) for region {}", attached, region.getId());
        }
        return attached;
    }

    // ---------------------------------------------------------------------
    // Side registry
    // ---------------------------------------------------------------------

    private int drainSideRegistry(Region region, int regionId, IRandomProvider placementRandom) {
        World world = region.getWorld();
        Optional<SideRegistry> entry = world.getSideTable().tryGet(regionId);
        if (entry.isEmpty()) {
            return 0;
        }
        SideRegistry side = entry.get();
        WorldRegistry worldRegistry = world.getWorldRegistry();
        Faction player = world.getPlayerFaction();

        Set<Creature> current = Collections.newSetFromMap(new IdentityHashMap<>());
        side.getSleepingOccupants().forEach(r -> current.add(r.creature()));
        side.getContainerOccupants().forEach(r -> current.add(r.creature()));
        side.getOwnedAnimals().forEach(r -> current.add(r.creature()));
        side.getTrackedCreatures().forEach(r -> current.add(r.creature()));

        int legacy = 0;
        for (Creature creature : new ArrayList<>(side.getLegacyParked())) {
            if (!isRestorable(creature) || current.contains(creature)) {
                continue;
            }
            worldRegistry.remove(creature);
            spawnAtSavedPosition(region, creature, creature.getPosition(), placementRandom);
            legacy++;
        }
        if (legacy > 0) {
            log.info("(legacy) Restored {} parked creature(s) on region {}", legacy, regionId);
        }

        int sleeping = 0;
        for (ContainerOccupantRecord record : new ArrayList<>(side.getSleepingOccupants())) {
            Creature creature = record.creature();
            if (!isRestorable(creature)) {
                continue;
            }
            worldRegistry.remove(creature);
            if (player != null && creature.getFaction() != player) {
                creature.setFaction(player);
            }
            if (reinsert(region, record)) {
                sleeping++;
            } else {
                log.warn("No container at {} for {}; spawning free", record.containerCell(), creature);
                spawnFree(region, creature, record.containerCell(), placementRandom);
            }
        }
        if (sleeping > 0) {
            log.info("Restored {} sleeping occupant(s) into containers on region {}", sleeping, regionId);
        }

        int occupants = 0;
        for (ContainerOccupantRecord record : new ArrayList<>(side.getContainerOccupants())) {
            Creature creature = record.creature();
            if (!isRestorable(creature)) {
                continue;
            }
            if (worldRegistry.isTracked(creature)) {
                worldRegistry.remove(creature);
            }
            if (reinsert(region, record)) {
                occupants++;
            } else {
                log.warn("No container at {} for occupant {}; spawning free", record.containerCell(), creature);
                spawnFree(region, creature, record.containerCell(), placementRandom);
            }
        }
        if (occupants > 0) {
            log.info("Restored {} container occupant(s) on region {}", occupants, regionId);
        }

        int animals = 0;
        for (CreatureRecord record : new ArrayList<>(side.getOwnedAnimals())) {
            Creature creature = record.creature();
            if (!isRestorable(creature)) {
                continue;
            }
            if (worldRegistry.isTracked(creature)) {
                worldRegistry.remove(creature);
            }
            if (player != null && creature.getFaction() != player) {
                creature.setFaction(player);
            }
            spawnAtSavedPosition(region, creature, record.position(), placementRandom);
            animals++;
        }
        if (animals > 0) {
            log.info("Restored {} player animal(s) on region {}", animals, regionId);
        }

        int tracked = 0;
        for (CreatureRecord record : new ArrayList<>(side.getTrackedCreatures())) {
            Creature creature = record.creature();
            if (!isRestorable(creature)) {
                continue;
            }
            spawnAtSavedPosition(region, creature, record.position(), placementRandom);
            // saved tasks point at targets that no longer exist
            creature.clearTasks();
            tracked++;
        }
        if (tracked > 0) {
            log.info("Restored {} world-tracked creature(s) on region {}", tracked, regionId);
        }

        world.getSideTable().release(regionId);
        return legacy + sleeping + occupants + animals + tracked;
    }

    private static boolean isRestorable(Creature creature) {
        return creature != null && !creature.isDestroyed() && !creature.isSpawned();
    }

    private static boolean reinsert(Region region, ContainerOccupantRecord record) {
        Optional<Container> container = region.firstAt(record.containerCell(), Container.class);
        return container.isPresent() && container.get().tryAccept(record.creature());
    }

    private void spawnAtSavedPosition(Region region, Creature creature, Cell saved, IRandomProvider placementRandom) {
        Cell target = saved;
        if (saved == null || !region.isStandable(saved)) {
            target = findFallbackCell(region, saved, placementRandom);
            log.info("Saved position {} of {} is not standable; placing at {}", saved, creature, target);
        }
        region.spawn(creature, target, creature.getRotation());
    }

    private void spawnFree(Region region, Creature creature, Cell preferred, IRandomProvider placementRandom) {
        Cell target = preferred != null && region.isStandable(preferred)
            ? preferred
            : findFallbackCell(region, preferred, placementRandom);
        region.spawn(creature, target, Rotation.NORTH);
    }

    /**
     * Nearby standable cell, else any standable cell, else the saved cell clamped into bounds.
     */
    private static Cell findFallbackCell(Region region, Cell saved, IRandomProvider placementRandom) {
        Optional<Cell> found = Optional.empty();
        if (saved != null) {
            found = region.findStandableCellNear(saved, FALLBACK_SEARCH_RADIUS, placementRandom);
        }
        if (found.isEmpty()) {
            found = region.randomStandableCell(placementRandom);
        }
        if (found.isPresent()) {
            return found.get();
        }
        Cell base = saved != null ? saved : Cell.ORIGIN;
        return new Cell(Math.max(0, Math.min(region.getWidth() - 1, base.x())),
            Math.max(0, Math.min(region.getHeight() - 1, base.z())));
    }

    // ---------------------------------------------------------------------
    // Remaining layers
    // ---------------------------------------------------------------------

    private void applyRemainingGrids(Region region, ArchiveRecord record) {
        if (record.getRoof() != null) {
            gridCodec.deserializeShorts(record.getRoof(), region, (c, roof) -> {
                if (roof >= Region.ROOF_NONE && roof <= Region.ROOF_ROCK_THICK) {
                    region.setRoof(c, roof);
                }
            });
            int unsupported = region.recomputeStructuralSupport();
            region.clearCollapseQueue();
            if (unsupported > 0) {
                log.debug("Cleared {} pending roof collapse(s) on region {}", unsupported, region.getId());
            }
        }
        if (record.getSnow() != null) {
            gridCodec.deserializeBytes(record.getSnow(), region, region::setSnowDepth);
        }
        if (record.getPollution() != null && region.isPollutionActive()) {
            gridCodec.deserializeBytes(record.getPollution(), region, (c, v) -> region.setPolluted(c, v == 1));
        }
        if (record.getFog() != null) {
            region.refogAll();
            gridCodec.deserializeBytes(record.getFog(), region, (c, v) -> {
                if (v == 0) {
                    region.unfog(c);
                }
            });
        }
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private boolean checkPrerequisites(Region region, int regionId, String operation) {
        if (region == null) {
            log.error("Cannot {} region {}: no live region", operation, regionId);
            return false;
        }
        if (regionId < 0) {
            log.error("Cannot {} region: no region id available", operation);
            return false;
        }
        if (store == null) {
            log.error("Cannot {} region {}: no storage location configured", operation, regionId);
            return false;
        }
        String worldId = region.getWorld().getWorldId();
        if (worldId == null || worldId.isBlank()) {
            log.error("Cannot {} region {}: world has no persistent id", operation, regionId);
            return false;
        }
        return true;
    }

    private static List<IPersistableRegionComponent> persistableComponents(Region region) {
        List<IPersistableRegionComponent> result = new ArrayList<>();
        for (RegionComponent component : region.getComponents()) {
            if (component instanceof IPersistableRegionComponent) {
                result.add((IPersistableRegionComponent) component);
            }
        }
        return result;
    }

    private static String describeSession(IPersistenceSession session) {
        if (session instanceof JsonArchiveSession && ((JsonArchiveSession) session).getResolver() != null) {
            return ((JsonArchiveSession) session).getResolver().describe();
        }
        return "mode=" + session.getMode();
    }

    public ArchiveStore getStore() {
        return store;
    }

    public EligibilityClassifier getClassifier() {
        return classifier;
    }
}
