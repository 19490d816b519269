package org.permafrost.archive;

import org.permafrost.runtime.model.Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;

/**
 * Hooks the archiver into region deactivation and activation.
 * <p>
 * Saving runs synchronously before the host tears the region down. Loading is handed to an
 * executor so the host can finish generating the region first; the default executor runs the
 * load inline.
 * </p>
 */
public class RegionLifecycleTrigger {

    private static final Logger log = LoggerFactory.getLogger(RegionLifecycleTrigger.class);

    private final RegionArchiver archiver;
    private final Executor deferredLoads;

    public RegionLifecycleTrigger(RegionArchiver archiver) {
        this(archiver, Runnable::run);
    }

    /**
     * @param archiver The archiver.
     * @param deferredLoads Executor that runs loads once generation has finished.
     */
    public RegionLifecycleTrigger(RegionArchiver archiver, Executor deferredLoads) {
        this.archiver = archiver;
        this.deferredLoads = deferredLoads;
    }

    /**
     * Called just before a region is torn down.
     *
     * @param region The live region.
     * @param regionId Its id.
     * @return true if the region was archived
     */
    public boolean onRegionDeactivated(Region region, int regionId) {
        return archiver.save(region, regionId);
    }

    /**
     * Called after a region has been freshly generated. Schedules a restore if an archive
     * exists for it.
     *
     * @param region The freshly generated region.
     * @param regionId Its id.
     * @return true if a restore was scheduled
     */
    public boolean onRegionActivated(Region region, int regionId) {
        if (!archiver.archiveExists(region, regionId)) {
            return false;
        }
        log.debug("Scheduling restore of region {}", regionId);
        deferredLoads.execute(() -> archiver.load(region, regionId)
            .ifPresent(result -> log.debug("Region {} restore finished: {}", regionId, result)));
        return true;
    }

    public RegionArchiver getArchiver() {
        return archiver;
    }
}
