package org.permafrost.decay;

import org.permafrost.runtime.model.Entity;
import org.permafrost.runtime.model.Region;
import org.permafrost.runtime.spi.IClimateSampler;
import org.permafrost.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Reconstructs the effect of an archived interval on a restored region without replaying it.
 * <p>
 * All passes are deterministic functions of the {@link DecayContext}; discrete events draw from
 * sub-streams of the given random provider derived per region, so a given seed reproduces
 * the same outcome. Zero elapsed time leaves every entity and cell untouched.
 * </p>
 */
public final class DecayEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DecayEngine.class);

    private final IClimateSampler climate;
    private final DecaySettings settings;
    private final PerishableDecay perishables;
    private final WeatheringDecay weathering = new WeatheringDecay();
    private final FloorErosion floorErosion = new FloorErosion();
    private final StructuralFailureSimulator failures = new StructuralFailureSimulator();

    public DecayEngine(IClimateSampler climate, DecaySettings settings) {
        this.climate = climate;
        this.settings = settings;
        this.perishables = new PerishableDecay(climate);
    }

    /**
     * @param region Region being restored.
     * @param abandonedAtTick Tick stored in the archive.
     * @param now Current tick.
     * @return the context for this restore
     */
    public DecayContext buildContext(Region region, long abandonedAtTick, long now) {
        return DecayContext.build(region, abandonedAtTick, now, climate, settings);
    }

    /**
     * Evaluates rot of an unplaced perishable. Spoiled entities are destroyed; others get
     * their new rot progress.
     *
     * @param entity A perishable entity.
     * @param ctx Decay context.
     * @param report Report to update, may be null.
     * @return the outcome
     */
    public RotOutcome applyRot(Entity entity, DecayContext ctx, DecayReport report) {
        RotOutcome outcome = perishables.apply(entity, ctx);
        if (report != null) {
            report.recordRot(outcome);
        }
        if (outcome.spoiled()) {
            LOG.debug("{} spoiled at tick {} while archived", entity, outcome.spoiledAtTick());
        }
        return outcome;
    }

    /**
     * Runs the per-entity and region passes over restored entities.
     *
     * @param region The restored region.
     * @param restored Entities placed by the restore.
     * @param ctx Decay context.
     * @param random Random source for discrete events.
     * @param report Report to complete; perishables evaluated at placement are already counted.
     * @return the report
     */
    public DecayReport run(Region region, Collection<? extends Entity> restored, DecayContext ctx,
                           IRandomProvider random, DecayReport report) {
        if (ctx.getElapsedTicks() == 0) {
            return report;
        }
        for (Entity entity : restored) {
            if (entity.isDestroyed() || entity.getRegion() != region) {
                continue;
            }
            int outdoor = weathering.applyOutdoor(entity, ctx);
            if (outdoor > 0) {
                report.recordItem(entity.isDestroyed());
                continue;
            }
            int structural = weathering.applyStructural(entity, ctx);
            if (structural > 0) {
                report.recordStructure(entity.isDestroyed());
            }
        }
        report.setFloorsEroded(floorErosion.apply(region, ctx, random.deriveFor("floorErosion", region.getId())));
        report.setFailures(failures.simulate(region, ctx, random.deriveFor("structuralFailure", region.getId())));
        if (!report.isEmpty()) {
            LOG.info("Offline decay for region {} over {} years: {}", region.getId(),
                String.format("%.2f", ctx.yearsPassed()), report);
        }
        return report;
    }

    public DecaySettings getSettings() {
        return settings;
    }
}
