package org.permafrost.decay;

import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.model.Region;
import org.permafrost.runtime.spi.IRandomProvider;

/**
 * Removes constructed floors from unroofed cells, one draw per cell against the cumulative
 * removal probability of the interval.
 */
public final class FloorErosion {

    /**
     * @param ctx Decay context.
     * @return probability that an unroofed floor is gone after the interval
     */
    public double removalProbability(DecayContext ctx) {
        DecaySettings s = ctx.getSettings();
        double rainMod = 0.5 + 1.5 * ctx.normalizedRainfall();
        double freezeMod = ctx.isFreezeThaw() ? s.getFloorFreezeFactor() : 1.0;
        double perYear = Math.min(1.0, s.getFloorBaseChancePerYear() * rainMod * freezeMod);
        return 1.0 - Math.pow(1.0 - perYear, ctx.yearsPassed());
    }

    /**
     * @param region Region to erode.
     * @param ctx Decay context.
     * @param random Random source.
     * @return number of floors removed
     */
    public int apply(Region region, DecayContext ctx, IRandomProvider random) {
        double p = removalProbability(ctx);
        if (p <= 0.0) {
            return 0;
        }
        int removed = 0;
        for (int i = 0; i < region.cellCount(); i++) {
            Cell c = region.cellAt(i);
            if (region.hasConstructedFloor(c) && !region.isRoofed(c) && random.chance(p)) {
                region.removeFloor(c);
                removed++;
            }
        }
        return removed;
    }
}
