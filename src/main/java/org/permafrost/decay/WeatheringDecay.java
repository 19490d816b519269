package org.permafrost.decay;

import org.permafrost.runtime.model.Entity;
import org.permafrost.runtime.model.EntityCategory;

/**
 * Hit point loss of items left outdoors and of structures, as a closed-form function of the
 * archived interval.
 */
public final class WeatheringDecay {

    /**
     * @param ctx Decay context.
     * @return hit points an unroofed item loses over the interval
     */
    public int outdoorDamage(DecayContext ctx) {
        DecaySettings s = ctx.getSettings();
        double intervals = (double) ctx.getElapsedTicks() / s.getOutdoorIntervalTicks();
        double rainFactor = lerp(0.5, 2.0, ctx.normalizedRainfall());
        return (int) Math.round(intervals * s.getOutdoorDamagePerInterval() * rainFactor);
    }

    /**
     * Damages an unroofed item. Roofed items and other categories are left alone.
     *
     * @param entity A spawned entity.
     * @param ctx Decay context.
     * @return hit points removed
     */
    public int applyOutdoor(Entity entity, DecayContext ctx) {
        if (entity.getCategory() != EntityCategory.ITEM || entity.getMaxHitPoints() <= 0
                || ctx.getRegion().isRoofed(entity.getPosition())) {
            return 0;
        }
        int damage = Math.min(outdoorDamage(ctx), entity.getHitPoints());
        return damage > 0 ? damage(entity, damage) : 0;
    }

    /**
     * @param entity A structure.
     * @param roofed Whether its cell is roofed.
     * @param ctx Decay context.
     * @return the fraction of maximum hit points lost over the interval, in [0, 1]
     */
    public double structuralFraction(Entity entity, boolean roofed, DecayContext ctx) {
        DecaySettings s = ctx.getSettings();
        double material = s.materialFactor(entity.getMaterial());
        double exposure = roofed ? s.getRoofedExposure() : 1.0;
        double rain = roofed ? 1.0 : 0.5 + 1.5 * ctx.normalizedRainfall();
        double freeze = ctx.isFreezeThaw() ? s.getFreezeThawFactor() : 1.0;
        double fraction = ctx.yearsPassed() * material * exposure * rain * freeze;
        return Math.max(0.0, Math.min(1.0, fraction));
    }

    /**
     * Applies material decay to a structure. Natural rock is exempt; frames are a separate category.
     *
     * @param entity A spawned entity.
     * @param ctx Decay context.
     * @return hit points removed
     */
    public int applyStructural(Entity entity, DecayContext ctx) {
        if (!isDecayingStructure(entity)) {
            return 0;
        }
        double fraction = structuralFraction(entity, ctx.getRegion().isRoofed(entity.getPosition()), ctx);
        int damage = Math.min((int) Math.round(entity.getMaxHitPoints() * fraction), entity.getHitPoints());
        return damage > 0 ? damage(entity, damage) : 0;
    }

    static boolean isDecayingStructure(Entity entity) {
        return entity.getCategory() == EntityCategory.BUILDING && !entity.isNaturalRock()
            && !entity.isDestroyed() && entity.getMaxHitPoints() > 0;
    }

    static int damage(Entity entity, int amount) {
        entity.setHitPoints(entity.getHitPoints() - amount);
        if (entity.getHitPoints() <= 0) {
            entity.destroy();
        }
        return amount;
    }

    private static double lerp(double a, double b, double t) {
        return a + (b - a) * t;
    }
}
