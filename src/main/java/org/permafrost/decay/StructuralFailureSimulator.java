package org.permafrost.decay;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.model.Entity;
import org.permafrost.runtime.model.Region;
import org.permafrost.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Discrete collapse events over the archived interval. Each event picks an epicenter structure
 * and damages structures and floors around it with a power-law falloff.
 */
public final class StructuralFailureSimulator {

    private static final Logger LOG = LoggerFactory.getLogger(StructuralFailureSimulator.class);

    /**
     * Outcome of the failure pass.
     *
     * @param events Events simulated.
     * @param structuresDamaged Structures that lost hit points.
     * @param structuresDestroyed Structures destroyed.
     * @param floorsRemoved Floors removed.
     */
    public record FailureReport(int events, int structuresDamaged, int structuresDestroyed, int floorsRemoved) {
        public static final FailureReport NONE = new FailureReport(0, 0, 0, 0);
    }

    /**
     * @param ctx Decay context.
     * @param roofedFraction Fraction of candidate structures standing under a roof.
     * @return mean time between failures in days
     */
    public double adjustedMtbfDays(DecayContext ctx, double roofedFraction) {
        DecaySettings s = ctx.getSettings();
        double mtbf = s.getBaseMtbfDays() / (1.0 + ctx.normalizedRainfall());
        if (ctx.isFreezeThaw()) {
            mtbf *= s.getFreezeThawMtbfFactor();
        }
        return mtbf * (0.5 + 0.5 * roofedFraction);
    }

    /**
     * @param ctx Decay context.
     * @param roofedFraction Roofed fraction of candidates.
     * @param random Random source for the fractional remainder.
     * @return number of events, at most the configured cap
     */
    public int eventCount(DecayContext ctx, double roofedFraction, IRandomProvider random) {
        if (ctx.yearsPassed() < ctx.getSettings().getMinYearsForFailures()) {
            return 0;
        }
        double expected = ctx.daysPassed() / adjustedMtbfDays(ctx, roofedFraction);
        int cap = ctx.getSettings().getMaxFailureEvents();
        return Math.min(random.roundStochastically(Math.min(expected, cap)), cap);
    }

    /**
     * @param ctx Decay context.
     * @return event severity, 0 at no elapsed time and saturating towards 1
     */
    public double severity(DecayContext ctx) {
        return 1.0 - Math.exp(-ctx.yearsPassed() / ctx.getSettings().getSeverityTimeConstantYears());
    }

    /**
     * @param region Region with restored structures.
     * @param ctx Decay context.
     * @param random Random source.
     * @return what happened
     */
    public FailureReport simulate(Region region, DecayContext ctx, IRandomProvider random) {
        List<Entity> candidates = candidates(region);
        if (candidates.isEmpty() || ctx.yearsPassed() < ctx.getSettings().getMinYearsForFailures()) {
            return FailureReport.NONE;
        }
        int roofed = 0;
        for (Entity e : candidates) {
            if (region.isRoofed(e.getPosition())) {
                roofed++;
            }
        }
        int events = eventCount(ctx, (double) roofed / candidates.size(), random);
        DecaySettings s = ctx.getSettings();
        double severity = severity(ctx);
        LongSet damaged = new LongOpenHashSet();
        int destroyed = 0;
        int floors = 0;
        int ran = 0;
        for (int n = 0; n < events; n++) {
            Entity epicenter = pickEpicenter(region, candidates, random, s.getUnroofedEpicenterWeight());
            if (epicenter == null) {
                break;
            }
            ran++;
            Cell center = epicenter.getPosition();
            double radius = random.nextDouble(s.getMinFailureRadius(), s.getMaxFailureRadius());
            double epicenterMult = region.isRoofed(center) ? s.getRoofedEpicenterMultiplier() : 1.0;

            for (Entity target : new ArrayList<>(candidates)) {
                if (target.isDestroyed()) {
                    continue;
                }
                double d = target.getPosition().distanceTo(center);
                if (d > radius) {
                    continue;
                }
                double targetMult = region.isRoofed(target.getPosition()) ? s.getRoofedTargetMultiplier() : 1.0;
                double fraction = severity * falloff(d, radius, s.getFalloffExponent()) * epicenterMult * targetMult;
                int amount = Math.min((int) Math.round(target.getMaxHitPoints() * fraction), target.getHitPoints());
                if (amount > 0) {
                    WeatheringDecay.damage(target, amount);
                    damaged.add(target.getId());
                    if (target.isDestroyed()) {
                        destroyed++;
                    }
                }
            }
            floors += removeFloors(region, center, radius, severity * epicenterMult, random, s);
            candidates.removeIf(Entity::isDestroyed);
        }
        if (ran > 0) {
            LOG.debug("Region {}: {} structural failure event(s), severity {}", region.getId(), ran, String.format("%.3f", severity));
        }
        return new FailureReport(ran, damaged.size(), destroyed, floors);
    }

    private static List<Entity> candidates(Region region) {
        List<Entity> result = new ArrayList<>();
        for (Entity e : region.getEntities()) {
            if (WeatheringDecay.isDecayingStructure(e)) {
                result.add(e);
            }
        }
        return result;
    }

    private static Entity pickEpicenter(Region region, List<Entity> survivors, IRandomProvider random, double unroofedWeight) {
        if (survivors.isEmpty()) {
            return null;
        }
        List<Entity> unroofed = new ArrayList<>();
        for (Entity e : survivors) {
            if (!region.isRoofed(e.getPosition())) {
                unroofed.add(e);
            }
        }
        if (!unroofed.isEmpty() && random.chance(unroofedWeight)) {
            return random.pick(unroofed);
        }
        return random.pick(survivors);
    }

    private static int removeFloors(Region region, Cell center, double radius, double scale, IRandomProvider random, DecaySettings s) {
        int r = (int) Math.ceil(radius);
        int removed = 0;
        for (int dz = -r; dz <= r; dz++) {
            for (int dx = -r; dx <= r; dx++) {
                Cell c = center.offset(dx, dz);
                if (!region.inBounds(c) || !region.hasConstructedFloor(c)) {
                    continue;
                }
                double d = c.distanceTo(center);
                if (d > radius) {
                    continue;
                }
                double exposure = region.isRoofed(c) ? s.getRoofedTargetMultiplier() : 1.0;
                if (random.chance(scale * falloff(d, radius, s.getFalloffExponent()) * exposure)) {
                    region.removeFloor(c);
                    removed++;
                }
            }
        }
        return removed;
    }

    static double falloff(double distance, double radius, double exponent) {
        return Math.pow(Math.max(0.0, 1.0 - distance / radius), exponent);
    }
}
