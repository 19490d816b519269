package org.permafrost.decay;

import org.permafrost.runtime.model.Entity;
import org.permafrost.runtime.spi.IClimateSampler;

/**
 * Steps rot through the archived interval one hour at a time. The rot rate depends
 * non-linearly on temperature, so the interval is walked instead of integrated in one step.
 */
public final class PerishableDecay {

    private final IClimateSampler climate;

    public PerishableDecay(IClimateSampler climate) {
        this.climate = climate;
    }

    /**
     * @param entity A perishable entity.
     * @param ctx Decay context.
     * @return the outcome; the entity is not modified
     */
    public RotOutcome simulate(Entity entity, DecayContext ctx) {
        double threshold = entity.getRotThreshold();
        double rot = entity.getRotProgress();
        if (rot >= threshold) {
            return new RotOutcome(true, rot, ctx.getStartTick());
        }
        long step = ctx.getSettings().getTicksPerHour();
        long end = ctx.getEndTick();
        for (long tick = ctx.getStartTick(); tick < end; tick += step) {
            long length = Math.min(step, end - tick);
            double temperature = climate.seasonalTemperature(tick, ctx.getTileId()) + climate.diurnalOffset(tick, ctx.getTileId());
            double rate = climate.rotRateAtTemperature(temperature);
            double next = rot + rate * length;
            if (next >= threshold) {
                long crossing = tick + (long) Math.ceil((threshold - rot) / rate);
                return new RotOutcome(true, threshold, Math.min(crossing, tick + length));
            }
            rot = next;
        }
        return RotOutcome.fresh(rot);
    }

    /**
     * Simulates and applies: spoiled entities are destroyed, others get the new rot progress.
     *
     * @param entity A perishable entity.
     * @param ctx Decay context.
     * @return the outcome
     */
    public RotOutcome apply(Entity entity, DecayContext ctx) {
        RotOutcome outcome = simulate(entity, ctx);
        if (outcome.spoiled()) {
            entity.destroy();
        } else {
            entity.setRotProgress(outcome.rotProgress());
        }
        return outcome;
    }
}
