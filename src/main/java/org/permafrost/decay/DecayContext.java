package org.permafrost.decay;

import org.permafrost.runtime.model.Region;
import org.permafrost.runtime.spi.IClimateSampler;

/**
 * Immutable inputs of one offline decay run, built once per load.
 */
public final class DecayContext {

    private static final int FREEZE_THAW_SAMPLES = 12;

    private final Region region;
    private final long startTick;
    private final long elapsedTicks;
    private final int tileId;
    private final double rainfall;
    private final boolean freezeThaw;
    private final DecaySettings settings;

    /**
     * @param region Region being restored.
     * @param startTick Tick the region was abandoned at.
     * @param elapsedTicks Ticks spent archived; negative values are clamped to zero.
     * @param tileId World tile of the region.
     * @param rainfall Annual rainfall in mm.
     * @param freezeThaw Whether the tile crosses freezing during a year.
     * @param settings Time constants and coefficients.
     */
    public DecayContext(Region region, long startTick, long elapsedTicks, int tileId, double rainfall,
                        boolean freezeThaw, DecaySettings settings) {
        this.region = region;
        this.startTick = startTick;
        this.elapsedTicks = Math.max(0L, elapsedTicks);
        this.tileId = tileId;
        this.rainfall = rainfall;
        this.freezeThaw = freezeThaw;
        this.settings = settings;
    }

    /**
     * Samples the climate of the region's tile and builds the context.
     *
     * @param region Region being restored.
     * @param abandonedAtTick Tick stored in the archive.
     * @param now Current tick.
     * @param climate Climate sampler.
     * @param settings Decay settings.
     * @return the context
     */
    public static DecayContext build(Region region, long abandonedAtTick, long now, IClimateSampler climate, DecaySettings settings) {
        int tile = region.getTileId();
        return new DecayContext(region, abandonedAtTick, now - abandonedAtTick, tile, climate.rainfall(tile),
            hasFreezeThaw(climate, tile, abandonedAtTick, settings.getTicksPerYear()), settings);
    }

    /**
     * @return true if the seasonal temperature over one year has a minimum below 0 °C and a maximum above it
     */
    static boolean hasFreezeThaw(IClimateSampler climate, int tileId, long fromTick, long ticksPerYear) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < FREEZE_THAW_SAMPLES; i++) {
            double t = climate.seasonalTemperature(fromTick + i * ticksPerYear / FREEZE_THAW_SAMPLES, tileId);
            min = Math.min(min, t);
            max = Math.max(max, t);
        }
        return min < 0.0 && max > 0.0;
    }

    public Region getRegion() {
        return region;
    }

    public long getStartTick() {
        return startTick;
    }

    public long getElapsedTicks() {
        return elapsedTicks;
    }

    public long getEndTick() {
        return startTick + elapsedTicks;
    }

    public int getTileId() {
        return tileId;
    }

    public double getRainfall() {
        return rainfall;
    }

    public boolean isFreezeThaw() {
        return freezeThaw;
    }

    public DecaySettings getSettings() {
        return settings;
    }

    /**
     * @return rainfall mapped onto [0, 1]
     */
    public double normalizedRainfall() {
        return Math.max(0.0, Math.min(1.0, rainfall / settings.getRainfallNormalization()));
    }

    public double yearsPassed() {
        return (double) elapsedTicks / settings.getTicksPerYear();
    }

    public double daysPassed() {
        return (double) elapsedTicks / settings.getTicksPerDay();
    }

    @Override
    public String toString() {
        return String.format("DecayContext{region=%d, start=%d, elapsed=%d (%.2fy), tile=%d, rain=%.0f, freezeThaw=%s}",
            region != null ? region.getId() : -1, startTick, elapsedTicks, yearsPassed(), tileId, rainfall, freezeThaw);
    }
}
