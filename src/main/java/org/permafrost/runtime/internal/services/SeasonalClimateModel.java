package org.permafrost.runtime.internal.services;

import it.unimi.dsi.fastutil.ints.Int2DoubleMap;
import it.unimi.dsi.fastutil.ints.Int2DoubleOpenHashMap;
import org.permafrost.runtime.spi.IClimateSampler;

/**
 * Sinusoidal reference climate used when no host climate is attached (CLI, tests).
 * <p>
 * The seasonal curve peaks at mid-year, the diurnal curve at mid-day. Rot rate follows the
 * usual refrigeration curve: zero at or below freezing, rising linearly to 1 per tick at 10 °C.
 * </p>
 */
public final class SeasonalClimateModel implements IClimateSampler {

    private final double meanTemperature;
    private final double seasonalAmplitude;
    private final double diurnalAmplitude;
    private final double defaultRainfall;
    private final long ticksPerYear;
    private final long ticksPerDay;
    private final Int2DoubleMap tileRainfall = new Int2DoubleOpenHashMap();
    private final Int2DoubleMap tileTemperatureOffset = new Int2DoubleOpenHashMap();

    /**
     * @param meanTemperature Annual mean in °C.
     * @param seasonalAmplitude Half the summer/winter spread in °C.
     * @param diurnalAmplitude Half the day/night spread in °C.
     * @param defaultRainfall Annual rainfall in mm for tiles without an override.
     * @param ticksPerYear Length of a year in ticks.
     * @param ticksPerDay Length of a day in ticks.
     */
    public SeasonalClimateModel(double meanTemperature, double seasonalAmplitude, double diurnalAmplitude,
                                double defaultRainfall, long ticksPerYear, long ticksPerDay) {
        if (ticksPerYear <= 0 || ticksPerDay <= 0) {
            throw new IllegalArgumentException("Year and day length must be positive");
        }
        this.meanTemperature = meanTemperature;
        this.seasonalAmplitude = seasonalAmplitude;
        this.diurnalAmplitude = diurnalAmplitude;
        this.defaultRainfall = Math.max(0.0, defaultRainfall);
        this.ticksPerYear = ticksPerYear;
        this.ticksPerDay = ticksPerDay;
    }

    /**
     * Overrides the climate of a single tile.
     *
     * @param tileId World tile id.
     * @param rainfall Annual rainfall in mm.
     * @param temperatureOffset Offset added to the seasonal temperature.
     * @return this model
     */
    public SeasonalClimateModel withTile(int tileId, double rainfall, double temperatureOffset) {
        tileRainfall.put(tileId, Math.max(0.0, rainfall));
        tileTemperatureOffset.put(tileId, temperatureOffset);
        return this;
    }

    @Override
    public double seasonalTemperature(long tick, int tileId) {
        double phase = (double) Math.floorMod(tick, ticksPerYear) / ticksPerYear;
        double offset = tileTemperatureOffset.getOrDefault(tileId, 0.0);
        return meanTemperature + offset - seasonalAmplitude * Math.cos(2.0 * Math.PI * phase);
    }

    @Override
    public double diurnalOffset(long tick, int tileId) {
        double phase = (double) Math.floorMod(tick, ticksPerDay) / ticksPerDay;
        return -diurnalAmplitude * Math.cos(2.0 * Math.PI * phase);
    }

    @Override
    public double rainfall(int tileId) {
        return tileRainfall.getOrDefault(tileId, defaultRainfall);
    }

    @Override
    public double rotRateAtTemperature(double celsius) {
        if (celsius <= 0.0) {
            return 0.0;
        }
        if (celsius >= 10.0) {
            return 1.0;
        }
        return celsius / 10.0;
    }
}
