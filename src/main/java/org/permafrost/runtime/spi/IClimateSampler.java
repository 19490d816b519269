package org.permafrost.runtime.spi;

/**
 * Pure read-only climate queries of the host simulation.
 * <p>
 * All methods must be deterministic for identical arguments so that offline decay
 * computed from them is reproducible.
 * </p>
 */
public interface IClimateSampler {

    /**
     * Seasonal outdoor temperature at a world tile.
     *
     * @param tick Absolute simulation tick.
     * @param tileId World tile id.
     * @return temperature in degrees Celsius
     */
    double seasonalTemperature(long tick, int tileId);

    /**
     * Day/night temperature swing added on top of the seasonal value.
     *
     * @param tick Absolute simulation tick.
     * @param tileId World tile id.
     * @return offset in degrees Celsius
     */
    double diurnalOffset(long tick, int tileId);

    /**
     * Annual rainfall of a world tile in millimetres.
     *
     * @param tileId World tile id.
     * @return rainfall, non-negative
     */
    double rainfall(int tileId);

    /**
     * Converts a temperature into a rot rate (rot progress per tick).
     *
     * @param celsius Temperature in degrees Celsius.
     * @return rot rate, non-negative
     */
    double rotRateAtTemperature(double celsius);
}
