package org.permafrost.decay;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.permafrost.runtime.model.Material;

import java.util.EnumMap;
import java.util.Map;

/**
 * Time constants and coefficients of the offline decay model.
 * <p>
 * Read from the {@code permafrost.decay} block; every key is optional and falls back to the
 * built-in default.
 * </p>
 */
public final class DecaySettings {

    public static final long DEFAULT_TICKS_PER_HOUR = 2_500L;
    public static final long DEFAULT_TICKS_PER_DAY = 60_000L;
    public static final long DEFAULT_TICKS_PER_YEAR = 3_600_000L;

    private final long ticksPerHour;
    private final long ticksPerDay;
    private final long ticksPerYear;
    private final double rainfallNormalization;
    private final long outdoorIntervalTicks;
    private final double outdoorDamagePerInterval;
    private final Map<Material, Double> materialFactors = new EnumMap<>(Material.class);
    private final double roofedExposure;
    private final double freezeThawFactor;
    private final double floorBaseChancePerYear;
    private final double floorFreezeFactor;
    private final double baseMtbfDays;
    private final double freezeThawMtbfFactor;
    private final double minYearsForFailures;
    private final int maxFailureEvents;
    private final double unroofedEpicenterWeight;
    private final double minFailureRadius;
    private final double maxFailureRadius;
    private final double falloffExponent;
    private final double roofedEpicenterMultiplier;
    private final double roofedTargetMultiplier;
    private final double severityTimeConstantYears;

    private DecaySettings(Config c) {
        this.ticksPerHour = c.hasPath("ticks-per-hour") ? c.getLong("ticks-per-hour") : DEFAULT_TICKS_PER_HOUR;
        this.ticksPerDay = c.hasPath("ticks-per-day") ? c.getLong("ticks-per-day") : DEFAULT_TICKS_PER_DAY;
        this.ticksPerYear = c.hasPath("ticks-per-year") ? c.getLong("ticks-per-year") : DEFAULT_TICKS_PER_YEAR;
        if (ticksPerHour <= 0 || ticksPerDay <= 0 || ticksPerYear <= 0) {
            throw new IllegalArgumentException("Decay time constants must be positive");
        }
        this.rainfallNormalization = c.hasPath("rainfall-normalization") ? c.getDouble("rainfall-normalization") : 4000.0;
        this.outdoorIntervalTicks = c.hasPath("outdoor.interval-ticks") ? c.getLong("outdoor.interval-ticks") : 250L;
        this.outdoorDamagePerInterval = c.hasPath("outdoor.damage-per-interval") ? c.getDouble("outdoor.damage-per-interval") : 0.015;

        materialFactors.put(Material.WOOD, 0.15);
        materialFactors.put(Material.METAL, 0.07);
        materialFactors.put(Material.STONE, 0.02);
        materialFactors.put(Material.NONE, 0.04);
        materialFactors.put(Material.OTHER, 0.05);
        if (c.hasPath("structural.material-factors")) {
            Config factors = c.getConfig("structural.material-factors");
            for (Material m : Material.values()) {
                String key = m.name().toLowerCase();
                if (factors.hasPath(key)) {
                    materialFactors.put(m, factors.getDouble(key));
                }
            }
        }
        this.roofedExposure = c.hasPath("structural.roofed-exposure") ? c.getDouble("structural.roofed-exposure") : 0.08;
        this.freezeThawFactor = c.hasPath("structural.freeze-thaw-factor") ? c.getDouble("structural.freeze-thaw-factor") : 1.4;

        this.floorBaseChancePerYear = c.hasPath("floor.base-chance-per-year") ? c.getDouble("floor.base-chance-per-year") : 0.06;
        this.floorFreezeFactor = c.hasPath("floor.freeze-thaw-factor") ? c.getDouble("floor.freeze-thaw-factor") : 1.5;

        this.baseMtbfDays = c.hasPath("failure.base-mtbf-days") ? c.getDouble("failure.base-mtbf-days") : 300.0;
        this.freezeThawMtbfFactor = c.hasPath("failure.freeze-thaw-mtbf-factor") ? c.getDouble("failure.freeze-thaw-mtbf-factor") : 0.7;
        this.minYearsForFailures = c.hasPath("failure.min-years") ? c.getDouble("failure.min-years") : 0.25;
        this.maxFailureEvents = c.hasPath("failure.max-events") ? c.getInt("failure.max-events") : 8;
        this.unroofedEpicenterWeight = c.hasPath("failure.unroofed-epicenter-weight") ? c.getDouble("failure.unroofed-epicenter-weight") : 0.75;
        this.minFailureRadius = c.hasPath("failure.min-radius") ? c.getDouble("failure.min-radius") : 2.0;
        this.maxFailureRadius = c.hasPath("failure.max-radius") ? c.getDouble("failure.max-radius") : 6.0;
        this.falloffExponent = c.hasPath("failure.falloff-exponent") ? c.getDouble("failure.falloff-exponent") : 1.8;
        this.roofedEpicenterMultiplier = c.hasPath("failure.roofed-epicenter-multiplier") ? c.getDouble("failure.roofed-epicenter-multiplier") : 0.65;
        this.roofedTargetMultiplier = c.hasPath("failure.roofed-target-multiplier") ? c.getDouble("failure.roofed-target-multiplier") : 0.35;
        this.severityTimeConstantYears = c.hasPath("failure.severity-time-constant-years") ? c.getDouble("failure.severity-time-constant-years") : 5.0;
        if (minFailureRadius <= 0 || maxFailureRadius < minFailureRadius) {
            throw new IllegalArgumentException("Invalid failure radius range [" + minFailureRadius + ", " + maxFailureRadius + "]");
        }
    }

    /**
     * @param decayConfig The {@code permafrost.decay} block.
     * @return settings with defaults for missing keys
     */
    public static DecaySettings fromConfig(Config decayConfig) {
        return new DecaySettings(decayConfig);
    }

    public static DecaySettings defaults() {
        return new DecaySettings(ConfigFactory.empty());
    }

    public long getTicksPerHour() {
        return ticksPerHour;
    }

    public long getTicksPerDay() {
        return ticksPerDay;
    }

    public long getTicksPerYear() {
        return ticksPerYear;
    }

    public double getRainfallNormalization() {
        return rainfallNormalization;
    }

    public long getOutdoorIntervalTicks() {
        return outdoorIntervalTicks;
    }

    public double getOutdoorDamagePerInterval() {
        return outdoorDamagePerInterval;
    }

    public double materialFactor(Material material) {
        return materialFactors.getOrDefault(material, materialFactors.get(Material.OTHER));
    }

    public double getRoofedExposure() {
        return roofedExposure;
    }

    public double getFreezeThawFactor() {
        return freezeThawFactor;
    }

    public double getFloorBaseChancePerYear() {
        return floorBaseChancePerYear;
    }

    public double getFloorFreezeFactor() {
        return floorFreezeFactor;
    }

    public double getBaseMtbfDays() {
        return baseMtbfDays;
    }

    public double getFreezeThawMtbfFactor() {
        return freezeThawMtbfFactor;
    }

    public double getMinYearsForFailures() {
        return minYearsForFailures;
    }

    public int getMaxFailureEvents() {
        return maxFailureEvents;
    }

    public double getUnroofedEpicenterWeight() {
        return unroofedEpicenterWeight;
    }

    public double getMinFailureRadius() {
        return minFailureRadius;
    }

    public double getMaxFailureRadius() {
        return maxFailureRadius;
    }

    public double getFalloffExponent() {
        return falloffExponent;
    }

    public double getRoofedEpicenterMultiplier() {
        return roofedEpicenterMultiplier;
    }

    public double getRoofedTargetMultiplier() {
        return roofedTargetMultiplier;
    }

    public double getSeverityTimeConstantYears() {
        return severityTimeConstantYears;
    }
}
