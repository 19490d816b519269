package org.permafrost.decay;

/**
 * Result of simulating rot over the archived interval.
 *
 * @param spoiled True if the rot threshold was reached.
 * @param rotProgress Accumulated rot; at the threshold crossing if spoiled.
 * @param spoiledAtTick Absolute tick at which the threshold was crossed, or -1.
 */
public record RotOutcome(boolean spoiled, double rotProgress, long spoiledAtTick) {

    public static RotOutcome fresh(double rotProgress) {
        return new RotOutcome(false, rotProgress, -1L);
    }
}
