package org.permafrost.runtime.model;

import org.permafrost.runtime.spi.ITickClock;

/**
 * Simulation clock advanced explicitly by the host loop.
 */
public final class ManualTickClock implements ITickClock {

    private long tick;

    public ManualTickClock() {
        this(0L);
    }

    public ManualTickClock(long startTick) {
        this.tick = startTick;
    }

    @Override
    public long currentTick() {
        return tick;
    }

    /**
     * @param ticks Number of ticks to advance; must be non-negative.
     */
    public void advance(long ticks) {
        if (ticks < 0) {
            throw new IllegalArgumentException("Cannot advance clock by negative ticks: " + ticks);
        }
        tick += ticks;
    }

    public void setTick(long tick) {
        this.tick = tick;
    }
}
