package org.permafrost.runtime.spi;

/**
 * Read-only view of the host simulation clock.
 */
public interface ITickClock {

    /**
     * @return the current simulation tick
     */
    long currentTick();
}
