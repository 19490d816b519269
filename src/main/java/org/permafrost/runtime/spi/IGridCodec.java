package org.permafrost.runtime.spi;

import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.model.Region;

import java.util.function.ObjIntConsumer;
import java.util.function.ToIntFunction;

/**
 * Flattens uniform per-cell scalar layers of a region into byte buffers and back.
 * <p>
 * Exactly one scalar is produced per cell, in a fixed iteration order shared by
 * serialization and deserialization.
 * </p>
 */
public interface IGridCodec {

    /**
     * Encodes one unsigned 16-bit value per cell.
     *
     * @param region The region to iterate.
     * @param cellFn Value provider, must return values in [0, 65535].
     * @return encoded layer
     */
    byte[] serializeShorts(Region region, ToIntFunction<Cell> cellFn);

    /**
     * Encodes one unsigned 8-bit value per cell.
     *
     * @param region The region to iterate.
     * @param cellFn Value provider, must return values in [0, 255].
     * @return encoded layer
     */
    byte[] serializeBytes(Region region, ToIntFunction<Cell> cellFn);

    /**
     * Decodes a 16-bit layer and hands each cell's value to {@code applyFn}.
     *
     * @param data Encoded layer.
     * @param region Target region.
     * @param applyFn Receives cell and value.
     * @throws IllegalArgumentException if the buffer does not match the region size
     */
    void deserializeShorts(byte[] data, Region region, ObjIntConsumer<Cell> applyFn);

    /**
     * Decodes an 8-bit layer and hands each cell's value to {@code applyFn}.
     *
     * @param data Encoded layer.
     * @param region Target region.
     * @param applyFn Receives cell and value.
     * @throws IllegalArgumentException if the buffer does not match the region size
     */
    void deserializeBytes(byte[] data, Region region, ObjIntConsumer<Cell> applyFn);
}
