package org.permafrost.runtime.internal.services;

import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.model.Region;
import org.permafrost.runtime.spi.IGridCodec;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.function.ObjIntConsumer;
import java.util.function.ToIntFunction;

/**
 * Default {@link IGridCodec}: row-major order (z outer, x inner), shorts little-endian.
 */
public final class RowMajorGridCodec implements IGridCodec {

    @Override
    public byte[] serializeShorts(Region region, ToIntFunction<Cell> cellFn) {
        ByteBuffer buffer = ByteBuffer.allocate(region.cellCount() * Short.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        region.forEachCell(c -> {
            int value = cellFn.applyAsInt(c);
            if (value < 0 || value > 0xFFFF) {
                throw new IllegalArgumentException("Short layer value out of range at " + c + ": " + value);
            }
            buffer.putShort((short) value);
        });
        return buffer.array();
    }

    @Override
    public byte[] serializeBytes(Region region, ToIntFunction<Cell> cellFn) {
        byte[] data = new byte[region.cellCount()];
        int[] i = {0};
        region.forEachCell(c -> {
            int value = cellFn.applyAsInt(c);
            if (value < 0 || value > 0xFF) {
                throw new IllegalArgumentException("Byte layer value out of range at " + c + ": " + value);
            }
            data[i[0]++] = (byte) value;
        });
        return data;
    }

    @Override
    public void deserializeShorts(byte[] data, Region region, ObjIntConsumer<Cell> applyFn) {
        requireLength(data, region.cellCount() * Short.BYTES, region);
        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        region.forEachCell(c -> applyFn.accept(c, buffer.getShort() & 0xFFFF));
    }

    @Override
    public void deserializeBytes(byte[] data, Region region, ObjIntConsumer<Cell> applyFn) {
        requireLength(data, region.cellCount(), region);
        int[] i = {0};
        region.forEachCell(c -> applyFn.accept(c, data[i[0]++] & 0xFF));
    }

    private static void requireLength(byte[] data, int expected, Region region) {
        if (data == null || data.length != expected) {
            throw new IllegalArgumentException("Grid layer of " + (data == null ? 0 : data.length)
                + " bytes does not match region " + region.getId() + " (" + expected + " bytes expected)");
        }
    }
}
