package org.permafrost.archive.session;

import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.spi.IReferenceable;

import java.util.Collection;
import java.util.List;

/**
 * Writes named fields into one node of an archive document.
 */
public interface IArchiveWriter {

    void writeInt(String name, int value);

    void writeLong(String name, long value);

    void writeDouble(String name, double value);

    void writeBoolean(String name, boolean value);

    /**
     * @param name Field name.
     * @param value Value; null values are omitted.
     */
    void writeString(String name, String value);

    /**
     * @param name Field name.
     * @param value Raw bytes; null values are omitted.
     */
    void writeBytes(String name, byte[] value);

    /**
     * @param name Field name.
     * @param cell Cell; null values are omitted.
     */
    void writeCell(String name, Cell cell);

    /**
     * Writes the load id of a target instead of its state.
     *
     * @param name Field name.
     * @param target Target; null values are omitted.
     */
    void writeReference(String name, IReferenceable target);

    /**
     * @param name Field name.
     * @param targets Targets; null elements are kept as null entries.
     */
    void writeReferenceList(String name, Collection<? extends IReferenceable> targets);

    /**
     * Writes an object's full state into a child node.
     *
     * @param name Field name.
     * @param value Object; null values are omitted.
     * @param codec Codec for the object type.
     * @param <T> Object type.
     */
    <T> void writeDeep(String name, T value, IDeepCodec<T> codec);

    /**
     * @param name Field name.
     * @param values Objects; null lists are omitted.
     * @param codec Codec for the element type.
     * @param <T> Element type.
     */
    <T> void writeDeepList(String name, List<T> values, IDeepCodec<T> codec);

    /**
     * Creates (or replaces) a child node and returns a writer for it.
     *
     * @param name Field name.
     * @return writer for the new child
     */
    IArchiveWriter child(String name);
}
