package org.permafrost.archive.session;

import org.permafrost.runtime.model.Cell;
import org.permafrost.runtime.spi.IReferenceable;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Reads named fields from one node of an archive document during the
 * {@link SessionMode#LOADING_VARS} phase.
 */
public interface IArchiveReader {

    boolean has(String name);

    int readInt(String name, int defaultValue);

    long readLong(String name, long defaultValue);

    double readDouble(String name, double defaultValue);

    boolean readBoolean(String name, boolean defaultValue);

    String readString(String name, String defaultValue);

    /**
     * @param name Field name.
     * @return the bytes, or null if the field is absent
     * @throws ArchiveFormatException if the value is not Base64 text
     */
    byte[] readBytes(String name);

    /**
     * @param name Field name.
     * @return the cell, or null if the field is absent
     */
    Cell readCell(String name);

    /**
     * Records a reference to be bound during cross-reference resolution. The setter is
     * called exactly once, with null if the target cannot be found. Absent fields are ignored.
     *
     * @param name Field name.
     * @param type Expected target type.
     * @param setter Receives the resolved target.
     * @param <T> Target type.
     */
    <T extends IReferenceable> void readReference(String name, Class<T> type, Consumer<T> setter);

    /**
     * Records a list of references; unresolved entries become null elements.
     *
     * @param name Field name.
     * @param type Expected target type.
     * @param setter Receives the resolved list.
     * @param <T> Target type.
     */
    <T extends IReferenceable> void readReferenceList(String name, Class<T> type, Consumer<List<T>> setter);

    /**
     * Reads an object through its codec. A loaded {@link IReferenceable} is registered as a
     * cross-reference target of this session.
     *
     * @param name Field name.
     * @param codec Codec.
     * @param <T> Object type.
     * @return the object, or null if absent
     */
    <T> T readDeep(String name, IDeepCodec<T> codec);

    /**
     * @param name Field name.
     * @param codec Element codec.
     * @param <T> Element type.
     * @return the objects, empty if absent
     */
    <T> List<T> readDeepList(String name, IDeepCodec<T> codec);

    /**
     * @param name Field name.
     * @return reader for the child node, or empty if absent
     */
    Optional<IArchiveReader> child(String name);

    /**
     * Queues an action for the post-load initialization phase of this session.
     *
     * @param action The action.
     */
    void onPostLoadInit(Runnable action);
}
