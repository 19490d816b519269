package org.permafrost.archive.session;

/**
 * Writes an object's full state into a node and constructs a new object from a node.
 * <p>
 * {@link #read(IArchiveReader)} acts as the factory for the loaded instance, so codecs for
 * wrappers around live objects can capture the live instance as a constructor argument.
 * </p>
 *
 * @param <T> the object type
 */
public interface IDeepCodec<T> {

    /**
     * @param value The object to write; never null.
     * @param out Writer positioned on the object's node.
     */
    void write(T value, IArchiveWriter out);

    /**
     * @param in Reader positioned on the object's node.
     * @return the loaded object; references are bound later during resolution
     */
    T read(IArchiveReader in);
}
