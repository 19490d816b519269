package org.permafrost.runtime.spi;

/**
 * An object that can be the target of a cross-reference inside a persistence session.
 * <p>
 * The load id must be stable across save and load and unique among all live objects
 * of the world. Two distinct instances sharing a load id are an identity collision.
 * </p>
 */
public interface IReferenceable {

    /**
     * Returns the stable unique load id of this object (e.g. {@code "Thing_42"}).
     *
     * @return the load id, never null
     */
    String getUniqueLoadId();
}
