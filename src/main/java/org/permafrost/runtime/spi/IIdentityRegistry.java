package org.permafrost.runtime.spi;

import java.util.Optional;

/**
 * Tracks which object currently owns each unique load id.
 * <p>
 * Registering the same instance again is allowed and counted; registering a different
 * instance under an id that is already taken throws {@link IdentityCollisionException}.
 * An id is released once every registration of its owner has been removed.
 * </p>
 */
public interface IIdentityRegistry {

    /**
     * Registers an object under its load id.
     *
     * @param target The object to register.
     * @throws IdentityCollisionException if a different object already owns the id
     */
    void register(IReferenceable target);

    /**
     * Looks up the current owner of a load id.
     *
     * @param loadId The load id.
     * @return the owner, or empty if the id is free
     */
    Optional<IReferenceable> tryFind(String loadId);

    /**
     * Removes one registration of the given object.
     *
     * @param target The object to remove.
     * @return true if the object was registered
     */
    boolean remove(IReferenceable target);

    /**
     * @param loadId The load id.
     * @return true if some object owns the id
     */
    boolean contains(String loadId);

    /**
     * @return number of distinct ids currently owned
     */
    int size();
}
