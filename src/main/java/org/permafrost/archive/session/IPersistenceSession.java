package org.permafrost.archive.session;

import org.permafrost.runtime.spi.IReferenceable;

/**
 * One save or load pass over a single archive document.
 * <p>
 * Load sessions run in a fixed order: {@link #beginLoad(byte[])}, field reads,
 * {@link #preRegister(IReferenceable)} of live targets, {@link #closeReadCursor()},
 * {@link #resolveAllCrossReferences()} (exactly once), {@link #runPostLoadInit()}.
 * Calling a step out of order throws {@link IllegalStateException}.
 * </p>
 */
public interface IPersistenceSession {

    SessionMode getMode();

    /**
     * @return writer for the document root
     */
    IArchiveWriter beginSave();

    /**
     * Finishes a save and returns the encoded document.
     *
     * @return document bytes
     * @throws ArchiveException if encoding fails
     */
    byte[] finalizeSaving() throws ArchiveException;

    /**
     * @param content Encoded document.
     * @return reader for the document root
     * @throws ArchiveException if the document is corrupt or of an unsupported version
     */
    IArchiveReader beginLoad(byte[] content) throws ArchiveException;

    /**
     * Registers a live object as a valid cross-reference target of this load session.
     *
     * @param target Live object.
     * @throws org.permafrost.runtime.spi.IdentityCollisionException if the id is already registered by another object
     */
    void preRegister(IReferenceable target);

    /**
     * Ends the field-reading phase; further reads fail.
     */
    void closeReadCursor();

    /**
     * Binds every recorded reference against deep-loaded and pre-registered targets.
     *
     * @return number of references that could not be resolved
     */
    int resolveAllCrossReferences();

    /**
     * Runs post-load hooks of every deep-loaded object and queued action.
     *
     * @return number of hooks run
     */
    int runPostLoadInit();

    /**
     * Discards all session state and returns to {@link SessionMode#INACTIVE}.
     */
    void reset();
}
