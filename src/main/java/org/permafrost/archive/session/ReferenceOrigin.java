package org.permafrost.archive.session;

/**
 * Where a cross-reference target was registered from.
 */
public enum ReferenceOrigin {
    /** Deep-loaded from the document of the current session. */
    ARCHIVE,
    /** Pre-registered live object of the running world. */
    WORLD
}
