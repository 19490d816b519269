package org.permafrost.archive.session;

/**
 * Phase of a persistence session. A session moves strictly forward through these phases
 * and returns to {@link #INACTIVE} when finished or reset.
 */
public enum SessionMode {
    INACTIVE,
    SAVING,
    /** Fields are being read; references are only recorded, not resolved. */
    LOADING_VARS,
    RESOLVING_CROSS_REFS,
    POST_LOAD_INIT
}
