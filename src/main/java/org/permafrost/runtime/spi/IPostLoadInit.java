package org.permafrost.runtime.spi;

/**
 * Implemented by deep-loaded objects that need a hook after all cross-references of
 * their session have been resolved.
 */
public interface IPostLoadInit {

    /**
     * Called exactly once per load session, after cross-reference resolution.
     */
    void postLoadInit();
}
