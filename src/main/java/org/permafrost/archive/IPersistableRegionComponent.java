package org.permafrost.archive;

import org.permafrost.archive.session.IArchiveReader;
import org.permafrost.archive.session.IArchiveWriter;

/**
 * Opt-in contract for region components whose state rides inside the region archive.
 * <p>
 * {@link #save(IArchiveWriter)} runs in the same session as the main record and writes into a
 * sibling node keyed by {@link #archiveKey(Class)}. {@link #load(IArchiveReader)} runs before
 * cross references are resolved, so a component may request references to archived entities
 * or to live world objects and register post-load callbacks. References to entities that are
 * not archived (human-like creatures, for example) resolve to null.
 * </p>
 * <p>
 * When an archive has no node for a component (it was added after the archive was written),
 * {@code load} is not called and the component keeps its fresh state.
 * </p>
 */
public interface IPersistableRegionComponent {

    void save(IArchiveWriter out);

    void load(IArchiveReader in);

    /**
     * @param type Component class.
     * @return the node name: the binary class name with '.' and '$' replaced by '_'
     */
    static String archiveKey(Class<?> type) {
        return type.getName().replace('.', '_').replace('$', '_');
    }
}
