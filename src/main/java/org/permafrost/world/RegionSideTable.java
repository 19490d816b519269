package org.permafrost.world;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * World-scoped table of {@link SideRegistry} entries keyed by region id.
 * Entries are created on save and released by the matching load; entries of regions that
 * are never restored stay indefinitely.
 */
public class RegionSideTable {

    private final Map<Integer, SideRegistry> entries = new LinkedHashMap<>();

    /**
     * @param regionId Region id.
     * @return the existing entry or a new empty one
     */
    public SideRegistry getOrCreate(int regionId) {
        return entries.computeIfAbsent(regionId, SideRegistry::new);
    }

    public Optional<SideRegistry> tryGet(int regionId) {
        return Optional.ofNullable(entries.get(regionId));
    }

    /**
     * @param regionId Region id.
     * @return true if an entry was removed
     */
    public boolean release(int regionId) {
        return entries.remove(regionId) != null;
    }

    /**
     * Puts a fully built entry, replacing any existing one. Used when the world session is loaded.
     *
     * @param registry The entry.
     */
    public void put(SideRegistry registry) {
        entries.put(registry.getRegionId(), registry);
    }

    public List<SideRegistry> all() {
        return new ArrayList<>(entries.values());
    }

    public int size() {
        return entries.size();
    }
}
