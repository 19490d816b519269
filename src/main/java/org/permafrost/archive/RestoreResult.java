package org.permafrost.archive;

import org.permafrost.decay.DecayReport;

/**
 * Summary of a completed region restore.
 *
 * @param placed Archived entities placed in the region.
 * @param rotted Perishables that spoiled while archived and were not placed.
 * @param groupLeaders Group controllers re-attached.
 * @param sideRegistryRestored Creatures returned from the side registry.
 * @param unresolvedReferences References that resolved to null.
 * @param decay Offline decay counters.
 */
public record RestoreResult(int placed, int rotted, int groupLeaders, int sideRegistryRestored,
                            int unresolvedReferences, DecayReport decay) {
}
