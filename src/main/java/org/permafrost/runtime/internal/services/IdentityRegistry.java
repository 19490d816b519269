package org.permafrost.runtime.internal.services;

import org.permafrost.runtime.spi.IIdentityRegistry;
import org.permafrost.runtime.spi.IReferenceable;
import org.permafrost.runtime.spi.IdentityCollisionException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Hash-map backed {@link IIdentityRegistry} with per-instance registration counts.
 * <p>
 * The same instance may be held by several owners at once (for example a creature that is
 * spawned in a region and also tracked by the world registry); its id is only released when
 * the last owner removes it.
 * </p>
 */
public final class IdentityRegistry implements IIdentityRegistry {

    private final String name;
    private final Map<String, Slot> slots = new HashMap<>();

    /**
     * @param name Descriptive registry name used in collision messages.
     */
    public IdentityRegistry(String name) {
        this.name = name;
    }

    @Override
    public void register(IReferenceable target) {
        String id = target.getUniqueLoadId();
        Slot slot = slots.get(id);
        if (slot == null) {
            slots.put(id, new Slot(target));
            return;
        }
        if (slot.owner != target) {
            throw new IdentityCollisionException(id,
                "Id already used in " + name + ": " + id + " (held by " + describe(slot.owner)
                    + ", offered by " + describe(target) + ")");
        }
        slot.count++;
    }

    @Override
    public Optional<IReferenceable> tryFind(String loadId) {
        Slot slot = slots.get(loadId);
        return slot == null ? Optional.empty() : Optional.of(slot.owner);
    }

    @Override
    public boolean remove(IReferenceable target) {
        String id = target.getUniqueLoadId();
        Slot slot = slots.get(id);
        if (slot == null || slot.owner != target) {
            return false;
        }
        if (--slot.count <= 0) {
            slots.remove(id);
        }
        return true;
    }

    @Override
    public boolean contains(String loadId) {
        return slots.containsKey(loadId);
    }

    @Override
    public int size() {
        return slots.size();
    }

    private static String describe(IReferenceable target) {
        return target.getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(target));
    }

    private static final class Slot {
        private final IReferenceable owner;
        private int count = 1;

        private Slot(IReferenceable owner) {
            this.owner = owner;
        }
    }
}
