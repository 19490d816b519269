package org.permafrost.archive.session;

import org.permafrost.runtime.internal.services.IdentityRegistry;
import org.permafrost.runtime.spi.IReferenceable;
import org.permafrost.runtime.spi.IdentityCollisionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Directory of cross-reference targets for one load session.
 * <p>
 * Deep-loaded archive objects and pre-registered live world objects share one directory,
 * so a reference written in either session binds to whichever object carries the id.
 * Recorded references are bound exactly once by {@link #resolveAll()}.
 * </p>
 */
public final class CrossReferenceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(CrossReferenceResolver.class);

    private final IdentityRegistry directory = new IdentityRegistry("load session");
    private final Map<String, ReferenceOrigin> origins = new HashMap<>();
    private final Map<ReferenceOrigin, Integer> registeredCounts = new EnumMap<>(ReferenceOrigin.class);
    private final List<Runnable> pending = new ArrayList<>();
    private boolean resolved;
    private int unresolved;

    /**
     * Adds a target to the directory. Registering the same instance twice is harmless.
     *
     * @param target The target.
     * @param origin Where it comes from.
     * @throws IdentityCollisionException if another instance already owns the id
     */
    public void register(IReferenceable target, ReferenceOrigin origin) {
        String id = target.getUniqueLoadId();
        Optional<IReferenceable> existing = directory.tryFind(id);
        if (existing.isPresent()) {
            if (existing.get() == target) {
                return;
            }
            throw new IdentityCollisionException(id, "Id already used in load session: " + id
                + " (registered from " + origins.get(id) + ", offered from " + origin + ")");
        }
        directory.register(target);
        origins.put(id, origin);
        registeredCounts.merge(origin, 1, Integer::sum);
    }

    /**
     * Records a single reference.
     *
     * @param loadId Referenced id.
     * @param type Expected target type.
     * @param setter Receives the target or null.
     * @param <T> Target type.
     */
    public <T extends IReferenceable> void request(String loadId, Class<T> type, Consumer<T> setter) {
        requireOpen();
        pending.add(() -> setter.accept(lookup(loadId, type)));
    }

    /**
     * Records a list of references; null ids stay null elements.
     *
     * @param loadIds Referenced ids.
     * @param type Expected target type.
     * @param setter Receives the list.
     * @param <T> Target type.
     */
    public <T extends IReferenceable> void requestList(List<String> loadIds, Class<T> type, Consumer<List<T>> setter) {
        requireOpen();
        List<String> ids = new ArrayList<>(loadIds);
        pending.add(() -> {
            List<T> targets = new ArrayList<>(ids.size());
            for (String id : ids) {
                targets.add(id == null ? null : lookup(id, type));
            }
            setter.accept(targets);
        });
    }

    /**
     * Binds every recorded reference.
     *
     * @return number of references that resolved to null
     * @throws IllegalStateException if called a second time
     */
    public int resolveAll() {
        requireOpen();
        resolved = true;
        for (Runnable binding : pending) {
            binding.run();
        }
        pending.clear();
        if (unresolved > 0) {
            LOG.warn("{} cross reference(s) could not be resolved and were set to null", unresolved);
        }
        return unresolved;
    }

    private <T extends IReferenceable> T lookup(String loadId, Class<T> type) {
        Optional<IReferenceable> found = directory.tryFind(loadId);
        if (found.isEmpty()) {
            unresolved++;
            LOG.debug("Unresolved reference {}", loadId);
            return null;
        }
        if (!type.isInstance(found.get())) {
            unresolved++;
            LOG.warn("Reference {} points to {} but {} was expected", loadId,
                found.get().getClass().getSimpleName(), type.getSimpleName());
            return null;
        }
        return type.cast(found.get());
    }

    private void requireOpen() {
        if (resolved) {
            throw new IllegalStateException("Cross references were already resolved for this session");
        }
    }

    public boolean isResolved() {
        return resolved;
    }

    public boolean contains(String loadId) {
        return directory.contains(loadId);
    }

    public int getRegisteredCount(ReferenceOrigin origin) {
        return registeredCounts.getOrDefault(origin, 0);
    }

    public int getPendingCount() {
        return pending.size();
    }

    public int getUnresolvedCount() {
        return unresolved;
    }

    /**
     * @return short diagnostic line with directory and pending counts
     */
    public String describe() {
        return "archive=" + getRegisteredCount(ReferenceOrigin.ARCHIVE)
            + ", world=" + getRegisteredCount(ReferenceOrigin.WORLD)
            + ", pending=" + pending.size()
            + ", unresolved=" + unresolved;
    }
}
