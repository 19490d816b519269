package org.permafrost.runtime.model;

/**
 * Base class for region-scoped subsystems attached to a {@link Region}.
 */
public abstract class RegionComponent {

    private final Region region;

    protected RegionComponent(Region region) {
        this.region = region;
    }

    public Region getRegion() {
        return region;
    }
}
