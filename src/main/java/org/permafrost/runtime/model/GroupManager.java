package org.permafrost.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-region list of live group controllers.
 */
public class GroupManager {

    private final Region region;
    private final List<GroupController> controllers = new ArrayList<>();

    GroupManager(Region region) {
        this.region = region;
    }

    public Region getRegion() {
        return region;
    }

    public List<GroupController> getControllers() {
        return Collections.unmodifiableList(controllers);
    }

    /**
     * Adds a controller to the live list and attaches this manager to it.
     *
     * @param controller The controller.
     */
    public void add(GroupController controller) {
        controller.setManager(this);
        if (!controllers.contains(controller)) {
            controllers.add(controller);
        }
    }

    public boolean remove(GroupController controller) {
        return controllers.remove(controller);
    }
}
