package org.permafrost.archive;

import org.permafrost.runtime.model.Entity;
import org.permafrost.runtime.model.GroupController;

import java.util.ArrayList;
import java.util.List;

/**
 * The persisted state of one region: grid layers, archived entities, group leaders and the
 * tick the region was abandoned at.
 * <p>
 * A null grid buffer means the layer was not active when the region was saved.
 * </p>
 */
public class ArchiveRecord {

    private byte[] terrain;
    private byte[] roof;
    private byte[] snow;
    private byte[] pollution;
    private byte[] fog;
    private List<Entity> entities = new ArrayList<>();
    private List<GroupController> groupLeaders = new ArrayList<>();
    private long abandonedAtTick;

    public byte[] getTerrain() {
        return terrain;
    }

    public void setTerrain(byte[] terrain) {
        this.terrain = terrain;
    }

    public byte[] getRoof() {
        return roof;
    }

    public void setRoof(byte[] roof) {
        this.roof = roof;
    }

    public byte[] getSnow() {
        return snow;
    }

    public void setSnow(byte[] snow) {
        this.snow = snow;
    }

    public byte[] getPollution() {
        return pollution;
    }

    public void setPollution(byte[] pollution) {
        this.pollution = pollution;
    }

    public byte[] getFog() {
        return fog;
    }

    public void setFog(byte[] fog) {
        this.fog = fog;
    }

    public List<Entity> getEntities() {
        return entities;
    }

    /**
     * @param entities Archived entities; null is normalised to an empty list.
     */
    public void setEntities(List<Entity> entities) {
        this.entities = entities != null ? new ArrayList<>(entities) : new ArrayList<>();
    }

    public List<GroupController> getGroupLeaders() {
        return groupLeaders;
    }

    /**
     * @param groupLeaders Archived group controllers; null is normalised to an empty list.
     */
    public void setGroupLeaders(List<GroupController> groupLeaders) {
        this.groupLeaders = groupLeaders != null ? new ArrayList<>(groupLeaders) : new ArrayList<>();
    }

    public long getAbandonedAtTick() {
        return abandonedAtTick;
    }

    public void setAbandonedAtTick(long abandonedAtTick) {
        this.abandonedAtTick = abandonedAtTick;
    }

    /**
     * @return total size of all present grid buffers in bytes
     */
    public long gridBytes() {
        long total = 0;
        for (byte[] layer : new byte[][] {terrain, roof, snow, pollution, fog}) {
            if (layer != null) {
                total += layer.length;
            }
        }
        return total;
    }
}
