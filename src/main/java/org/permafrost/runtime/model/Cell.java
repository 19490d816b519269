package org.permafrost.runtime.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An immutable cell coordinate inside a region grid.
 */
public final class Cell {

    /** The origin cell (0, 0). */
    public static final Cell ORIGIN = new Cell(0, 0);

    private final int x;
    private final int z;

    /**
     * Creates a new cell coordinate.
     *
     * @param x Column.
     * @param z Row.
     */
    @JsonCreator
    public Cell(@JsonProperty("x") int x, @JsonProperty("z") int z) {
        this.x = x;
        this.z = z;
    }

    @JsonProperty("x")
    public int x() {
        return x;
    }

    @JsonProperty("z")
    public int z() {
        return z;
    }

    /**
     * Returns the cell shifted by the given deltas.
     *
     * @param dx Column delta.
     * @param dz Row delta.
     * @return the shifted cell
     */
    public Cell offset(int dx, int dz) {
        return new Cell(x + dx, z + dz);
    }

    /**
     * Euclidean distance between cell centres.
     *
     * @param other The other cell.
     * @return the distance
     */
    public double distanceTo(Cell other) {
        int dx = other.x - x;
        int dz = other.z - z;
        return Math.sqrt((double) dx * dx + (double) dz * dz);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cell)) return false;
        Cell cell = (Cell) o;
        return x == cell.x && z == cell.z;
    }

    @Override
    public int hashCode() {
        return 31 * x + z;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + z + ")";
    }
}
