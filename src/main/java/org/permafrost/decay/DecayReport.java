package org.permafrost.decay;

/**
 * Counters of one offline decay run.
 */
public final class DecayReport {

    private int rotted;
    private int perishablesAged;
    private int itemsWeathered;
    private int itemsDestroyed;
    private int structuresDamaged;
    private int structuresDestroyed;
    private int floorsEroded;
    private StructuralFailureSimulator.FailureReport failures = StructuralFailureSimulator.FailureReport.NONE;

    void recordRot(RotOutcome outcome) {
        if (outcome.spoiled()) {
            rotted++;
        } else {
            perishablesAged++;
        }
    }

    void recordItem(boolean destroyed) {
        itemsWeathered++;
        if (destroyed) {
            itemsDestroyed++;
        }
    }

    void recordStructure(boolean destroyed) {
        structuresDamaged++;
        if (destroyed) {
            structuresDestroyed++;
        }
    }

    void setFloorsEroded(int floorsEroded) {
        this.floorsEroded = floorsEroded;
    }

    void setFailures(StructuralFailureSimulator.FailureReport failures) {
        this.failures = failures;
    }

    public int getRotted() {
        return rotted;
    }

    public int getPerishablesAged() {
        return perishablesAged;
    }

    public int getItemsWeathered() {
        return itemsWeathered;
    }

    public int getItemsDestroyed() {
        return itemsDestroyed;
    }

    public int getStructuresDamaged() {
        return structuresDamaged;
    }

    public int getStructuresDestroyed() {
        return structuresDestroyed;
    }

    public int getFloorsEroded() {
        return floorsEroded;
    }

    public StructuralFailureSimulator.FailureReport getFailures() {
        return failures;
    }

    /**
     * @return true if nothing changed
     */
    public boolean isEmpty() {
        return rotted == 0 && itemsWeathered == 0 && structuresDamaged == 0 && floorsEroded == 0 && failures.events() == 0;
    }

    @Override
    public String toString() {
        return "rotted=" + rotted
            + ", itemsWeathered=" + itemsWeathered + " (destroyed " + itemsDestroyed + ")"
            + ", structuresDamaged=" + structuresDamaged + " (destroyed " + structuresDestroyed + ")"
            + ", floorsEroded=" + floorsEroded
            + ", failureEvents=" + failures.events()
            + " (damaged " + failures.structuresDamaged() + ", destroyed " + failures.structuresDestroyed()
            + ", floors " + failures.floorsRemoved() + ")";
    }
}
