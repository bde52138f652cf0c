package com.taleforge.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of operations describing one state transition.
 * Applied strictly in order.
 */
public record StatePatch(List<PatchOperation> operations) {

    public static final StatePatch EMPTY = new StatePatch(List.of());

    public StatePatch {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    public static StatePatch of(PatchOperation... operations) {
        return new StatePatch(List.of(operations));
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public int size() {
        return operations.size();
    }

    /**
     * This patch followed by the other one.
     */
    public StatePatch concat(StatePatch other) {
        if (other.isEmpty()) {
            return this;
        }
        List<PatchOperation> combined = new ArrayList<>(operations);
        combined.addAll(other.operations);
        return new StatePatch(combined);
    }
}
