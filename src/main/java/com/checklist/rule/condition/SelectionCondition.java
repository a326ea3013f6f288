package com.checklist.rule.condition;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Condition that holds when any of the listed answer options was chosen.
 *
 * @param options 1-based option indices in source order, duplicates included
 */
public record SelectionCondition(List<Integer> options) implements Condition {

    public SelectionCondition {
        options = List.copyOf(options);
    }

    /**
     * Distinct option indices in first-seen order.
     */
    public Set<Integer> distinctOptions() {
        return new LinkedHashSet<>(options);
    }

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitSelection(this);
    }
}
