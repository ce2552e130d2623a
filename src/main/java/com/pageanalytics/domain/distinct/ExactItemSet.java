package com.pageanalytics.domain.distinct;

import com.pageanalytics.domain.exception.InconsistentSketchStateException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Exact set of item ids. Cost grows with cardinality.
 */
public final class ExactItemSet implements DistinctItems {

    private static final ExactItemSet EMPTY = new ExactItemSet(Collections.emptySet());

    private final Set<Long> itemIds;

    private ExactItemSet(Set<Long> itemIds) {
        this.itemIds = itemIds;
    }

    public static ExactItemSet of(Collection<Long> itemIds) {
        if (itemIds == null || itemIds.isEmpty()) {
            return EMPTY;
        }
        return new ExactItemSet(Collections.unmodifiableSet(new HashSet<>(itemIds)));
    }

    public static ExactItemSet empty() {
        return EMPTY;
    }

    public Set<Long> getItemIds() {
        return itemIds;
    }

    @Override
    public long cardinality() {
        return itemIds.size();
    }

    @Override
    public DistinctItems union(DistinctItems other) {
        if (!(other instanceof ExactItemSet)) {
            throw new InconsistentSketchStateException(
                    "Cannot union an exact item set with " + other.getClass().getSimpleName());
        }
        Set<Long> merged = new HashSet<>(itemIds);
        merged.addAll(((ExactItemSet) other).itemIds);
        return new ExactItemSet(Collections.unmodifiableSet(merged));
    }

    @Override
    public String toString() {
        return "ExactItemSet" + itemIds;
    }
}
