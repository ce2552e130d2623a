package com.pageanalytics.domain.distinct;

import java.util.List;

/**
 * Distinct-item representation for one or more (day, group) summaries.
 *
 * Two variants: {@link ExactItemSet} holds the item ids, {@link SketchItemSet}
 * references HyperLogLog sketches. Union is defined within a variant only;
 * mixing them throws {@link com.pageanalytics.domain.exception.InconsistentSketchStateException}.
 */
public interface DistinctItems {

    long cardinality();

    DistinctItems union(DistinctItems other);

    /**
     * Unions all parts. An empty list is an empty exact set.
     */
    static DistinctItems unionAll(List<? extends DistinctItems> parts) {
        DistinctItems result = null;
        for (DistinctItems part : parts) {
            result = result == null ? part : result.union(part);
        }
        return result != null ? result : ExactItemSet.empty();
    }
}
