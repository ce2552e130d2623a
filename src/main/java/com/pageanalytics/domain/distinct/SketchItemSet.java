package com.pageanalytics.domain.distinct;

import com.pageanalytics.domain.exception.InconsistentSketchStateException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Union of HyperLogLog sketches, held as sketch keys.
 *
 * Union only merges key sets; the estimate is computed once, over all keys,
 * when {@link #cardinality()} is called.
 */
public final class SketchItemSet implements DistinctItems {

    private final Set<String> sketchKeys;
    private final SketchCounter counter;

    private SketchItemSet(Set<String> sketchKeys, SketchCounter counter) {
        this.sketchKeys = sketchKeys;
        this.counter = counter;
    }

    public static SketchItemSet of(Collection<String> sketchKeys, SketchCounter counter) {
        return new SketchItemSet(Collections.unmodifiableSet(new LinkedHashSet<>(sketchKeys)), counter);
    }

    public Set<String> getSketchKeys() {
        return sketchKeys;
    }

    @Override
    public long cardinality() {
        if (sketchKeys.isEmpty()) {
            return 0;
        }
        return counter.count(sketchKeys);
    }

    @Override
    public DistinctItems union(DistinctItems other) {
        if (!(other instanceof SketchItemSet)) {
            throw new InconsistentSketchStateException(
                    "Cannot union a sketch with " + other.getClass().getSimpleName());
        }
        Set<String> merged = new LinkedHashSet<>(sketchKeys);
        merged.addAll(((SketchItemSet) other).sketchKeys);
        return new SketchItemSet(Collections.unmodifiableSet(merged), counter);
    }

    @Override
    public String toString() {
        return "SketchItemSet" + sketchKeys;
    }
}
