package com.pageanalytics.domain.distinct;

import java.util.Collection;

/**
 * Estimates the cardinality of the union of the given sketches.
 */
@FunctionalInterface
public interface SketchCounter {

    long count(Collection<String> sketchKeys);
}
