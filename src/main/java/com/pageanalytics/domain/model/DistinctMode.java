package com.pageanalytics.domain.model;

/**
 * How distinct items are counted across days.
 * 
 * EXACT unions the stored per-day item id sets.
 * APPROXIMATE additionally keeps a HyperLogLog sketch per summary row and
 * prefers sketch union on the read path.
 */
public enum DistinctMode {
    EXACT,
    APPROXIMATE
}
