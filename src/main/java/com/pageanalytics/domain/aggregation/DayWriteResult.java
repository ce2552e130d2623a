package com.pageanalytics.domain.aggregation;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Row changes from replacing one day of summaries (or, in a dry run, the
 * changes that would be made).
 */
@Data
@AllArgsConstructor
public class DayWriteResult {
    
    private int created;
    private int updated;
    private int removed;
}
