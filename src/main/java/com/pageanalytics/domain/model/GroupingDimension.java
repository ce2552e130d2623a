package com.pageanalytics.domain.model;

import java.util.Arrays;

/**
 * Dimension a summary scope groups by.
 * 
 * The path value is what the REST layer and the operator command accept.
 */
public enum GroupingDimension {
    
    COUNTRY("country"),
    AUTHOR("user");
    
    private final String pathValue;
    
    GroupingDimension(String pathValue) {
        this.pathValue = pathValue;
    }
    
    public String getPathValue() {
        return pathValue;
    }
    
    /**
     * Parses "country" or "user" (also accepts "author" and the enum name).
     */
    public static GroupingDimension fromPathValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase();
            if (normalized.equals("author")) {
                return AUTHOR;
            }
            for (GroupingDimension dimension : values()) {
                if (dimension.pathValue.equals(normalized) || dimension.name().equalsIgnoreCase(normalized)) {
                    return dimension;
                }
            }
        }
        throw new IllegalArgumentException("object_type must be one of: " + Arrays.stream(values())
                .map(GroupingDimension::getPathValue)
                .reduce((a, b) -> a + ", " + b)
                .orElse(""));
    }
}
