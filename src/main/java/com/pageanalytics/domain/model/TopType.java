package com.pageanalytics.domain.model;

/**
 * What a top-N ranking ranks.
 */
public enum TopType {
    
    BLOG,
    USER,
    COUNTRY;
    
    public static TopType fromPathValue(String value) {
        if (value != null) {
            for (TopType type : values()) {
                if (type.name().equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("top_type must be one of: blog, user, country");
    }
    
    /**
     * Summary dimension backing this ranking, or null when it can only be
     * answered from raw events.
     */
    public GroupingDimension getDimension() {
        return switch (this) {
            case USER -> GroupingDimension.AUTHOR;
            case COUNTRY -> GroupingDimension.COUNTRY;
            case BLOG -> null;
        };
    }
}
