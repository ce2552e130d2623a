package com.pageanalytics.domain.service;

import java.util.Set;
import java.util.TreeSet;

/**
 * Views and distinct blogs of one day (or one period, after merging).
 */
public class DayActivity {
    
    private long views;
    private final Set<Long> blogIds = new TreeSet<>();
    
    public void add(long blogViews, Long blogId) {
        views += blogViews;
        blogIds.add(blogId);
    }
    
    public void addAll(long moreViews, Iterable<Long> moreBlogIds) {
        views += moreViews;
        for (Long blogId : moreBlogIds) {
            blogIds.add(blogId);
        }
    }
    
    public void merge(DayActivity other) {
        addAll(other.views, other.blogIds);
    }
    
    public long getViews() {
        return views;
    }
    
    public Set<Long> getBlogIds() {
        return blogIds;
    }
}
