package com.platform.coverage.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Items of one page plus the total-count hint, when the source sends one.
 */
public record Page(List<JsonNode> items, Long totalCount) {
    
    public Page {
        items = List.copyOf(items);
    }
    
    public int size() {
        return items.size();
    }
    
    /**
     * A total of zero or less is treated as unknown.
     */
    public boolean hasTotal() {
        return totalCount != null && totalCount > 0;
    }
}
