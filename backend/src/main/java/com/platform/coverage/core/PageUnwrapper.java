package com.platform.coverage.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the data array (and optionally a total count) from a raw page response.
 */
@FunctionalInterface
public interface PageUnwrapper {
    
    Page unwrap(JsonNode response);
    
    /**
     * The response body is the array itself.
     */
    static PageUnwrapper bareArray() {
        return response -> new Page(elements(response), null);
    }
    
    /**
     * The array sits under {@code dataField}; no total count.
     */
    static PageUnwrapper nested(String dataField) {
        return nested(dataField, null);
    }
    
    /**
     * The array sits under {@code dataField}, with an optional total count under {@code totalField}.
     */
    static PageUnwrapper nested(String dataField, String totalField) {
        return response -> {
            if (response == null || !response.isObject()) {
                return new Page(List.of(), null);
            }
            Long total = null;
            if (totalField != null && response.path(totalField).canConvertToLong()) {
                total = response.path(totalField).asLong();
            }
            return new Page(elements(response.get(dataField)), total);
        };
    }
    
    private static List<JsonNode> elements(JsonNode node) {
        List<JsonNode> items = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(items::add);
        }
        return items;
    }
}
