package com.platform.coverage.core;

/**
 * How one endpoint is paged.
 *
 * @param offsetParam query parameter carrying the offset
 * @param limitParam query parameter carrying the page size
 * @param pageSize items requested per page
 * @param stopOnShortBatch end pagination when a batch returns less than a full batch of items
 */
public record PaginationParams(
    String offsetParam,
    String limitParam,
    int pageSize,
    boolean stopOnShortBatch
) {
    
    public PaginationParams {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1");
        }
    }
}
