package com.platform.coverage.core;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Drives an offset-paginated endpoint to exhaustion.
 *
 * The first page is fetched alone. After that, rounds of up to {@code maxConcurrentRequests}
 * pages are launched together at consecutive offsets and awaited as a group. A failed page is
 * logged and skipped; only a round that yields nothing ends the fetch. Items are returned in
 * offset order, but callers should treat them as a set.
 */
@Slf4j
public class ConcurrentPaginator {

    private final RetryingHttpClient client;
    private final ExecutorService executor;
    private final int maxConcurrentRequests;

    public ConcurrentPaginator(RetryingHttpClient client, ExecutorService executor, int maxConcurrentRequests) {
        if (maxConcurrentRequests < 1) {
            throw new IllegalArgumentException("maxConcurrentRequests must be >= 1");
        }
        this.client = client;
        this.executor = executor;
        this.maxConcurrentRequests = maxConcurrentRequests;
    }

    /**
     * Fetch every page of {@code url}.
     *
     * @return all items, or an empty list when the first page cannot be fetched
     */
    public List<JsonNode> fetchAll(String url, PaginationParams pagination, Map<String, String> params,
                                   PageUnwrapper unwrapper) {
        int pageSize = pagination.pageSize();
        Map<String, String> baseParams = new LinkedHashMap<>(params != null ? params : Map.of());
        baseParams.put(pagination.limitParam(), String.valueOf(pageSize));

        RequestOutcome first = client.execute("GET", url, withOffset(baseParams, pagination, 0));
        if (!first.isSuccess()) {
            log.error("[{}] First page of {} failed ({}), nothing fetched", client.getSource(), url, first.describe());
            return List.of();
        }

        Page firstPage = unwrapper.unwrap(first.payload());
        List<JsonNode> all = new ArrayList<>(firstPage.items());
        log.debug("[{}] First batch: {} records", client.getSource(), firstPage.size());

        if (firstPage.size() < pageSize) {
            return all;
        }

        Long total = firstPage.hasTotal() ? firstPage.totalCount() : null;
        if (total != null) {
            long remainingPages = (total - pageSize + pageSize - 1) / pageSize;
            log.info("[{}] Fetching {} additional pages...", client.getSource(), remainingPages);
        }

        long offset = pageSize;
        while (true) {
            List<Long> offsets = new ArrayList<>();
            for (int i = 0; i < maxConcurrentRequests; i++) {
                long currentOffset = offset + (long) i * pageSize;
                if (total != null && currentOffset >= total) {
                    break;
                }
                offsets.add(currentOffset);
            }

            if (offsets.isEmpty()) {
                break;
            }

            List<CompletableFuture<RequestOutcome>> futures = new ArrayList<>(offsets.size());
            for (Long pageOffset : offsets) {
                Map<String, String> pageParams = withOffset(baseParams, pagination, pageOffset);
                futures.add(CompletableFuture.supplyAsync(() -> client.execute("GET", url, pageParams), executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .exceptionally(ex -> null)
                .join();

            int newItems = 0;
            int successfulPages = 0;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    RequestOutcome outcome = futures.get(i).join();
                    if (!outcome.isSuccess()) {
                        log.warn("[{}] Page at offset {} failed: {}", client.getSource(), offsets.get(i), outcome.describe());
                        continue;
                    }
                    Page page = unwrapper.unwrap(outcome.payload());
                    all.addAll(page.items());
                    newItems += page.size();
                    successfulPages++;
                } catch (CompletionException e) {
                    log.error("[{}] Batch request failed at offset {}: {}",
                        client.getSource(), offsets.get(i), e.getCause() != null ? e.getCause().toString() : e.toString());
                }
            }

            if (newItems == 0) {
                break;
            }

            offset += (long) offsets.size() * pageSize;

            if (total != null) {
                double progress = Math.min(100.0, all.size() * 100.0 / total);
                log.info("[{}] Progress: {}/{} ({}%)", client.getSource(), all.size(), total,
                    String.format("%.1f", progress));
            } else {
                log.info("[{}] Progress: {} records fetched", client.getSource(), all.size());
            }

            // failed pages do not make a round short
            if (pagination.stopOnShortBatch() && newItems < (long) successfulPages * pageSize) {
                break;
            }
        }

        return all;
    }

    private static Map<String, String> withOffset(Map<String, String> base, PaginationParams pagination, long offset) {
        Map<String, String> params = new LinkedHashMap<>(base);
        params.put(pagination.offsetParam(), String.valueOf(offset));
        return params;
    }
}
