package com.architecture.memory.riskscope.service.graph;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Retry policy for graph calls: one retry on {@link GraphUnavailableException}, nothing else.
 */
@Slf4j
public final class GraphRetry {

    private GraphRetry() {
    }

    public static <T> T retryOnce(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (GraphUnavailableException first) {
            log.debug("[GraphStore] {} failed ({}), retrying once", operation, first.getMessage());
            if (Thread.currentThread().isInterrupted()) {
                throw first;
            }
            return call.get();
        }
    }
}
