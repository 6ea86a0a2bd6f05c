package com.architecture.memory.riskscope.service.graph;

/**
 * Transient failure talking to the graph store. Retry once, then treat the signal as unknown.
 */
public class GraphUnavailableException extends RuntimeException {

    public GraphUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public GraphUnavailableException(String message) {
        super(message);
    }
}
