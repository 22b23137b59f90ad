package com.wayfarer.core.graph;

/**
 * A stage graph was built with missing handlers or routes.
 */
public class GraphDefinitionException extends RuntimeException {

    public GraphDefinitionException(String message) {
        super(message);
    }
}
