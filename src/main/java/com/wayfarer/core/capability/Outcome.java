package com.wayfarer.core.capability;

/**
 * What a capability returns: its answer, or a structured reason it could not produce one.
 */
public sealed interface Outcome<P> permits Outcome.Success, Outcome.Failure {

    static <P> Outcome<P> success(P payload) {
        return new Success<>(payload);
    }

    static <P> Outcome<P> failure(String reason) {
        return new Failure<>(reason);
    }

    record Success<P>(P payload) implements Outcome<P> {}

    record Failure<P>(String reason) implements Outcome<P> {}
}
