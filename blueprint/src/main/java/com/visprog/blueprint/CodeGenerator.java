package com.visprog.blueprint;

import com.visprog.blueprint.model.Graph;
import com.visprog.common.errorsor.ErrorsOr;

/**
 * Turns a validated graph into something runnable. Implementations may assume the graph has one
 * Entry, at least one Exit, no illegal edges, no unreachable nodes and no control-flow cycle.
 *
 * @param <T> generated artifact (source text, a file set, ...)
 */
@FunctionalInterface
public interface CodeGenerator<T> {
    ErrorsOr<T> generate(Graph graph);
}
