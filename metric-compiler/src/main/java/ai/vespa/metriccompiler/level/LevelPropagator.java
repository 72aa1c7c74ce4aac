// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.level;

import ai.vespa.metriccompiler.model.Statement;

import java.util.List;

/**
 * Extends the levels of the statements of a body across brace-delimited groups, so that a group is
 * not split between insertion points. Implementations change levels only, never the statements themselves.
 *
 * @author mcomp
 */
public interface LevelPropagator {

    /** Raises the levels of the given statements, given in source order */
    void propagate(List<Statement> statements);

    /** Returns the propagator of the given name: "block" or "linear" */
    static LevelPropagator named(String name) {
        switch (name) {
            case BlockLevelPropagator.name: return new BlockLevelPropagator();
            case LinearLevelPropagator.name: return new LinearLevelPropagator();
            default: throw new IllegalArgumentException("Unknown level propagation '" + name +
                                                        "', must be '" + BlockLevelPropagator.name +
                                                        "' or '" + LinearLevelPropagator.name + "'");
        }
    }

}
