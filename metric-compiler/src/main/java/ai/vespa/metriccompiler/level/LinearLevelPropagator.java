// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.level;

import ai.vespa.metriccompiler.model.Statement;

import java.util.List;

/**
 * Propagates levels with one forward and one backward scan over the flat statement list:
 * a statement closing a brace group takes at least the level of the statement before it, and
 * a statement opening a group takes at least the level of the statement after it.
 *
 * <p>This is only correct for groups whose contents are all at one level, such as one-line conditionals.
 * In a group mixing levels the opening line may end up at a lower level than its contents.</p>
 *
 * @see BlockLevelPropagator
 *
 * @author mcomp
 */
public class LinearLevelPropagator implements LevelPropagator {

    public static final String name = "linear";

    @Override
    public void propagate(List<Statement> statements) {
        Statement previous = null;
        for (Statement statement : statements) {
            if (previous != null && statement.closesBlock())
                statement.raiseLevel(previous.level());
            previous = statement;
        }

        Statement next = null;
        for (int i = statements.size() - 1; i >= 0; i--) {
            Statement statement = statements.get(i);
            if (next != null && statement.opensBlock())
                statement.raiseLevel(next.level());
            next = statement;
        }
    }

}
