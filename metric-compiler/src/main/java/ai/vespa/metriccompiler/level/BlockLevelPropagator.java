// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.level;

import ai.vespa.metriccompiler.model.Level;
import ai.vespa.metriccompiler.model.Statement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Propagates levels by folding the statements into a tree of brace groups and giving every statement of
 * an outermost group the highest level found anywhere in it, so that each group is emitted whole.
 *
 * <p>A statement with '{' and no '}' opens a group, one with '}' and no '{' closes the innermost open group,
 * and any other statement, such as <code>} else {</code>, belongs to the innermost open group.
 * A closing statement with no open group stands alone, and groups still open at the end are closed there.</p>
 *
 * @author mcomp
 */
public class BlockLevelPropagator implements LevelPropagator {

    public static final String name = "block";

    @Override
    public void propagate(List<Statement> statements) {
        for (Block block : fold(statements))
            block.raiseTo(block.level());
    }

    /** Returns the outermost groups of the given statements. Statements outside any group are not returned. */
    static List<Block> fold(List<Statement> statements) {
        List<Block> outermost = new ArrayList<>();
        Deque<Block> open = new ArrayDeque<>();
        for (Statement statement : statements) {
            if (statement.opensBlock()) {
                Block block = new Block();
                block.statements.add(statement);
                if (open.isEmpty())
                    outermost.add(block);
                else
                    open.peek().children.add(block);
                open.push(block);
            }
            else if ( ! open.isEmpty()) {
                open.peek().statements.add(statement);
                if (statement.closesBlock())
                    open.pop();
            }
        }
        return outermost;
    }

    /** A brace group: its own statements, opening and closing lines included, and its nested groups */
    static class Block {

        private final List<Statement> statements = new ArrayList<>();
        private final List<Block> children = new ArrayList<>();

        Level level() {
            Level level = Level.CONSTANT;
            for (Statement statement : statements)
                level = level.max(statement.level());
            for (Block child : children)
                level = level.max(child.level());
            return level;
        }

        void raiseTo(Level level) {
            for (Statement statement : statements)
                statement.raiseLevel(level);
            for (Block child : children)
                child.raiseTo(level);
        }

        int size() {
            int size = statements.size();
            for (Block child : children)
                size += child.size();
            return size;
        }

    }

}
