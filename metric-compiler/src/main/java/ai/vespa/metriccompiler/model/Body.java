// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A decode or post function body: its scope and its statements in source order.
 *
 * @author mcomp
 */
public class Body {

    public enum Kind {

        /** Per query term contribution to each document */
        DECODE("decode"),
        /** Per document aggregation after all terms are processed */
        POST("post");

        private final String functionName;

        Kind(String functionName) { this.functionName = functionName; }

        public String functionName() { return functionName; }

    }

    private final Kind kind;
    private final Scope scope;
    private final List<Statement> statements = new ArrayList<>();

    public Body(Kind kind) {
        this.kind = kind;
        this.scope = new Scope(kind.functionName());
    }

    public Kind kind() { return kind; }

    public Scope scope() { return scope; }

    public Namespace namespace() { return scope.namespace(); }

    public void add(Statement statement) { statements.add(statement); }

    public List<Statement> statements() { return Collections.unmodifiableList(statements); }

    /** Returns the statements of this at exactly the given level, in source order */
    public List<Statement> statementsAt(Level level) {
        List<Statement> atLevel = new ArrayList<>();
        for (Statement statement : statements)
            if (statement.level() == level) atLevel.add(statement);
        return atLevel;
    }

    /** Returns the pre-requisite code of all used declarations of this, in namespace order */
    public List<String> prerequisites() {
        List<String> prerequisites = new ArrayList<>();
        for (Declaration declaration : namespace().declarations()) {
            if (scope.isUsed(declaration.name()) && ! declaration.prerequisite().isEmpty())
                prerequisites.add(declaration.prerequisite());
        }
        return prerequisites;
    }

    @Override
    public String toString() { return kind.functionName() + " body with " + statements.size() + " statements"; }

}
