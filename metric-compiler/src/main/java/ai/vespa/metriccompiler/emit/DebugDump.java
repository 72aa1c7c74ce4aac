// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.emit;

import ai.vespa.metriccompiler.model.Body;
import ai.vespa.metriccompiler.model.Declaration;
import ai.vespa.metriccompiler.model.MetricDescription;
import ai.vespa.metriccompiler.model.Scope;
import ai.vespa.metriccompiler.model.Statement;

/**
 * A human readable listing of an analyzed metric description: the declarations of each body
 * with their type and level, the quantities each body uses, and the level of each statement.
 *
 * @author mcomp
 */
public class DebugDump {

    private DebugDump() {}

    public static String of(MetricDescription metric) {
        StringBuilder b = new StringBuilder();
        b.append("metric ").append(metric.name()).append("\n");
        for (String comment : metric.headerComments())
            b.append("# ").append(comment).append("\n");
        b.append("\n");

        b.append("parameters:\n");
        for (Declaration parameter : metric.parameters().namespace().declarations())
            b.append("  ").append(parameter.name()).append(" (").append(parameter.type()).append(")\n");

        appendBody(metric.decode(), b);
        appendBody(metric.post(), b);

        b.append("\nprerequisites:\n");
        for (String prerequisite : metric.prerequisites())
            b.append("  ").append(prerequisite).append("\n");
        return b.toString();
    }

    private static void appendBody(Body body, StringBuilder b) {
        b.append("\n").append(body.kind().functionName()).append(" declarations:\n");
        for (Declaration declaration : body.namespace().declarations()) {
            b.append("  ").append(declaration.level()).append(" ").append(declaration.name())
             .append(" (").append(declaration.type()).append(")");
            appendLine(declaration, b);
        }

        b.append(body.kind().functionName()).append(" used:\n");
        Scope scope = body.scope();
        for (String name : scope.used()) {
            Declaration declaration = body.namespace().get(name).orElseThrow();
            b.append("  ").append(declaration.level()).append(" ").append(name);
            appendLine(declaration, b);
        }
        b.append(body.kind().functionName()).append(" statements:\n");
        for (Statement statement : body.statements())
            b.append("  ").append(statement.level()).append(" ").append(statement.text()).append("\n");
    }

    private static void appendLine(Declaration declaration, StringBuilder b) {
        if ( ! declaration.isBuiltin())
            b.append(" line ").append(declaration.lineNumber());
        b.append("\n");
    }

}
