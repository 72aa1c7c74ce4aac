// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.emit;

import ai.vespa.metriccompiler.model.Body;
import ai.vespa.metriccompiler.model.Declaration;
import ai.vespa.metriccompiler.model.Level;
import ai.vespa.metriccompiler.model.Statement;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static ai.vespa.metriccompiler.emit.Indentation.dedent;
import static ai.vespa.metriccompiler.emit.Indentation.indent;
import static ai.vespa.metriccompiler.emit.Indentation.spaces;

/**
 * Writes native code for the declarations and statements of a body, indented from a given column.
 *
 * @author mcomp
 */
class CodeWriter {

    static final int indentStep = 4;

    private final StringBuilder out;

    CodeWriter(StringBuilder out) {
        this.out = out;
    }

    /**
     * Writes declarations of the quantities used in the given body which need one, in source order,
     * followed by the fallback initialization code of those quantities.
     */
    void declarations(Body body, int column, MacroSubstitution substitution) {
        List<Declaration> used = new ArrayList<>();
        for (String name : body.scope().used())
            body.namespace().get(name).ifPresent(used::add);
        used.sort(Comparator.comparingInt(Declaration::lineNumber));

        List<Declaration> declared = new ArrayList<>();
        for (Declaration declaration : used) {
            if (declaration.hasMacro()) continue;
            if (declaration.isBuiltin() && declaration.initializer().isEmpty() && declaration.functionInit().isEmpty()) continue;
            declared.add(declaration);

            out.append(spaces(column)).append(declaration.type());
            if ( ! declaration.type().isEmpty() && ! declaration.type().endsWith("*"))
                out.append(" ");
            out.append(declaration.name());
            if ( ! declaration.initializer().isEmpty())
                out.append(" ").append(substitution.apply(declaration.initializer()));
            out.append(";\n");
        }
        for (Declaration declaration : declared) {
            if (declaration.functionInit().isEmpty()) continue;
            out.append(indent(dedent(declaration.functionInit()), column)).append("\n");
        }
    }

    /**
     * Writes the statements at the given level. Statements closing a block are outdented one step
     * and statements opening a block indent the following ones.
     */
    void statements(List<Statement> statements, Level level, int column, MacroSubstitution substitution) {
        int depth = column;
        for (Statement statement : statements) {
            if (statement.level() != level) continue;
            if (statement.closesBlock())
                depth -= indentStep;
            out.append(spaces(depth)).append(substitution.apply(statement.text())).append("\n");
            if (statement.opensBlock())
                depth += indentStep;
        }
    }

    /** Writes each of the given code fragments indented to the given column */
    void fragments(List<String> fragments, int column) {
        for (String fragment : fragments)
            out.append(indent(fragment, column)).append("\n");
    }

}
