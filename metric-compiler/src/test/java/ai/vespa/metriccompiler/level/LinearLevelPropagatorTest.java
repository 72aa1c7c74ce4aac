// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.level;

import ai.vespa.metriccompiler.model.Level;
import ai.vespa.metriccompiler.model.Statement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LinearLevelPropagatorTest {

    @Test
    void testBlockIsRaisedToItsBody() {
        List<Statement> statements = List.of(new Statement(1, Level.CONSTANT, "if (x > 0) {"),
                                             new Statement(2, Level.DOCUMENT, "y = D_terms;"),
                                             new Statement(3, Level.CONSTANT, "}"));
        new LinearLevelPropagator().propagate(statements);
        assertEquals(List.of(Level.DOCUMENT, Level.DOCUMENT, Level.DOCUMENT), levels(statements));
    }

    @Test
    void testStatementsOutsideBlocksKeepTheirLevels() {
        List<Statement> statements = List.of(new Statement(1, Level.CONSTANT, "a = 1;"),
                                             new Statement(2, Level.TERM, "b = f_dt;"),
                                             new Statement(3, Level.CONSTANT, "c = 2;"));
        new LinearLevelPropagator().propagate(statements);
        assertEquals(List.of(Level.CONSTANT, Level.TERM, Level.CONSTANT), levels(statements));
    }

    @Test
    void testOnlyNeighboursArePropagated() {
        // The opener only sees the level of the line after it
        List<Statement> statements = List.of(new Statement(1, Level.CONSTANT, "if (x) {"),
                                             new Statement(2, Level.CONSTANT, "a = 1;"),
                                             new Statement(3, Level.TERM, "b = f_dt;"),
                                             new Statement(4, Level.CONSTANT, "}"));
        new LinearLevelPropagator().propagate(statements);
        assertEquals(List.of(Level.CONSTANT, Level.CONSTANT, Level.TERM, Level.TERM), levels(statements));
    }

    @Test
    void testEmpty() {
        new LinearLevelPropagator().propagate(List.of());
    }

    static List<Level> levels(List<Statement> statements) {
        return statements.stream().map(Statement::level).collect(Collectors.toList());
    }

}
