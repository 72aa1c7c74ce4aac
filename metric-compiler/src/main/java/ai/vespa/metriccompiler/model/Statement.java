// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.model;

/**
 * A statement of a decode or post body, with the level at which it must be evaluated.
 * The text is fixed; the level may be raised by level propagation.
 *
 * @author mcomp
 */
public class Statement {

    private final int lineNumber;
    private final String text;
    private Level level;

    public Statement(int lineNumber, Level level, String text) {
        this.lineNumber = lineNumber;
        this.level = level;
        this.text = text;
    }

    /** Creates a level 1 statement holding the given comment text as a C block comment */
    public static Statement comment(int lineNumber, String commentText) {
        return new Statement(lineNumber, Level.CONSTANT, "/* " + commentText + " */");
    }

    public int lineNumber() { return lineNumber; }

    public Level level() { return level; }

    public String text() { return text; }

    public void raiseLevel(Level candidate) {
        level = level.max(candidate);
    }

    /** Returns whether this closes a brace group without opening another */
    public boolean closesBlock() {
        return text.indexOf('}') >= 0 && text.indexOf('{') < 0;
    }

    /** Returns whether this opens a brace group without closing another */
    public boolean opensBlock() {
        return text.indexOf('{') >= 0 && text.indexOf('}') < 0;
    }

    @Override
    public String toString() {
        return "[" + lineNumber + ", " + level + ", '" + text + "']";
    }

}
