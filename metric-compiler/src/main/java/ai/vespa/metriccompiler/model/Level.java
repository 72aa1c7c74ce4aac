// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.model;

/**
 * The dependency tier of a quantity or statement: the narrowest loop of the generated
 * scoring code in which its value can change. Levels only ever increase during analysis.
 *
 * @author mcomp
 */
public enum Level {

    /** Constant for the whole collection and query */
    CONSTANT(1),
    /** Changes per document (the outer loop) */
    DOCUMENT(2),
    /** Changes per query term and document (the inner loop) */
    TERM(3),
    /** Changes per term offset. Reserved, never emitted */
    OFFSET(4),
    /** Changes per term attribute. Reserved, never emitted */
    ATTRIBUTE(5),
    /** Write-only accumulated score. Reading it as an operand is an error */
    ACCUMULATOR(6);

    private final int number;

    Level(int number) {
        this.number = number;
    }

    public boolean isAbove(Level other) { return number > other.number; }

    /** Returns the higher of this and the given level */
    public Level max(Level other) {
        return other.isAbove(this) ? other : this;
    }

    @Override
    public String toString() { return String.valueOf(number); }

}
