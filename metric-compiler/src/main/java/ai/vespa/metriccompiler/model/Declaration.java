// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.model;

import java.util.Objects;

/**
 * A declared quantity: a parameter, a built-in, or a local of a decode or post body.
 * All fields are fixed at construction except the level, which may only be raised.
 *
 * @see Builder
 *
 * @author mcomp
 */
public class Declaration {

    /** The line number of built-in quantities, which have no source line */
    public static final int BUILTIN_LINE = -1;

    private final String name;
    private final String type;
    private final String initializer;
    private final int lineNumber;
    private final String macro;
    private final String functionInit;
    private final String prerequisite;
    private final String contribution;
    private final String description;
    private final String comment;
    private Level level;

    private Declaration(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "A declaration must have a name");
        this.type = builder.type;
        this.initializer = builder.initializer;
        this.lineNumber = builder.lineNumber;
        this.level = builder.level;
        this.macro = builder.macro;
        this.functionInit = builder.functionInit;
        this.prerequisite = builder.prerequisite;
        this.contribution = builder.contribution;
        this.description = builder.description;
        this.comment = builder.comment;
    }

    public String name() { return name; }

    /** The C type of this, qualifiers included, e.g. "const unsigned int" */
    public String type() { return type; }

    /** The declarator text following the name up to the terminator, e.g. "= 0.5", or empty */
    public String initializer() { return initializer; }

    /** The source line of this, or {@link #BUILTIN_LINE} */
    public int lineNumber() { return lineNumber; }

    public boolean isBuiltin() { return lineNumber == BUILTIN_LINE; }

    public Level level() { return level; }

    /** The native expression substituted for this name wherever it is used, or empty if it is declared as a variable */
    public String macro() { return macro; }

    /** Code initializing this when a plain assignment cannot, or empty */
    public String functionInit() { return functionInit; }

    /** Code which must run once before the value of this may be fetched, or empty */
    public String prerequisite() { return prerequisite; }

    /** The collection-average expression used in place of this when no document is at hand, or empty */
    public String contribution() { return contribution; }

    public String description() { return description; }

    /** The trailing comment of the declaring line, or empty */
    public String comment() { return comment; }

    public boolean hasMacro() { return ! macro.isEmpty(); }

    /** Raises the level of this to the given level if that is higher. Returns whether the level changed. */
    public boolean raiseLevel(Level candidate) {
        if ( ! candidate.isAbove(level)) return false;
        level = candidate;
        return true;
    }

    @Override
    public String toString() {
        return "type/name/init/fninit " + type + " " + name + " " + initializer + " " + functionInit +
               "; lvl " + level + " line " + lineNumber + " macro " + macro + " comment " + comment +
               " pre " + prerequisite;
    }

    public static class Builder {

        private String name;
        private String type = "";
        private String initializer = "";
        private int lineNumber = BUILTIN_LINE;
        private Level level = Level.CONSTANT;
        private String macro = "";
        private String functionInit = "";
        private String prerequisite = "";
        private String contribution = "";
        private String description = "";
        private String comment = "";

        public Builder name(String name) { this.name = name; return this; }
        public Builder type(String type) { this.type = type; return this; }
        public Builder initializer(String initializer) { this.initializer = initializer; return this; }
        public Builder lineNumber(int lineNumber) { this.lineNumber = lineNumber; return this; }
        public Builder level(Level level) { this.level = Objects.requireNonNull(level); return this; }
        public Builder macro(String macro) { this.macro = macro; return this; }
        public Builder functionInit(String functionInit) { this.functionInit = functionInit; return this; }
        public Builder prerequisite(String prerequisite) { this.prerequisite = prerequisite; return this; }
        public Builder contribution(String contribution) { this.contribution = contribution; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder comment(String comment) { this.comment = comment.strip(); return this; }

        /** Returns a new declaration from the current state of this. Each call returns a distinct instance. */
        public Declaration build() {
            return new Declaration(this);
        }

    }

}
