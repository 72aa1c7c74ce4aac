// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler;

/**
 * The state of one compilation which error reporting needs: the name of the description
 * being compiled and the line currently being read.
 * One instance is created per compilation and passed to every component which may fail.
 *
 * @author mcomp
 */
public class CompilationContext {

    private final String sourceName;
    private int lineNumber = 0;

    public CompilationContext(String sourceName) {
        this.sourceName = sourceName;
    }

    public String sourceName() { return sourceName; }

    /** The line most recently read, starting at 1, or 0 before any line is read */
    public int lineNumber() { return lineNumber; }

    public void setLineNumber(int lineNumber) { this.lineNumber = lineNumber; }

    /** Returns an exception for the given error at the current line */
    public MetricCompileException error(String reason) {
        return new MetricCompileException(sourceName, lineNumber, reason);
    }

    @Override
    public String toString() { return sourceName + ":" + lineNumber; }

}
