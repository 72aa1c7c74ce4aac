// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler;

/**
 * A fatal error in a metric description. Compilation stops at the first one.
 *
 * @see CompilationContext#error(String)
 *
 * @author mcomp
 */
public class MetricCompileException extends Exception {

    private final String sourceName;
    private final int lineNumber;
    private final String reason;

    public MetricCompileException(String sourceName, int lineNumber, String reason) {
        super(sourceName + ":" + lineNumber + ": " + reason);
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
        this.reason = reason;
    }

    /** The name of the description file containing the error */
    public String sourceName() { return sourceName; }

    /** The line of the error, or the best known line near it */
    public int lineNumber() { return lineNumber; }

    /** The error message without source location */
    public String reason() { return reason; }

}
