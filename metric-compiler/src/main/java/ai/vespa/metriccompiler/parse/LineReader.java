// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.parse;

import ai.vespa.metriccompiler.CompilationContext;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Reads a description line by line, keeping the line number of the compilation context current.
 *
 * @author mcomp
 */
public class LineReader {

    private final BufferedReader reader;
    private final CompilationContext context;
    private int lineNumber = 0;

    public LineReader(Reader reader, CompilationContext context) {
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        this.context = context;
    }

    /** Returns the next line without its line terminator, or null at the end of input */
    public String next() throws IOException {
        String line = reader.readLine();
        if (line != null) {
            lineNumber++;
            context.setLineNumber(lineNumber);
        }
        return line;
    }

    /** The number of the line last returned, starting at 1 */
    public int lineNumber() { return lineNumber; }

}
