// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.emit;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for indenting multi-line code fragments.
 *
 * @author mcomp
 */
public class Indentation {

    private Indentation() {}

    /** Returns the given number of spaces, or none if the number is negative */
    public static String spaces(int count) {
        return count <= 0 ? "" : " ".repeat(count);
    }

    /** Returns the number of whitespace characters at the start of the given line */
    public static int leadingWhitespace(String line) {
        int count = 0;
        while (count < line.length() && Character.isWhitespace(line.charAt(count)))
            count++;
        return count;
    }

    /** Prefixes every line of the given text with the given number of spaces */
    public static String indent(String text, int columns) {
        List<String> indented = new ArrayList<>();
        for (String line : text.split("\n", -1))
            indented.add(spaces(columns) + line);
        return String.join("\n", indented);
    }

    /** Removes the whitespace common to the start of all non-blank lines of the given text */
    public static String dedent(String text) {
        String[] lines = text.split("\n", -1);
        int common = Integer.MAX_VALUE;
        for (String line : lines) {
            if ( ! line.isBlank())
                common = Math.min(common, leadingWhitespace(line));
        }
        if (common == Integer.MAX_VALUE) return text;

        List<String> dedented = new ArrayList<>();
        for (String line : lines)
            dedented.add(line.isBlank() ? line : line.substring(common));
        return String.join("\n", dedented);
    }

    /** Splits the given text into lines, each keeping its line terminator */
    public static List<String> linesWithTerminators(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int end = text.indexOf('\n', start);
            end = end < 0 ? text.length() : end + 1;
            lines.add(text.substring(start, end));
            start = end;
        }
        return lines;
    }

}
