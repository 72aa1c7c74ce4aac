// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.lexer;

/**
 * A token of metric source text and the offset of its first character in the line it was read from.
 *
 * @author mcomp
 */
public record Token(String text, int offset, TokenType type) {

    public boolean isWhitespace() { return type == TokenType.WHITESPACE; }

    public boolean isTerminator() { return type == TokenType.TERMINATOR; }

    public boolean is(String text) { return this.text.equals(text); }

    @Override
    public String toString() { return "'" + text + "'@" + offset; }

}
