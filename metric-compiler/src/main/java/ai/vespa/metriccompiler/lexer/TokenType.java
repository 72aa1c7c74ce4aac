// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.lexer;

/**
 * The character classes a line of metric source is split into.
 *
 * @author mcomp
 */
public enum TokenType {

    /** A run of whitespace, line terminators included */
    WHITESPACE,

    /** A run of operator symbols, see {@link Tokenizer#isOperator(char)} */
    OPERATOR,

    /** The statement terminator ';', always a single character */
    TERMINATOR,

    /** Anything else: identifiers, numbers, literals */
    WORD

}
