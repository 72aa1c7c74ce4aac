// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.metriccompiler.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a line of C-like text into whitespace, operator, terminator and word tokens.
 * Each run is extended greedily within its class, except the terminator ';' which is always
 * a token by itself. There is no awareness of string literals or escapes, so an operator
 * character inside a quoted string still breaks the string into several tokens.
 *
 * @see Token
 *
 * @author mcomp
 */
public class Tokenizer {

    private static final String operators = "-+,=()?:*/~!^|&[]{}%<>";

    private Tokenizer() {}

    /** Returns whether the given character belongs to the closed set of operator symbols */
    public static boolean isOperator(char c) {
        return operators.indexOf(c) >= 0;
    }

    /** Returns all tokens of the given text, whitespace included. Concatenating the token texts gives back the input. */
    public static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int position = 0;
        while (position < text.length()) {
            TokenType type = classify(text.charAt(position));
            int end = position + 1;
            if (type != TokenType.TERMINATOR) {
                while (end < text.length() && classify(text.charAt(end)) == type)
                    end++;
            }
            tokens.add(new Token(text.substring(position, end), position, type));
            position = end;
        }
        return tokens;
    }

    /** Returns the tokens of the given text which are not whitespace, keeping their offsets into the text */
    public static List<Token> tokenizeSkippingWhitespace(String text) {
        List<Token> tokens = new ArrayList<>();
        for (Token token : tokenize(text)) {
            if ( ! token.isWhitespace())
                tokens.add(token);
        }
        return tokens;
    }

    /** Returns the texts of the non-whitespace tokens of the given text */
    public static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        for (Token token : tokenizeSkippingWhitespace(text))
            words.add(token.text());
        return words;
    }

    private static TokenType classify(char c) {
        if (Character.isWhitespace(c)) return TokenType.WHITESPACE;
        if (isOperator(c)) return TokenType.OPERATOR;
        if (c == ';') return TokenType.TERMINATOR;
        return TokenType.WORD;
    }

}
