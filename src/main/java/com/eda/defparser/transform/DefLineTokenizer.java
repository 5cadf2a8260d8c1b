package com.eda.defparser.transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one cleaned DEF statement into tokens.
 *
 * Rules, first match wins at each position:
 * <ol>
 *   <li>whitespace is skipped;</li>
 *   <li>"+" and the word after it become one token "+ WORD", e.g. "+ PLACED";</li>
 *   <li>"(" at line start or after whitespace opens a group that runs to the
 *       balancing ")" and is kept whole, e.g. "( 100 200 )";</li>
 *   <li>a double quote opens a literal up to the closing quote, backslash escapes;</li>
 *   <li>anything else is a word up to whitespace or a quote, so "a(b)" stays one token.</li>
 * </ol>
 * Unbalanced groups and unterminated literals run to the end of the line.
 */
public class DefLineTokenizer {

    private static final char PLUS = '+';
    private static final char OPEN = '(';
    private static final char CLOSE = ')';
    private static final char QUOTE = '"';
    private static final char ESCAPE = '\\';

    private final String source;
    private int pos = 0;

    public DefLineTokenizer(String line) {
        this.source = line.strip();
    }

    public static List<String> split(String line) {
        return new DefLineTokenizer(line).tokenize();
    }

    public List<String> tokenize() {
        List<String> tokens = new ArrayList<>();

        while (pos < source.length()) {
            skipWhitespace();
            if (pos >= source.length()) {
                break;
            }

            char c = source.charAt(pos);
            if (c == PLUS && pos + 1 < source.length()) {
                tokens.add(readKeyword());
            } else if (c == OPEN && (pos == 0 || Character.isWhitespace(source.charAt(pos - 1)))) {
                tokens.add(readGroup());
            } else if (c == QUOTE) {
                tokens.add(readQuoted());
            } else {
                String word = readWord();
                if (word.isEmpty()) {
                    pos++;
                } else {
                    tokens.add(word);
                }
            }
        }

        return tokens;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private String readKeyword() {
        int j = pos + 1;
        while (j < source.length() && Character.isWhitespace(source.charAt(j))) {
            j++;
        }
        int wordStart = j;
        while (j < source.length() && !Character.isWhitespace(source.charAt(j)) && source.charAt(j) != QUOTE) {
            j++;
        }
        if (wordStart == j) {
            // lone "+"
            pos++;
            return String.valueOf(PLUS);
        }
        pos = j;
        return PLUS + " " + source.substring(wordStart, j);
    }

    private String readGroup() {
        int start = pos;
        int depth = 1;
        pos++;
        while (pos < source.length() && depth > 0) {
            char c = source.charAt(pos);
            if (c == OPEN) {
                depth++;
            } else if (c == CLOSE) {
                depth--;
            }
            pos++;
        }
        return source.substring(start, pos);
    }

    private String readQuoted() {
        int start = pos;
        pos++;
        while (pos < source.length() && source.charAt(pos) != QUOTE) {
            pos += source.charAt(pos) == ESCAPE ? 2 : 1;
        }
        if (pos < source.length()) {
            pos++;
        }
        pos = Math.min(pos, source.length());
        return source.substring(start, pos);
    }

    private String readWord() {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c) || c == QUOTE) {
                break;
            }
            if (c == OPEN && pos > start && Character.isWhitespace(source.charAt(pos - 1))) {
                break;
            }
            pos++;
        }
        return source.substring(start, pos);
    }
}
