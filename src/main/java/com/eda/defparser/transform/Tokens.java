package com.eda.defparser.transform;

/**
 * Shape tests and helpers for tokens produced by {@link DefLineTokenizer}.
 */
final class Tokens {

    static final String ENTRY_MARKER = "-";
    static final String KEYWORD_PREFIX = "+ ";

    private Tokens() {
    }

    static boolean isKeyword(String token) {
        return token.startsWith(KEYWORD_PREFIX);
    }

    static String keywordName(String token) {
        return token.substring(KEYWORD_PREFIX.length());
    }

    static boolean isGroup(String token) {
        return token.startsWith("(") && token.endsWith(")");
    }

    /**
     * Removes any leading and trailing parentheses and whitespace,
     * "( 100 200 )" becomes "100 200".
     */
    static String stripGroup(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && isGroupPadding(token.charAt(start))) {
            start++;
        }
        while (end > start && isGroupPadding(token.charAt(end - 1))) {
            end--;
        }
        return token.substring(start, end);
    }

    static String[] groupWords(String token) {
        String inner = stripGroup(token);
        return inner.isEmpty() ? new String[0] : inner.split("\\s+");
    }

    private static boolean isGroupPadding(char c) {
        return c == '(' || c == ')' || Character.isWhitespace(c);
    }
}
