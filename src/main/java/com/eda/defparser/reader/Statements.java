package com.eda.defparser.reader;

/**
 * Statement-level helpers shared by the block readers.
 */
final class Statements {

    static final char TERMINATOR = ';';
    static final String ENTRY_MARKER = "-";
    static final String EXTENSION_BLOCK = "BEGINEXT";
    static final String EXTENSION_END = "ENDEXT";

    private Statements() {
    }

    /**
     * Index of the first ";" at or after {@code from} that is not inside a
     * quoted literal, or -1.
     */
    static int indexOfTerminator(String line, int from) {
        boolean quoted = false;
        for (int i = from; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    quoted = false;
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == TERMINATOR) {
                return i;
            }
        }
        return -1;
    }

    static boolean hasTerminator(String line) {
        return indexOfTerminator(line, 0) >= 0;
    }

    static boolean isEndMarker(String line, String prefix) {
        String[] words = line.strip().split("\\s+");
        if (EXTENSION_BLOCK.equals(prefix)) {
            return EXTENSION_END.equals(words[0]);
        }
        return words.length >= 2 && "END".equals(words[0]) && prefix.equals(words[1]);
    }

    static boolean isSkippable(String line) {
        String trimmed = line.strip();
        return trimmed.isEmpty() || trimmed.startsWith("#");
    }

    static boolean startsEntry(String trimmed) {
        return trimmed.startsWith(ENTRY_MARKER);
    }
}
