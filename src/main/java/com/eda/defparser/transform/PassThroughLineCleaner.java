package com.eda.defparser.transform;

/**
 * Cleaner for entries already joined by the multi-line block reader, which
 * removes the terminator itself.
 */
public class PassThroughLineCleaner implements LineCleaner {

    @Override
    public String clean(String line) {
        return line.strip();
    }
}
