package com.eda.defparser.progress;

/**
 * Observer of how far a DEF file has been read. Callbacks run on the parsing
 * thread and must not throw.
 */
public interface ParseProgressListener {

    ParseProgressListener NONE = new ParseProgressListener() {
    };

    default void onStart(long totalBytes) {
    }

    default void onProgress(long bytesRead) {
    }

    default void onFinish() {
    }
}
