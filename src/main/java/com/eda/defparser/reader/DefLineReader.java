package com.eda.defparser.reader;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.eda.defparser.progress.ParseProgressListener;

/**
 * Line source shared by the orchestrator and the block readers. Counts lines
 * and bytes consumed and reports them to the progress listener.
 */
public class DefLineReader implements Closeable {

    private final BufferedReader reader;
    private final ParseProgressListener progressListener;
    private long bytesRead;
    private int lineNumber;

    public DefLineReader(BufferedReader reader, ParseProgressListener progressListener) {
        this.reader = reader;
        this.progressListener = progressListener != null ? progressListener : ParseProgressListener.NONE;
    }

    public DefLineReader(BufferedReader reader) {
        this(reader, ParseProgressListener.NONE);
    }

    /**
     * Next line without its line terminator, or null at end of input.
     */
    public String readLine() throws IOException {
        String line = reader.readLine();
        if (line == null) {
            return null;
        }
        lineNumber++;
        // +1 for the newline readLine() dropped
        bytesRead += line.getBytes(StandardCharsets.UTF_8).length + 1L;
        progressListener.onProgress(bytesRead);
        return line;
    }

    public long getBytesRead() {
        return bytesRead;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
