package com.eda.defparser.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs parse progress at every 10% of the file.
 */
public class LoggingProgressListener implements ParseProgressListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

    private static final int STEP_PERCENT = 10;

    private final String label;
    private long totalBytes;
    private int lastReported;

    public LoggingProgressListener(String label) {
        this.label = label;
    }

    @Override
    public void onStart(long totalBytes) {
        this.totalBytes = totalBytes;
        this.lastReported = 0;
        log.info("{}: {} bytes", label, totalBytes);
    }

    @Override
    public void onProgress(long bytesRead) {
        if (totalBytes <= 0) {
            return;
        }
        int percent = (int) Math.min(100, bytesRead * 100 / totalBytes);
        if (percent >= lastReported + STEP_PERCENT) {
            lastReported = percent - percent % STEP_PERCENT;
            log.info("{}: {}%", label, lastReported);
        }
    }

    @Override
    public void onFinish() {
        if (lastReported < 100) {
            log.info("{}: 100%", label);
        }
    }
}
