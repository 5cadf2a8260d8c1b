package com.eda.defparser.transform;

/**
 * Raised when a worker fails while transforming a block of sections.
 */
public class DefTransformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DefTransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
