package com.eda.defparser.parser;

/**
 * Raised under {@link com.eda.defparser.config.DuplicateNamePolicy#REJECT} when an
 * instance or net name occurs twice.
 */
public class DuplicateNameException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String kind;
    private final String name;

    public DuplicateNameException(String kind, String name) {
        super("Duplicate " + kind + " name: " + name);
        this.kind = kind;
        this.name = name;
    }

    public String getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }
}
