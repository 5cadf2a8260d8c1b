package com.eda.defparser.model;

import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Design-level attributes read from the DEF header statements.
 */
@Value
@Builder
public class HeaderInfo {
    String version;
    String design;
    String technology;
    @NonNull
    Units units;
    String dividerChar;
    String busBitChars;

    public Optional<String> findVersion() {
        return Optional.ofNullable(version);
    }

    public Optional<String> findDesign() {
        return Optional.ofNullable(design);
    }

    public Optional<String> findTechnology() {
        return Optional.ofNullable(technology);
    }

    public int getDatabaseUnitsPerMicron() {
        return units.getDatabaseUnitsPerMicron();
    }
}
