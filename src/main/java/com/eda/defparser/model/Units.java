package com.eda.defparser.model;

import lombok.Value;

/**
 * "UNITS DISTANCE MICRONS n" of the design.
 */
@Value
public class Units {

    public static final String MICRONS = "MICRONS";
    public static final int DEFAULT_DATABASE_UNITS_PER_MICRON = 1000;

    String distance;
    int databaseUnitsPerMicron;
    boolean defaultUsed;

    public static Units microns(int databaseUnitsPerMicron) {
        return new Units(MICRONS, databaseUnitsPerMicron, false);
    }

    public static Units defaults() {
        return new Units(MICRONS, DEFAULT_DATABASE_UNITS_PER_MICRON, true);
    }

    public double toMicrons(long databaseUnits) {
        return (double) databaseUnits / databaseUnitsPerMicron;
    }
}
