package com.eda.defparser.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Location and orientation of a placed component.
 *
 * Coordinates are kept as written in the file. When both parse as integers the
 * placement is numeric and {@link #getX()} / {@link #getY()} are usable;
 * otherwise only the raw strings are meaningful.
 */
@Value
@Builder
public class Placement {

    public static final String DEFAULT_ORIENTATION = "N";

    @NonNull
    String rawX;

    @NonNull
    String rawY;

    @NonNull
    String orientation;

    Integer x;

    Integer y;

    public static Placement numeric(int x, int y, String orientation) {
        return Placement.builder()
                .rawX(Integer.toString(x))
                .rawY(Integer.toString(y))
                .x(x)
                .y(y)
                .orientation(orientation)
                .build();
    }

    public static Placement raw(String rawX, String rawY, String orientation) {
        return Placement.builder()
                .rawX(rawX)
                .rawY(rawY)
                .orientation(orientation)
                .build();
    }

    public boolean isNumeric() {
        return x != null && y != null;
    }

    @Override
    public String toString() {
        return "(" + rawX + ", " + rawY + ", " + orientation + ")";
    }
}
