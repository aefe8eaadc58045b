package org.newslens.model;

/**
 * Helpers for numeric confidence values.
 */
public final class Scores {

    private Scores() {
    }

    /**
     * Clamps a value to {@code [0, 1]}; {@code NaN} becomes {@code 0}.
     */
    public static double clampUnit(double value) {
        if (Double.isNaN(value) || value < 0d) {
            return 0d;
        }
        return Math.min(value, 1d);
    }
}
