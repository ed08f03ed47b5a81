package com.sensemaking.common.util;

/**
 * Formatting of rates as percentages for human-readable messages.
 */
public final class Percentages {

    private Percentages() {}

    /** {@code 0.6 → "60%"}, {@code 0.125 → "13%"}. */
    public static String format(double decimal) {
        return format(decimal, 0);
    }

    /**
     * @param decimal   rate to format, 1.0 = 100%
     * @param precision number of fractional digits to keep
     */
    public static String format(double decimal, int precision) {
        double scale = Math.pow(10, precision);
        double rounded = Math.round(decimal * 100.0 * scale) / scale;
        if (precision == 0 || rounded == Math.rint(rounded)) {
            return (long) rounded + "%";
        }
        return rounded + "%";
    }
}
