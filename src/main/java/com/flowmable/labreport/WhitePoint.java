package com.flowmable.labreport;

import java.util.List;
import java.util.Locale;

/**
 * Reference white of a CIELAB conversion, as CIE 1931 2° XYZ with Y normalized to 1.
 *
 * @param name Illuminant name used in configuration and logs
 * @param x    X of the white
 * @param y    Y of the white (1.0 for the standard illuminants)
 * @param z    Z of the white
 */
public record WhitePoint(String name, double x, double y, double z) {

    public static final WhitePoint A = new WhitePoint("A", 1.09850, 1.00000, 0.35585);
    /** ICC profile connection space white. */
    public static final WhitePoint D50 = new WhitePoint("D50", 0.96422, 1.00000, 0.82521);
    public static final WhitePoint D55 = new WhitePoint("D55", 0.95682, 1.00000, 0.92149);
    /** sRGB native white. */
    public static final WhitePoint D65 = new WhitePoint("D65", 0.95047, 1.00000, 1.08883);
    public static final WhitePoint D75 = new WhitePoint("D75", 0.94972, 1.00000, 1.22638);
    public static final WhitePoint E = new WhitePoint("E", 1.00000, 1.00000, 1.00000);

    private static final List<WhitePoint> STANDARD = List.of(A, D50, D55, D65, D75, E);

    /**
     * Look up a standard illuminant by name (case-insensitive).
     *
     * @throws ColorProfileException if the name is not a known illuminant
     */
    public static WhitePoint named(String name) {
        if (name != null) {
            String wanted = name.trim().toUpperCase(Locale.ROOT);
            for (WhitePoint wp : STANDARD) {
                if (wp.name.equals(wanted)) {
                    return wp;
                }
            }
        }
        throw new ColorProfileException("Unknown illuminant '" + name + "', expected one of "
                + STANDARD.stream().map(WhitePoint::name).toList());
    }

    public static List<WhitePoint> standard() {
        return STANDARD;
    }

    @Override
    public String toString() {
        return name;
    }
}
