package com.flowmable.labreport;

/**
 * Color space conversion helpers shared by {@link LabTransform}.
 * <p>
 * Provides the sRGB transfer function (as a 256-entry lookup table), the linear sRGB → XYZ (D65)
 * matrix, Bradford chromatic adaptation, the CIELAB companding function and the 8-bit Lab
 * encoding used by the histograms (L scaled by 2.55, a/b offset by 128).
 */
public final class ColorSpaceUtils {

    private ColorSpaceUtils() {}

    /** Linear sRGB → XYZ, D65 reference white (IEC 61966-2-1). */
    static final double[][] SRGB_TO_XYZ_D65 = {
            {0.4124564, 0.3575761, 0.1804375},
            {0.2126729, 0.7151522, 0.0721750},
            {0.0193339, 0.1191920, 0.9503041}
    };

    /** Bradford cone response matrix. */
    static final double[][] BRADFORD = {
            {0.8951, 0.2664, -0.1614},
            {-0.7502, 1.7135, 0.0367},
            {0.0389, -0.0685, 1.0296}
    };

    private static final double[] LINEAR = new double[256];

    static {
        for (int i = 0; i < 256; i++) {
            LINEAR[i] = gammaExpand(i / 255.0);
        }
    }

    /**
     * Linear-light value of an 8-bit sRGB component.
     */
    public static double linearize(int component) {
        return LINEAR[component & 0xFF];
    }

    static double gammaExpand(double c) {
        return c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    static double labF(double t) {
        return t > 0.008856 ? Math.cbrt(t) : (903.3 * t + 16.0) / 116.0;
    }

    /**
     * Encode L* (0–100) as an 8-bit histogram bin.
     */
    public static int encodeLightness(double l) {
        return clamp8((int) Math.round(l * 2.55));
    }

    /**
     * Encode a* or b* (signed) as an 8-bit histogram bin centered on 128.
     */
    public static int encodeChroma(double v) {
        return clamp8((int) Math.round(v) + 128);
    }

    private static int clamp8(int v) {
        return Math.min(255, Math.max(0, v));
    }

    /**
     * Bradford adaptation matrix moving XYZ relative to {@code source} onto {@code target}.
     */
    static double[][] bradfordAdaptation(WhitePoint source, WhitePoint target) {
        double[] src = multiply(BRADFORD, new double[]{source.x(), source.y(), source.z()});
        double[] dst = multiply(BRADFORD, new double[]{target.x(), target.y(), target.z()});
        double[][] scale = {
                {dst[0] / src[0], 0, 0},
                {0, dst[1] / src[1], 0},
                {0, 0, dst[2] / src[2]}
        };
        return multiply(invert(BRADFORD), multiply(scale, BRADFORD));
    }

    static double[] multiply(double[][] m, double[] v) {
        return new double[]{
                m[0][0] * v[0] + m[0][1] * v[1] + m[0][2] * v[2],
                m[1][0] * v[0] + m[1][1] * v[1] + m[1][2] * v[2],
                m[2][0] * v[0] + m[2][1] * v[1] + m[2][2] * v[2]
        };
    }

    static double[][] multiply(double[][] a, double[][] b) {
        double[][] out = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                out[i][j] = a[i][0] * b[0][j] + a[i][1] * b[1][j] + a[i][2] * b[2][j];
            }
        }
        return out;
    }

    static double[][] invert(double[][] m) {
        double c00 = m[1][1] * m[2][2] - m[1][2] * m[2][1];
        double c01 = m[1][2] * m[2][0] - m[1][0] * m[2][2];
        double c02 = m[1][0] * m[2][1] - m[1][1] * m[2][0];
        double det = m[0][0] * c00 + m[0][1] * c01 + m[0][2] * c02;
        if (det == 0 || !Double.isFinite(det)) {
            throw new ColorProfileException("Singular color matrix");
        }
        double inv = 1.0 / det;
        return new double[][]{
                {c00 * inv, (m[0][2] * m[2][1] - m[0][1] * m[2][2]) * inv, (m[0][1] * m[1][2] - m[0][2] * m[1][1]) * inv},
                {c01 * inv, (m[0][0] * m[2][2] - m[0][2] * m[2][0]) * inv, (m[0][2] * m[1][0] - m[0][0] * m[1][2]) * inv},
                {c02 * inv, (m[0][1] * m[2][0] - m[0][0] * m[2][1]) * inv, (m[0][0] * m[1][1] - m[0][1] * m[1][0]) * inv}
        };
    }
}
