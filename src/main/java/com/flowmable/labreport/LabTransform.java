package com.flowmable.labreport;

/**
 * sRGB → CIELAB transform relative to a fixed reference white.
 * <p>
 * sRGB is defined against D65. For any other white the XYZ values are Bradford-adapted before
 * the Lab step, which is what an ICC transform into a D50 profile connection space does.
 * Instances are immutable and safe to share between worker threads.
 */
public final class LabTransform {

    private final WhitePoint whitePoint;
    private final double[][] rgbToXyz;

    private LabTransform(WhitePoint whitePoint, double[][] rgbToXyz) {
        this.whitePoint = whitePoint;
        this.rgbToXyz = rgbToXyz;
    }

    /**
     * Build the transform for a reference white.
     *
     * @throws ColorProfileException if the white point is missing, non-finite or non-positive
     */
    public static LabTransform forWhitePoint(WhitePoint whitePoint) {
        if (whitePoint == null) {
            throw new ColorProfileException("No reference white configured");
        }
        if (!valid(whitePoint.x()) || !valid(whitePoint.y()) || !valid(whitePoint.z())) {
            throw new ColorProfileException("Invalid reference white " + whitePoint.name()
                    + " [" + whitePoint.x() + ", " + whitePoint.y() + ", " + whitePoint.z() + "]");
        }
        if (whitePoint.equals(WhitePoint.D65)) {
            return new LabTransform(whitePoint, ColorSpaceUtils.SRGB_TO_XYZ_D65);
        }
        double[][] adapt = ColorSpaceUtils.bradfordAdaptation(WhitePoint.D65, whitePoint);
        return new LabTransform(whitePoint, ColorSpaceUtils.multiply(adapt, ColorSpaceUtils.SRGB_TO_XYZ_D65));
    }

    private static boolean valid(double v) {
        return Double.isFinite(v) && v > 0;
    }

    public WhitePoint whitePoint() {
        return whitePoint;
    }

    /**
     * Convert sRGB (0–255 per channel) to CIELAB [L*, a*, b*].
     */
    public double[] toLab(int r, int g, int b) {
        // 1. sRGB → linear RGB
        double rl = ColorSpaceUtils.linearize(r);
        double gl = ColorSpaceUtils.linearize(g);
        double bl = ColorSpaceUtils.linearize(b);

        // 2. Linear RGB → XYZ (relative to the configured white)
        double[][] m = rgbToXyz;
        double x = m[0][0] * rl + m[0][1] * gl + m[0][2] * bl;
        double y = m[1][0] * rl + m[1][1] * gl + m[1][2] * bl;
        double z = m[2][0] * rl + m[2][1] * gl + m[2][2] * bl;

        // 3. XYZ → Lab
        double fx = ColorSpaceUtils.labF(x / whitePoint.x());
        double fy = ColorSpaceUtils.labF(y / whitePoint.y());
        double fz = ColorSpaceUtils.labF(z / whitePoint.z());

        double L = 116.0 * fy - 16.0;
        double a = 500.0 * (fx - fy);
        double bStar = 200.0 * (fy - fz);
        return new double[]{L, a, bStar};
    }
}
