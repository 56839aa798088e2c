package com.flowmable.labreport;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Validates sRGB→Lab conversion, chromatic adaptation and the 8-bit Lab encoding.
 */
class ColorSpaceUtilsTest {

    private final LabTransform d65 = LabTransform.forWhitePoint(WhitePoint.D65);
    private final LabTransform d50 = LabTransform.forWhitePoint(WhitePoint.D50);

    @Test
    void srgbToLab_pureWhite() {
        double[] lab = d65.toLab(255, 255, 255);
        assertEquals(100.0, lab[0], 0.01);
        assertEquals(0.0, lab[1], 0.01);
        assertEquals(0.0, lab[2], 0.01);
    }

    @Test
    void srgbToLab_pureBlack() {
        double[] lab = d65.toLab(0, 0, 0);
        assertEquals(0.0, lab[0], 0.01);
        assertEquals(0.0, lab[1], 0.01);
        assertEquals(0.0, lab[2], 0.01);
    }

    @Test
    void srgbToLab_pureRed() {
        double[] lab = d65.toLab(255, 0, 0);
        assertEquals(53.2, lab[0], 0.5);
        assertEquals(80.1, lab[1], 0.5);
        assertEquals(67.2, lab[2], 0.5);
    }

    @Test
    void srgbToLab_pureGreen() {
        double[] lab = d65.toLab(0, 255, 0);
        assertEquals(87.7, lab[0], 0.5);
        assertTrue(lab[1] < -70);
    }

    @Test
    void srgbToLab_midGray() {
        double[] lab = d65.toLab(128, 128, 128);
        assertEquals(53.6, lab[0], 0.5);
        assertEquals(0.0, lab[1], 0.01);
        assertEquals(0.0, lab[2], 0.01);
    }

    @Test
    void d50_keepsWhiteNeutral() {
        double[] lab = d50.toLab(255, 255, 255);
        assertEquals(100.0, lab[0], 0.01);
        assertEquals(0.0, lab[1], 0.05);
        assertEquals(0.0, lab[2], 0.05);
    }

    @Test
    void d50_redMatchesIccReference() {
        // sRGB red in a D50 profile connection space
        double[] lab = d50.toLab(255, 0, 0);
        assertEquals(54.3, lab[0], 0.5);
        assertEquals(80.8, lab[1], 0.8);
        assertEquals(69.9, lab[2], 0.8);
    }

    @Test
    void bradford_mapsSourceWhiteOntoTarget() {
        double[][] m = ColorSpaceUtils.bradfordAdaptation(WhitePoint.D65, WhitePoint.D50);
        double[] w = ColorSpaceUtils.multiply(m,
                new double[]{WhitePoint.D65.x(), WhitePoint.D65.y(), WhitePoint.D65.z()});
        assertEquals(WhitePoint.D50.x(), w[0], 1e-6);
        assertEquals(WhitePoint.D50.y(), w[1], 1e-6);
        assertEquals(WhitePoint.D50.z(), w[2], 1e-6);
    }

    @Test
    void invert_roundTripsToIdentity() {
        double[][] id = ColorSpaceUtils.multiply(ColorSpaceUtils.BRADFORD, ColorSpaceUtils.invert(ColorSpaceUtils.BRADFORD));
        for (int i = 0; i < 3; i++)
            for (int j = 0; j < 3; j++)
                assertEquals(i == j ? 1.0 : 0.0, id[i][j], 1e-12);
    }

    @Test
    void encoding_scalesLightnessAndCentersChroma() {
        assertEquals(255, ColorSpaceUtils.encodeLightness(100.0));
        assertEquals(0, ColorSpaceUtils.encodeLightness(0.0));
        assertEquals(128, ColorSpaceUtils.encodeLightness(50.2));
        assertEquals(128, ColorSpaceUtils.encodeChroma(0.0));
        assertEquals(0, ColorSpaceUtils.encodeChroma(-128.0));
        assertEquals(255, ColorSpaceUtils.encodeChroma(127.0));
    }

    @Test
    void encoding_clampsOutOfRange() {
        assertEquals(255, ColorSpaceUtils.encodeLightness(100.4));
        assertEquals(0, ColorSpaceUtils.encodeChroma(-140.0));
        assertEquals(255, ColorSpaceUtils.encodeChroma(150.0));
    }

    @Test
    void linearize_endpoints() {
        assertEquals(0.0, ColorSpaceUtils.linearize(0), 1e-12);
        assertEquals(1.0, ColorSpaceUtils.linearize(255), 1e-12);
        assertEquals(0.2158605, ColorSpaceUtils.linearize(128), 1e-6);
    }

    @Test
    void whitePoint_lookupIsCaseInsensitive() {
        assertSame(WhitePoint.D50, WhitePoint.named("d50"));
        assertSame(WhitePoint.D65, WhitePoint.named(" D65 "));
    }

    @Test
    void whitePoint_unknownNameIsProfileError() {
        assertThrows(ColorProfileException.class, () -> WhitePoint.named("D93"));
        assertThrows(ColorProfileException.class, () -> WhitePoint.named(null));
    }

    @Test
    void transform_rejectsInvalidWhite() {
        assertThrows(ColorProfileException.class, () -> LabTransform.forWhitePoint(null));
        assertThrows(ColorProfileException.class,
                () -> LabTransform.forWhitePoint(new WhitePoint("bad", 0.95, 0.0, 1.08)));
        assertThrows(ColorProfileException.class,
                () -> LabTransform.forWhitePoint(new WhitePoint("nan", Double.NaN, 1.0, 1.0)));
    }

    @Test
    void transform_everyStandardWhiteKeepsWhiteAtFullLightness() {
        for (WhitePoint wp : WhitePoint.standard()) {
            double[] lab = LabTransform.forWhitePoint(wp).toLab(255, 255, 255);
            assertEquals(100.0, lab[0], 0.01, wp.name());
        }
    }
}
