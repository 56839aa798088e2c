package com.flowmable.labreport;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decodes images and builds their CIELAB histograms.
 * <p>
 * Every pixel is read as sRGB (alpha is dropped), converted with the configured
 * {@link LabTransform}, encoded to 8 bits per channel and counted.
 * Stateless apart from the transform, so one instance serves all worker threads.
 */
public class ColorSpaceConverter {

    private static final Logger logger = LogManager.getLogger(ColorSpaceConverter.class);

    private final LabTransform transform;

    public ColorSpaceConverter() {
        this(WhitePoint.D65);
    }

    /**
     * @throws ColorProfileException if no transform can be built for the white point
     */
    public ColorSpaceConverter(WhitePoint whitePoint) {
        this.transform = LabTransform.forWhitePoint(whitePoint);
    }

    public WhitePoint whitePoint() {
        return transform.whitePoint();
    }

    /**
     * Read and decode an image file.
     *
     * @throws ImageDecodeException if the file cannot be read or decoded
     */
    public LabHistogram histogram(Path imageFile) throws ImageDecodeException {
        return histogram(readBytes(imageFile), imageFile.toString());
    }

    /**
     * Decode an in-memory image.
     *
     * @param data   Encoded image bytes (PNG, JPEG, BMP, GIF, ...)
     * @param source Name used in errors and logs
     * @throws ImageDecodeException if the bytes are not a decodable image
     */
    public LabHistogram histogram(byte[] data, String source) throws ImageDecodeException {
        return histogram(decode(data, source));
    }

    /**
     * Build the histogram of an already decoded image.
     */
    public LabHistogram histogram(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        LabHistogram.Builder builder = LabHistogram.builder();
        int[] row = new int[w];

        for (int y = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int rgb = row[x];
                double[] lab = transform.toLab((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
                builder.add(
                        ColorSpaceUtils.encodeLightness(lab[0]),
                        ColorSpaceUtils.encodeChroma(lab[1]),
                        ColorSpaceUtils.encodeChroma(lab[2]));
            }
        }
        LabHistogram histogram = builder.build();
        logger.debug("Built {} histogram over {} pixels ({}x{})", transform.whitePoint(), histogram.pixelCount(), w, h);
        return histogram;
    }

    static byte[] readBytes(Path imageFile) throws ImageDecodeException {
        try {
            return Files.readAllBytes(imageFile);
        } catch (IOException e) {
            throw new ImageDecodeException(imageFile.toString(), "Failed to read image", e);
        }
    }

    static BufferedImage decode(byte[] data, String source) throws ImageDecodeException {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(data));
        } catch (IOException | RuntimeException e) {
            throw new ImageDecodeException(source, "Failed to decode image", e);
        }
        if (image == null) {
            throw new ImageDecodeException(source, "Unsupported or unreadable image format");
        }
        return image;
    }
}
