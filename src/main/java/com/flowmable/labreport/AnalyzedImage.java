package com.flowmable.labreport;

import java.nio.file.Path;

/**
 * A decoded image with its derived data. Created once per successful decode and never mutated.
 *
 * @param source      Path the image was read from
 * @param contentHash Hex SHA-256 of the encoded bytes
 * @param histogram   CIELAB histogram
 * @param averages    Full-precision weighted averages of the histogram
 */
public record AnalyzedImage(
        Path source,
        String contentHash,
        LabHistogram histogram,
        ChannelAverages averages
) {}
