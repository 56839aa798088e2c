package com.flowmable.labreport;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Reduces Lab histograms to weighted-average triples.
 * <p>
 * All functions are pure; identical inputs give bit-identical outputs.
 */
public final class HistogramStatistics {

    private HistogramStatistics() {}

    /**
     * Count-weighted mean bin index: Σ(i · count[i]) / Σ(count[i]).
     *
     * @param counts 256 bin counts of one channel
     * @return mean bin index in [0, 255]
     * @throws EmptyHistogramException if every bin is zero
     */
    public static double weightedAverage(long[] counts) {
        if (counts == null || counts.length != LabHistogram.BINS) {
            throw new IllegalArgumentException("Expected " + LabHistogram.BINS + " bins");
        }
        long total = 0;
        double weighted = 0;
        for (int i = 0; i < counts.length; i++) {
            total += counts[i];
            weighted += (double) i * counts[i];
        }
        if (total == 0) {
            throw new EmptyHistogramException("Histogram has no pixels");
        }
        return weighted / total;
    }

    /**
     * Remapped weighted average of each channel. Not rounded.
     *
     * @throws EmptyHistogramException if the histogram has no pixels
     */
    public static ChannelAverages averages(LabHistogram histogram) {
        return new ChannelAverages(
                channelAverage(histogram, Channel.L),
                channelAverage(histogram, Channel.A),
                channelAverage(histogram, Channel.B));
    }

    public static double channelAverage(LabHistogram histogram, Channel channel) {
        return remap(channel, weightedAverage(histogram.counts(channel)));
    }

    public static double remap(Channel channel, double binMean) {
        return channel.remap(binMean);
    }

    /**
     * Round half-even on the exact binary value, so 2.675 rounds to 2.67.
     * Negative zero comes back as 0.0.
     */
    public static double round(double value, int digits) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Cannot round " + value);
        }
        return new BigDecimal(value).setScale(digits, RoundingMode.HALF_EVEN).doubleValue() + 0.0;
    }
}
