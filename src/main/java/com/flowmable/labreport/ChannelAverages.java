package com.flowmable.labreport;

/**
 * Weighted-average CIELAB triple of one image, after channel remapping.
 * Values are kept at full precision; round with {@link #rounded(int)} for display.
 *
 * @param l L* in [0, 100]
 * @param a a* in [−128, 127]
 * @param b b* in [−128, 127]
 */
public record ChannelAverages(double l, double a, double b) {

    public ChannelAverages rounded(int digits) {
        return new ChannelAverages(
                HistogramStatistics.round(l, digits),
                HistogramStatistics.round(a, digits),
                HistogramStatistics.round(b, digits));
    }

    public double get(Channel channel) {
        return switch (channel) {
            case L -> l;
            case A -> a;
            case B -> b;
        };
    }
}
