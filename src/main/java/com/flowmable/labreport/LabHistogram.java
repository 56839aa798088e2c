package com.flowmable.labreport;

import java.util.Arrays;

/**
 * Per-channel 256-bin histogram of an 8-bit encoded CIELAB image.
 * <p>
 * Immutable once built: {@link #counts(Channel)} hands out copies.
 */
public final class LabHistogram {

    public static final int BINS = 256;

    private final long[][] counts;
    private final long pixelCount;

    private LabHistogram(long[][] counts, long pixelCount) {
        this.counts = counts;
        this.pixelCount = pixelCount;
    }

    /**
     * Wrap three 256-entry count arrays (L, a, b). The arrays are copied.
     *
     * @throws IllegalArgumentException on a wrong bin count, a negative count,
     *                                  or channels that disagree on the pixel total
     */
    public static LabHistogram of(long[] l, long[] a, long[] b) {
        long[][] copy = {copyOf(l, Channel.L), copyOf(a, Channel.A), copyOf(b, Channel.B)};
        long total = Arrays.stream(copy[0]).sum();
        for (int c = 1; c < copy.length; c++) {
            long channelTotal = Arrays.stream(copy[c]).sum();
            if (channelTotal != total) {
                throw new IllegalArgumentException("Channel " + Channel.values()[c]
                        + " counts " + channelTotal + " pixels, L counts " + total);
            }
        }
        return new LabHistogram(copy, total);
    }

    private static long[] copyOf(long[] bins, Channel channel) {
        if (bins == null || bins.length != BINS) {
            throw new IllegalArgumentException("Channel " + channel + " must have " + BINS + " bins");
        }
        for (long v : bins) {
            if (v < 0) {
                throw new IllegalArgumentException("Channel " + channel + " has a negative count");
            }
        }
        return bins.clone();
    }

    /**
     * Accumulates encoded Lab pixels. Not thread-safe; one per image.
     */
    public static final class Builder {
        private final long[][] counts = new long[3][BINS];
        private long pixels;

        public Builder add(int l8, int a8, int b8) {
            counts[0][l8]++;
            counts[1][a8]++;
            counts[2][b8]++;
            pixels++;
            return this;
        }

        public LabHistogram build() {
            return new LabHistogram(new long[][]{counts[0].clone(), counts[1].clone(), counts[2].clone()}, pixels);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public long[] counts(Channel channel) {
        return counts[channel.ordinal()].clone();
    }

    public long count(Channel channel, int bin) {
        return counts[channel.ordinal()][bin];
    }

    public long pixelCount() {
        return pixelCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabHistogram other)) return false;
        return Arrays.deepEquals(counts, other.counts);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(counts);
    }

    @Override
    public String toString() {
        return "LabHistogram[pixels=" + pixelCount + "]";
    }
}
