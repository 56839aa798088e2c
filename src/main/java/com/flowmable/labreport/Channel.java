package com.flowmable.labreport;

/**
 * The three CIELAB histogram channels, in report column order.
 */
public enum Channel {
    /** Lightness. Bin index / 2.55 gives L* on 0–100. */
    L("L"),
    /** Green–red axis. Bin index − 128 gives a* on −128…127. */
    A("a"),
    /** Blue–yellow axis. Bin index − 128 gives b* on −128…127. */
    B("b");

    private final String suffix;

    Channel(String suffix) {
        this.suffix = suffix;
    }

    /** Column suffix used in the CSV headers. */
    public String suffix() {
        return suffix;
    }

    /**
     * Map a mean bin index (0–255) onto this channel's display range.
     */
    public double remap(double binMean) {
        return this == L ? binMean / 2.55 : binMean - 128;
    }
}
