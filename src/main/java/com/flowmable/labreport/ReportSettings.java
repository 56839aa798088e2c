package com.flowmable.labreport;

/**
 * Configuration for histogram conversion and report rounding.
 *
 * @param whitePoint     Reference white of the sRGB → CIELAB transform
 * @param averageDigits  Decimal places of reported averages
 * @param deltaDigits    Decimal places of reported deltas
 * @param roundingPolicy Whether averages are rounded before differencing
 * @param workerThreads  Size of the per-report image analysis pool
 */
public record ReportSettings(
        WhitePoint whitePoint,
        int averageDigits,
        int deltaDigits,
        RoundingPolicy roundingPolicy,
        int workerThreads
) {
    public static final ReportSettings DEFAULT = new ReportSettings(
            WhitePoint.D65,  // 6500 K Lab profile
            2,               // averageDigits
            3,               // deltaDigits
            RoundingPolicy.FINAL_VALUES,
            Math.max(1, Runtime.getRuntime().availableProcessors())
    );

    public ReportSettings {
        if (whitePoint == null) {
            throw new IllegalArgumentException("whitePoint is required");
        }
        if (roundingPolicy == null) {
            throw new IllegalArgumentException("roundingPolicy is required");
        }
        if (averageDigits < 0 || deltaDigits < 0) {
            throw new IllegalArgumentException("Rounding digits must be >= 0");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got " + workerThreads);
        }
    }

    public ReportSettings withWhitePoint(WhitePoint wp) {
        return new ReportSettings(wp, averageDigits, deltaDigits, roundingPolicy, workerThreads);
    }

    public ReportSettings withRoundingPolicy(RoundingPolicy policy) {
        return new ReportSettings(whitePoint, averageDigits, deltaDigits, policy, workerThreads);
    }

    public ReportSettings withWorkerThreads(int threads) {
        return new ReportSettings(whitePoint, averageDigits, deltaDigits, roundingPolicy, threads);
    }

    public ReportSettings withDigits(int averages, int deltas) {
        return new ReportSettings(whitePoint, averages, deltas, roundingPolicy, workerThreads);
    }
}
