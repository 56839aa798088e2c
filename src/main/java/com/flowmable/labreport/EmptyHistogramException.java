package com.flowmable.labreport;

/**
 * Thrown when a histogram with no pixels is averaged. An empty image has no average,
 * so this is reported instead of producing NaN.
 */
public class EmptyHistogramException extends IllegalArgumentException {

    public EmptyHistogramException(String message) {
        super(message);
    }

    public EmptyHistogramException(String message, Throwable cause) {
        super(message, cause);
    }
}
