package com.flowmable.labreport;

import java.io.IOException;

/**
 * Thrown when an image source cannot be read or is not in a format ImageIO can decode.
 */
public class ImageDecodeException extends IOException {

    private final String source;

    public ImageDecodeException(String source, String message) {
        super(message + ": " + source);
        this.source = source;
    }

    public ImageDecodeException(String source, String message, Throwable cause) {
        super(message + ": " + source, cause);
        this.source = source;
    }

    /** The path or identifier of the image that failed. */
    public String getSource() {
        return source;
    }
}
