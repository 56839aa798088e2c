package com.flowmable.labreport;

/**
 * Thrown when an sRGB to CIELAB transform cannot be constructed for the requested reference white.
 */
public class ColorProfileException extends RuntimeException {

    public ColorProfileException(String message) {
        super(message);
    }
}
