package com.flowmable.labreport;

/**
 * Signals that a row lacks its control or test image and therefore has no delta.
 * Non-fatal: reports leave the delta blank instead of raising this.
 */
public class IncompleteRowException extends RuntimeException {

    public IncompleteRowException(String label) {
        super("Row '" + label + "' is missing its control or test image");
    }
}
