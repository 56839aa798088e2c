package com.flowmable.labreport;

/**
 * Side of a bilateral dataset. Left and right are compared independently.
 */
public enum Side {
    LEFT("left"),
    RIGHT("right");

    private final String word;

    Side(String word) {
        this.word = word;
    }

    /** Lower-case name used in column headers and descriptions. */
    public String word() {
        return word;
    }
}
