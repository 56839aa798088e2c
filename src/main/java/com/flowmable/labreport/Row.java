package com.flowmable.labreport;

/**
 * One control/test comparison. Either side may be absent (null); such a row is still
 * reported but has no delta.
 *
 * @param label   User label, may be blank
 * @param control Control image averages, or null
 * @param test    Test image averages, or null
 */
public record Row(String label, ChannelAverages control, ChannelAverages test) {

    public Row {
        label = label == null ? "" : label;
    }

    public boolean isComplete() {
        return control != null && test != null;
    }
}
