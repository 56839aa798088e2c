package com.flowmable.labreport;

import java.nio.file.Path;

/**
 * Input for one simple-mode row before analysis.
 *
 * @param label   User label, may be blank
 * @param control Control image, or null
 * @param test    Test image, or null
 */
public record RowSpec(String label, Path control, Path test) {

    public RowSpec {
        label = label == null ? "" : label;
    }
}
