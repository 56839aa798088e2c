package com.flowmable.labreport;

import java.util.List;
import java.util.Objects;

/**
 * Analyzed counterpart of {@link BilateralDataset}: the immutable snapshot handed to the
 * aggregator and the report writer.
 */
public record BilateralImages(
        AnalyzedImage preLeft,
        AnalyzedImage preRight,
        List<AnalyzedImage> postLeft,
        List<AnalyzedImage> postRight
) {
    public BilateralImages {
        Objects.requireNonNull(preLeft, "preLeft is required");
        postLeft = postLeft == null ? List.of() : List.copyOf(postLeft);
        postRight = postRight == null ? List.of() : List.copyOf(postRight);
    }

    public AnalyzedImage pre(Side side) {
        return side == Side.LEFT ? preLeft : preRight;
    }

    public List<AnalyzedImage> post(Side side) {
        return side == Side.LEFT ? postLeft : postRight;
    }
}
