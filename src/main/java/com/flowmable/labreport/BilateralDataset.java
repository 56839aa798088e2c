package com.flowmable.labreport;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Image paths of a pre/post report. {@code postLeft.get(i)} is compared only with
 * {@code preLeft}, {@code postRight.get(i)} only with {@code preRight}. List order is the
 * report order and the only link between left and right images.
 *
 * @param preLeft   Left pre-op image, required
 * @param preRight  Right pre-op image, or null
 * @param postLeft  Left post-op images, in order
 * @param postRight Right post-op images, in order
 */
public record BilateralDataset(Path preLeft, Path preRight, List<Path> postLeft, List<Path> postRight) {

    public BilateralDataset {
        Objects.requireNonNull(preLeft, "preLeft is required");
        postLeft = postLeft == null ? List.of() : List.copyOf(postLeft);
        postRight = postRight == null ? List.of() : List.copyOf(postRight);
    }

    public static BilateralDataset of(Path preLeft) {
        return new BilateralDataset(preLeft, null, List.of(), List.of());
    }

    public Path pre(Side side) {
        return side == Side.LEFT ? preLeft : preRight;
    }

    public List<Path> post(Side side) {
        return side == Side.LEFT ? postLeft : postRight;
    }
}
