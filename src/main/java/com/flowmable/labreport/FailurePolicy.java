package com.flowmable.labreport;

/**
 * What a simple-mode report does when one of its images cannot be analyzed.
 */
public enum FailurePolicy {
    /** Propagate the first failure; nothing is written. */
    ABORT,
    /** Log the failure and report that side as absent. */
    SKIP
}
