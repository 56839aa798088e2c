package com.flowmable.labreport;

/**
 * One line of the summary table: an image average or a post − pre difference.
 *
 * @param id          Sequential id, starting at 1, in generation order
 * @param description Role, side and (for deltas) the comparison made
 * @param avgL        L* average or ΔL*
 * @param avgA        a* average or Δa*
 * @param avgB        b* average or Δb*
 */
public record SummaryRow(int id, String description, double avgL, double avgA, double avgB) {}
