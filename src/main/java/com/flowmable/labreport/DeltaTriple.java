package com.flowmable.labreport;

/**
 * Element-wise test − control difference of two {@link ChannelAverages}, already rounded.
 *
 * @param l ΔL*
 * @param a Δa*
 * @param b Δb*
 */
public record DeltaTriple(double l, double a, double b) {}
