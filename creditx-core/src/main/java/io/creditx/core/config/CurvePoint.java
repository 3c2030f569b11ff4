package io.creditx.core.config;

/// Control point of a {@link ScoreCurve}.
///
/// @param x input value
/// @param y curve value at `x`
public record CurvePoint(double x, double y) {}
