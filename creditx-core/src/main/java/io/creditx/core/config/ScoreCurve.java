package io.creditx.core.config;

import java.util.List;
import java.util.Objects;

/// Piecewise-linear curve defined by control points in ascending `x` order.
///
/// Below the first control point the curve is flat at the first value, above the last it is
/// flat at the last value, and between two bracketing points it interpolates linearly.
/// Used for the broker hit-rate quality score and by curve rules.
///
/// ### Contracts
/// - **Precondition**: at least one point, `x` strictly ascending and finite (checked by
///   {@link WeightsConfigValidator}, not here)
///
/// @param points control points, not null or empty
public record ScoreCurve(List<CurvePoint> points) {

    public ScoreCurve {
        Objects.requireNonNull(points, "points must not be null");
        if (points.isEmpty()) {
            throw new IllegalArgumentException("Score curve needs at least one control point");
        }
        points = List.copyOf(points);
    }

    /// Creates a curve from alternating `x, y` values.
    ///
    /// @param xy pairs of coordinates, even length
    /// @return new curve, never null
    public static ScoreCurve of(double... xy) {
        if (xy.length == 0 || xy.length % 2 != 0) {
            throw new IllegalArgumentException("Expected x,y pairs");
        }
        CurvePoint[] points = new CurvePoint[xy.length / 2];
        for (int i = 0; i < points.length; i++) {
            points[i] = new CurvePoint(xy[2 * i], xy[2 * i + 1]);
        }
        return new ScoreCurve(List.of(points));
    }

    /// Evaluates the curve at `x`.
    ///
    /// ### Performance
    /// - Time: O(n) in the number of control points
    ///
    /// @param x input value
    /// @return interpolated value
    public double valueAt(double x) {
        CurvePoint first = points.get(0);
        if (x <= first.x()) {
            return first.y();
        }
        CurvePoint last = points.get(points.size() - 1);
        if (x >= last.x()) {
            return last.y();
        }
        for (int i = 1; i < points.size(); i++) {
            CurvePoint hi = points.get(i);
            if (x <= hi.x()) {
                CurvePoint lo = points.get(i - 1);
                double t = (x - lo.x()) / (hi.x() - lo.x());
                return lo.y() + t * (hi.y() - lo.y());
            }
        }
        return last.y();
    }
}
