package io.creditx.core.config;

/// Floor and ceiling applied to a suggested rate after all pricing adjustments.
///
/// @param minRateBps lowest rate that may be suggested
/// @param maxRateBps highest rate that may be suggested
public record PricingBounds(int minRateBps, int maxRateBps) {

    /// Clips a rate into `[minRateBps, maxRateBps]`.
    ///
    /// @param rateBps unclipped rate
    /// @return clipped rate
    public double clip(double rateBps) {
        return Math.max(minRateBps, Math.min(maxRateBps, rateBps));
    }
}
