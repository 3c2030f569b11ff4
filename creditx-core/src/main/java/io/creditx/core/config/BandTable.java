package io.creditx.core.config;

import java.util.List;
import java.util.Objects;

/// Ordered table of contiguous, non-overlapping risk bands.
///
/// Classification never fails: rates below the lowest band map to the lowest band and rates
/// at or above the highest band's upper bound map to the highest band, so the table covers
/// every integer rate.
///
/// ### Contracts
/// - **Precondition**: bands sorted by ascending lower bound, each non-empty, each band's upper
///   bound equal to the next band's lower bound (checked by {@link WeightsConfigValidator})
///
/// @implNote Immutable and thread-safe.
public final class BandTable {

    private final List<Band> bands;

    /// Creates a band table.
    ///
    /// @param bands bands in ascending order, not null or empty
    public BandTable(List<Band> bands) {
        Objects.requireNonNull(bands, "bands must not be null");
        if (bands.isEmpty()) {
            throw new IllegalArgumentException("Band table needs at least one band");
        }
        this.bands = List.copyOf(bands);
    }

    /// Returns the bands in ascending order.
    ///
    /// @return unmodifiable list, never empty
    public List<Band> bands() {
        return bands;
    }

    /// Finds the band for a rate, clamping out-of-range rates to the boundary bands.
    ///
    /// @param rateBps suggested rate in basis points
    /// @return the first band (by ascending lower bound) containing the rate, never null
    public Band classify(int rateBps) {
        Band lowest = bands.get(0);
        if (rateBps < lowest.lowerBpsInclusive()) {
            return lowest;
        }
        for (Band band : bands) {
            if (band.contains(rateBps)) {
                return band;
            }
        }
        return bands.get(bands.size() - 1);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BandTable other && bands.equals(other.bands);
    }

    @Override
    public int hashCode() {
        return bands.hashCode();
    }

    @Override
    public String toString() {
        return "BandTable" + bands;
    }
}
