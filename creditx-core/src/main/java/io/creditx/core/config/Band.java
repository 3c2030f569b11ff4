package io.creditx.core.config;

import java.util.Objects;

/// Risk band covering the half-open rate interval `[lowerBpsInclusive, upperBpsExclusive)`.
///
/// @param code short band code such as `"B"`, not null
/// @param label human-readable range label, not null
/// @param description band description for display, not null
/// @param lowerBpsInclusive lower bound in basis points, inclusive
/// @param upperBpsExclusive upper bound in basis points, exclusive
public record Band(
        String code,
        String label,
        String description,
        int lowerBpsInclusive,
        int upperBpsExclusive) {

    public Band {
        Objects.requireNonNull(code, "code must not be null");
        label = label != null ? label : code;
        description = description != null ? description : "";
    }

    /// Checks whether a rate falls inside this band's interval.
    ///
    /// @param rateBps rate in basis points
    /// @return true if `lower <= rate < upper`
    public boolean contains(int rateBps) {
        return rateBps >= lowerBpsInclusive && rateBps < upperBpsExclusive;
    }
}
