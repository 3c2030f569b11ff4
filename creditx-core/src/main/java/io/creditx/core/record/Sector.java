package io.creditx.core.record;

import java.util.Locale;

/// Industry sectors recognised by the underwriting engine.
///
/// Every sector must carry a base rate in the active weights configuration, so the set is
/// closed: ingestion maps free-text sector names onto these constants via {@link #fromLabel}.
public enum Sector {
    RETAIL("Retail"),
    MANUFACTURING("Manufacturing"),
    LOGISTICS("Logistics"),
    AGRI("Agri"),
    SERVICES("Services"),
    OTHER("Other");

    private final String label;

    Sector(String label) {
        this.label = label;
    }

    /// Returns the display label used in configuration files and reason text.
    ///
    /// @return label such as `"Retail"`, never null
    public String label() {
        return label;
    }

    /// Resolves a sector from its display label or constant name, ignoring case.
    ///
    /// @param value label (`"Logistics"`) or constant name (`"LOGISTICS"`), not null
    /// @return matching sector, never null
    /// @throws IllegalArgumentException if no sector matches
    public static Sector fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Sector cannot be null");
        }
        String trimmed = value.trim();
        for (Sector sector : values()) {
            if (sector.label.equalsIgnoreCase(trimmed)
                    || sector.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return sector;
            }
        }
        throw new IllegalArgumentException("Unknown sector: " + value);
    }

    @Override
    public String toString() {
        return label;
    }
}
