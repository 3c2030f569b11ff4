package io.creditx.core.feature;

import io.creditx.core.record.RecordKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/// Immutable, typed set of features extracted from one record.
///
/// Values are stored per {@link Feature} with the Java type matching its {@link FeatureType}:
/// `Double` for numeric, `Boolean` for flag and `String` for category features.
///
/// ### Contracts
/// - **Precondition**: rules only read features validated against the record kind at reload
/// - **Invariant**: every stored value matches its feature type
///
/// @implNote Immutable and thread-safe after construction.
public final class FeatureSet {

    private final RecordKind kind;
    private final Map<Feature, Object> values;

    private FeatureSet(Builder builder) {
        this.kind = builder.kind;
        this.values = Collections.unmodifiableMap(new EnumMap<>(builder.values));
    }

    /// Returns the kind of record these features were extracted from.
    ///
    /// @return record kind, never null
    public RecordKind kind() {
        return kind;
    }

    /// Checks whether a feature was extracted.
    ///
    /// @param feature feature to look up, not null
    /// @return true if present
    public boolean contains(Feature feature) {
        return values.containsKey(feature);
    }

    /// Returns a numeric feature value.
    ///
    /// @param feature numeric feature, not null
    /// @return the value
    /// @throws IllegalStateException if absent or not numeric
    public double number(Feature feature) {
        return (Double) require(feature, FeatureType.NUMERIC);
    }

    /// Returns a flag feature value.
    ///
    /// @param feature flag feature, not null
    /// @return the value
    /// @throws IllegalStateException if absent or not a flag
    public boolean flag(Feature feature) {
        return (Boolean) require(feature, FeatureType.FLAG);
    }

    /// Returns a category feature value.
    ///
    /// @param feature category feature, not null
    /// @return the value, never null
    /// @throws IllegalStateException if absent or not a category
    public String category(Feature feature) {
        return (String) require(feature, FeatureType.CATEGORY);
    }

    /// Returns the raw value of a feature regardless of type.
    ///
    /// @param feature feature to look up, not null
    /// @return stored value, or null if absent
    public Object value(Feature feature) {
        return values.get(feature);
    }

    /// Returns all extracted values.
    ///
    /// @return unmodifiable view keyed by feature, never null
    public Map<Feature, Object> asMap() {
        return values;
    }

    private Object require(Feature feature, FeatureType expected) {
        if (feature.type() != expected) {
            throw new IllegalStateException(
                    "Feature " + feature.key() + " is " + feature.type() + ", not " + expected);
        }
        Object value = values.get(feature);
        if (value == null) {
            throw new IllegalStateException(
                    "Feature " + feature.key() + " not extracted for " + kind + " records");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureSet other)) return false;
        return kind == other.kind && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, values);
    }

    @Override
    public String toString() {
        return "FeatureSet{" + kind + ", " + values + "}";
    }

    /// Creates a builder for features of the given record kind.
    ///
    /// @param kind record kind the features describe, not null
    /// @return new builder, never null
    public static Builder builder(RecordKind kind) {
        return new Builder(kind);
    }

    /// Builder that checks each value against its feature type and record kind.
    public static final class Builder {
        private final RecordKind kind;
        private final Map<Feature, Object> values = new EnumMap<>(Feature.class);

        private Builder(RecordKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
        }

        public Builder number(Feature feature, double value) {
            return put(feature, FeatureType.NUMERIC, value);
        }

        public Builder flag(Feature feature, boolean value) {
            return put(feature, FeatureType.FLAG, value);
        }

        public Builder category(Feature feature, String value) {
            return put(feature, FeatureType.CATEGORY, Objects.requireNonNull(value, "value"));
        }

        public Builder category(Feature feature, Enum<?> value) {
            return category(feature, Feature.categoryValue(value));
        }

        private Builder put(Feature feature, FeatureType expected, Object value) {
            if (feature.type() != expected) {
                throw new IllegalArgumentException(
                        "Feature " + feature.key() + " expects " + feature.type());
            }
            if (!feature.appliesTo(kind)) {
                throw new IllegalArgumentException(
                        "Feature " + feature.key() + " does not apply to " + kind);
            }
            values.put(feature, value);
            return this;
        }

        public FeatureSet build() {
            return new FeatureSet(this);
        }
    }
}
