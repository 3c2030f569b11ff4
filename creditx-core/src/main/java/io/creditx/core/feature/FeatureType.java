package io.creditx.core.feature;

/// Value type carried by a {@link Feature}. Rules are type-checked against it at reload time.
public enum FeatureType {
    NUMERIC, // double value
    FLAG, // boolean value
    CATEGORY // string value, optionally from a closed vocabulary
}
