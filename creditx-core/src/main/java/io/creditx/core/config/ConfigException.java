package io.creditx.core.config;

import java.io.Serial;
import java.util.List;

/// Thrown when a weights configuration is malformed or logically invalid.
///
/// Raised only while loading or reloading configuration; a failed reload never changes the
/// active snapshot. Carries every problem found so a config author can fix them in one pass.
public class ConfigException extends Exception {
    @Serial private static final long serialVersionUID = 4127716905286035519L;

    private final List<String> problems;

    public ConfigException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public ConfigException(List<String> problems) {
        super("Invalid weights configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    /// Returns the individual problems found.
    ///
    /// @return unmodifiable list, never empty
    public List<String> getProblems() {
        return problems;
    }
}
