package io.creditx.core.config;

import java.io.Serial;

/// Thrown when the engine is used before any weights configuration was loaded successfully.
public class NoActiveConfigException extends Exception {
    @Serial private static final long serialVersionUID = -2290863120391853106L;

    public NoActiveConfigException(String message) {
        super(message);
    }
}
