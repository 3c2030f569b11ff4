package io.creditx.core.batch;

import java.io.Serial;

/// Thrown when a parallel batch cannot complete, either because the calling thread was
/// interrupted while waiting for record results or because a worker failed unexpectedly.
public class BatchExecutionException extends RuntimeException {
    @Serial private static final long serialVersionUID = -3380247216315587064L;

    public BatchExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
