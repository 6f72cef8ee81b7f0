package com.ryuqq.finfind.core.exception;

import com.ryuqq.finfind.core.outcome.ErrorKind;
import com.ryuqq.finfind.core.outcome.Fail;

/**
 * Base exception for failures raised at the edges of the system
 * (agents, vector store, LLM and embedding clients).
 *
 * <p>Exceptions never cross the bus or the workflow engine: adapters convert them
 * into {@link Fail} values with {@link #toFail()}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DiscoveryException extends RuntimeException {

    private final ErrorKind kind;

    public DiscoveryException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public DiscoveryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Converts this exception into a typed failure.
     *
     * @param <T> value type of the result
     * @return failure carrying this exception's kind and message
     */
    public <T> Fail<T> toFail() {
        String message = getMessage() == null ? getClass().getSimpleName() : getMessage();
        String cause = getCause() == null ? null : getCause().toString();
        return Fail.of(kind, message, cause);
    }
}
