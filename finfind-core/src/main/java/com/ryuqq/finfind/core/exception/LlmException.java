package com.ryuqq.finfind.core.exception;

import com.ryuqq.finfind.core.outcome.ErrorKind;

/**
 * Failure reported by an {@link com.ryuqq.finfind.core.spi.LlmClient}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LlmException extends DiscoveryException {

    /**
     * Why the completion failed.
     */
    public enum Reason {
        RATE_LIMITED,
        TIMEOUT,
        INVALID_RESPONSE
    }

    private final Reason reason;

    public LlmException(Reason reason, String message) {
        this(reason, message, null);
    }

    public LlmException(Reason reason, String message, Throwable cause) {
        super(kindOf(reason), message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    private static ErrorKind kindOf(Reason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        return reason == Reason.TIMEOUT ? ErrorKind.UPSTREAM_TIMEOUT : ErrorKind.UPSTREAM_FAILURE;
    }
}
