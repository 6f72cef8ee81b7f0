package com.ryuqq.finfind.core.exception;

import com.ryuqq.finfind.core.outcome.ErrorKind;

/**
 * An upstream collaborator did not answer in time.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UpstreamTimeoutException extends DiscoveryException {

    public UpstreamTimeoutException(String message) {
        super(ErrorKind.UPSTREAM_TIMEOUT, message);
    }

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_TIMEOUT, message, cause);
    }
}
