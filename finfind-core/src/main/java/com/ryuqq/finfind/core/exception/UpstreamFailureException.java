package com.ryuqq.finfind.core.exception;

import com.ryuqq.finfind.core.outcome.ErrorKind;

/**
 * An upstream collaborator (vector store, agent) failed.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UpstreamFailureException extends DiscoveryException {

    public UpstreamFailureException(String message) {
        super(ErrorKind.UPSTREAM_FAILURE, message);
    }

    public UpstreamFailureException(String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_FAILURE, message, cause);
    }
}
