package com.ryuqq.finfind.core.exception;

import com.ryuqq.finfind.core.outcome.ErrorKind;

/**
 * Invalid input: unknown filter field or operator, malformed payload, missing ids.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ValidationException extends DiscoveryException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
