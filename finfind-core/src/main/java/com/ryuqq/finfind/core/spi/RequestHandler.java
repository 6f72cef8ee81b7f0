package com.ryuqq.finfind.core.spi;

import com.ryuqq.finfind.core.outcome.Result;
import com.ryuqq.finfind.core.protocol.Message;

import java.util.Map;

/**
 * Designated handler of REQUEST messages on one topic.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RequestHandler {

    /**
     * Handles a request.
     *
     * <p>A thrown {@link com.ryuqq.finfind.core.exception.DiscoveryException} is converted by the
     * bus into a failure of the same kind; any other exception becomes {@code UPSTREAM_FAILURE}.</p>
     *
     * @param request REQUEST message
     * @return response payload or failure
     */
    Result<Map<String, Object>> handle(Message request);
}
