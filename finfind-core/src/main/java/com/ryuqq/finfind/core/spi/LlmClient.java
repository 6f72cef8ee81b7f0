package com.ryuqq.finfind.core.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Large-language-model completion SPI.
 *
 * <p>Implementations report failures as
 * {@link com.ryuqq.finfind.core.exception.LlmException} with reason
 * {@code RATE_LIMITED}, {@code TIMEOUT} or {@code INVALID_RESPONSE}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface LlmClient {

    /**
     * Completes a prompt, optionally letting the model call one of {@code tools}.
     *
     * @param prompt prompt text
     * @param tools tools the model may call (empty for plain completion)
     * @return text or tool call
     */
    Completion complete(String prompt, List<ToolSpec> tools);

    /**
     * Model output: plain text or a tool call.
     */
    sealed interface Completion permits Completion.Text, Completion.ToolCall {

        /**
         * Plain text answer.
         *
         * @param text answer text
         */
        record Text(String text) implements Completion {
            public Text {
                if (text == null) {
                    throw new IllegalArgumentException("text cannot be null");
                }
            }
        }

        /**
         * Request to invoke a tool.
         *
         * @param toolName tool name
         * @param arguments tool arguments
         */
        record ToolCall(String toolName, Map<String, Object> arguments) implements Completion {
            public ToolCall {
                if (toolName == null || toolName.isBlank()) {
                    throw new IllegalArgumentException("toolName cannot be null or blank");
                }
                arguments = arguments == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
            }
        }
    }

    /**
     * Tool the model may call.
     *
     * @param name tool name
     * @param description what the tool does
     * @param parameters parameter name to type description
     */
    record ToolSpec(String name, String description, Map<String, String> parameters) {
        public ToolSpec {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        }
    }
}
