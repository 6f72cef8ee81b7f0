package com.ryuqq.finfind.testkit.contract;

import com.ryuqq.finfind.core.exception.LlmException;
import com.ryuqq.finfind.core.spi.LlmClient;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Scripted LLM for contract tests.
 *
 * <p>Completions are answered from a queue in call order. Once the script runs out, every call
 * fails with {@link LlmException.Reason#INVALID_RESPONSE}, which drives agents onto their
 * non-LLM fallbacks.</p>
 *
 * <pre>
 * FakeLlmClient llm = new FakeLlmClient()
 *     .thenCallTool("select_workflow", Map.of("workflow_id", "full_pipeline"))
 *     .thenReply("Lightweight and within budget.")
 *     .thenFail(LlmException.Reason.RATE_LIMITED);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FakeLlmClient implements LlmClient {

    private final ConcurrentLinkedQueue<Supplier<Completion>> script = new ConcurrentLinkedQueue<>();
    private final List<String> prompts = new CopyOnWriteArrayList<>();

    /**
     * Queues a plain text answer.
     *
     * @param text answer text
     * @return this client
     */
    public FakeLlmClient thenReply(String text) {
        Completion completion = new Completion.Text(text);
        script.add(() -> completion);
        return this;
    }

    /**
     * Queues a tool call.
     *
     * @param toolName tool name
     * @param arguments tool arguments
     * @return this client
     */
    public FakeLlmClient thenCallTool(String toolName, Map<String, Object> arguments) {
        Completion completion = new Completion.ToolCall(toolName, arguments);
        script.add(() -> completion);
        return this;
    }

    /**
     * Queues a failure.
     *
     * @param reason failure reason
     * @return this client
     */
    public FakeLlmClient thenFail(LlmException.Reason reason) {
        script.add(() -> {
            throw new LlmException(reason, "Scripted failure: " + reason);
        });
        return this;
    }

    @Override
    public Completion complete(String prompt, List<ToolSpec> tools) {
        prompts.add(prompt);
        Supplier<Completion> next = script.poll();
        if (next == null) {
            throw new LlmException(LlmException.Reason.INVALID_RESPONSE, "No scripted completion left");
        }
        return next.get();
    }

    /**
     * Prompts received so far, in call order.
     *
     * @return prompts
     */
    public List<String> prompts() {
        return List.copyOf(prompts);
    }

    /**
     * Number of scripted completions not yet consumed.
     *
     * @return remaining count
     */
    public int remaining() {
        return script.size();
    }
}
