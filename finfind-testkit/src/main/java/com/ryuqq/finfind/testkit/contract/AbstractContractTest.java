package com.ryuqq.finfind.testkit.contract;

import com.ryuqq.finfind.adapter.agent.AgentConfig;
import com.ryuqq.finfind.adapter.agent.ReferenceAgents;
import com.ryuqq.finfind.adapter.inmemory.bus.InMemoryMessageBus;
import com.ryuqq.finfind.adapter.inmemory.store.InMemoryConversationStore;
import com.ryuqq.finfind.adapter.inmemory.store.InMemoryExecutionStore;
import com.ryuqq.finfind.adapter.inmemory.vector.InMemoryVectorStore;
import com.ryuqq.finfind.adapter.runner.DiscoveryOrchestrator;
import com.ryuqq.finfind.adapter.runner.LayeredWorkflowRunner;
import com.ryuqq.finfind.adapter.runner.WorkflowRunnerConfig;
import com.ryuqq.finfind.application.runtime.CapabilityEndpoints;
import com.ryuqq.finfind.core.capability.Agent;
import com.ryuqq.finfind.core.capability.StepRequest;
import com.ryuqq.finfind.core.outcome.ErrorDetail;
import com.ryuqq.finfind.core.outcome.ErrorKind;
import com.ryuqq.finfind.core.protocol.A2AProtocol;
import com.ryuqq.finfind.core.protocol.Capability;
import com.ryuqq.finfind.core.retrieval.Embedding;
import com.ryuqq.finfind.core.retrieval.Point;
import com.ryuqq.finfind.core.workflow.WorkflowDefinition;
import com.ryuqq.finfind.core.workflow.WorkflowRegistry;
import com.ryuqq.finfind.core.workflow.WorkflowResult;
import com.ryuqq.finfind.core.workflow.WorkflowStep;
import com.ryuqq.finfind.core.workflow.WorkflowType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>This class wires the in-memory adapters, the layered runner and a small product catalog so
 * that contract tests exercise the same paths a deployment does, only without network I/O.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>A2AProtocol + InMemoryMessageBus: agent registry and request/response transport</li>
 *   <li>InMemoryExecutionStore: live executions and history</li>
 *   <li>InMemoryConversationStore: turns carried between requests of one conversation</li>
 *   <li>InMemoryVectorStore: {@value #PRODUCTS} and {@value #USER_PROFILES} collections</li>
 *   <li>FakeEmbeddingClient / FakeLlmClient: deterministic model stand-ins</li>
 * </ul>
 *
 * <p><strong>Catalog</strong> (axis x = shoes, y = hats, z = camping):</p>
 * <pre>
 * shoe-1  Trail Runner   120  (1, 0, 0)
 * shoe-2  Road Runner     90  (.95, .05, 0)
 * shoe-3  Budget Jogger   60  (.9, .1, 0)
 * hat-1   Sun Hat         20  (0, 1, 0)
 * tent-1  Dome Tent      300  (0, 0, 1)
 * tent-2  Trail Tent      90  (.1, 0, .95)
 * stove-1 Camp Stove      45  (0, .3, .9)
 * </pre>
 * <p>{@value #USER_ID} has a profile budget of 100.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * public class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         exposeReferenceAgents();
 *         DiscoveryOrchestrator orchestrator = newOrchestrator();
 *
 *         DiscoveryResponse response = orchestrator.processRequest(DiscoveryRequest.of("show me shoes", USER_ID));
 *         // ... assertions ...
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final String PRODUCTS = "products";
    protected static final String USER_PROFILES = "user_profiles";
    protected static final String USER_ID = "user-1";
    protected static final int DIMENSION = 3;

    protected A2AProtocol protocol;
    protected InMemoryMessageBus bus;
    protected InMemoryExecutionStore executionStore;
    protected InMemoryConversationStore conversationStore;
    protected InMemoryVectorStore vectorStore;
    protected LayeredWorkflowRunner runner;
    protected WorkflowRegistry registry;
    protected FakeEmbeddingClient embeddings;
    protected FakeLlmClient llm;

    private final List<AutoCloseable> closeables = new ArrayList<>();

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates fresh instances of every adapter and seeds the catalog. No agent is exposed yet.</p>
     */
    @BeforeEach
    void setUp() {
        protocol = new A2AProtocol();
        bus = new InMemoryMessageBus(protocol);
        executionStore = new InMemoryExecutionStore();
        conversationStore = new InMemoryConversationStore();
        vectorStore = new InMemoryVectorStore();
        runner = new LayeredWorkflowRunner(bus, protocol, executionStore,
            new WorkflowRunnerConfig().withDefaultStepTimeout(Duration.ofSeconds(5)));
        registry = WorkflowRegistry.withPredefined();
        embeddings = new FakeEmbeddingClient(DIMENSION, Map.of(
            "shoe", 0, "run", 0,
            "hat", 1,
            "tent", 2, "camp", 2
        ));
        llm = new FakeLlmClient();
        seedCatalog();
    }

    /**
     * Cleans up test fixtures after each test.
     *
     * <p>Closes orchestrators, the runner, the bus and the protocol in reverse creation order.</p>
     */
    @AfterEach
    void tearDown() throws Exception {
        for (int i = closeables.size() - 1; i >= 0; i--) {
            closeables.get(i).close();
        }
        closeables.clear();
        if (runner != null) {
            runner.close();
        }
        if (bus != null) {
            bus.close();
        }
        if (protocol != null) {
            protocol.close();
        }
    }

    /**
     * Exposes agents on the bus and registers their cards.
     *
     * @param agents agents to expose
     */
    protected void expose(Agent... agents) {
        for (Agent agent : agents) {
            CapabilityEndpoints.expose(agent, bus, protocol);
        }
    }

    /**
     * Exposes the five reference agents over the catalog, the fake embeddings and the fake LLM.
     *
     * @return exposed agents (intent, search, recommendation, alternative, explainability)
     */
    protected List<Agent> exposeReferenceAgents() {
        List<Agent> agents = ReferenceAgents.create(vectorStore, embeddings, llm, registry, new AgentConfig());
        for (Agent agent : agents) {
            CapabilityEndpoints.expose(agent, bus, protocol);
        }
        return agents;
    }

    /**
     * Creates an orchestrator over the shared runner. Closed automatically after the test.
     *
     * <p>Expose the agents first: construction fails if a workflow capability has no provider.</p>
     *
     * @return orchestrator
     */
    protected DiscoveryOrchestrator newOrchestrator() {
        DiscoveryOrchestrator orchestrator = new DiscoveryOrchestrator(runner, bus, protocol, registry, conversationStore);
        closeables.add(orchestrator);
        return orchestrator;
    }

    /**
     * Creates a custom workflow definition.
     *
     * @param id workflow id
     * @param steps steps in dependency order
     * @return workflow definition
     */
    protected WorkflowDefinition customWorkflow(String id, WorkflowStep... steps) {
        return new WorkflowDefinition(id, WorkflowType.CUSTOM, id, "Contract test workflow " + id, List.of(steps));
    }

    /**
     * Creates the original request of a workflow run.
     *
     * @param capability capability of the first step
     * @param query user query
     * @param budgetMax budget (nullable)
     * @return step request
     */
    protected StepRequest stepRequest(Capability capability, String query, Double budgetMax) {
        return new StepRequest(capability, query, USER_ID, budgetMax, Map.of(), List.of(), null);
    }

    /**
     * Asserts that a step failed with the expected error kind.
     *
     * @param result workflow result
     * @param step step name
     * @param expectedKind expected error kind
     */
    protected void assertStepFailed(WorkflowResult result, String step, ErrorKind expectedKind) {
        assertTrue(result.failedSteps().contains(step),
            String.format("Expected step %s to fail but failed steps were %s", step, result.failedSteps()));
        ErrorDetail error = result.stepErrors().get(step);
        assertNotNull(error, "No error recorded for failed step " + step);
        assertEquals(expectedKind, error.kind(),
            String.format("Expected error kind %s but was %s for step: %s", expectedKind, error.kind(), step));
    }

    /**
     * Asserts that exactly the given steps were skipped, in definition order.
     *
     * @param result workflow result
     * @param steps expected skipped steps
     */
    protected void assertStepsSkipped(WorkflowResult result, String... steps) {
        assertEquals(List.of(steps), result.skippedSteps(),
            String.format("Unexpected skipped steps for workflow: %s", result.workflowId()));
    }

    /**
     * Asserts that nothing is left running once an execution has returned.
     */
    protected void assertNoLiveExecutions() {
        assertTrue(executionStore.active().isEmpty(),
            "Expected no live executions but found " + executionStore.active());
        assertEquals(0, protocol.pendingCount(), "Expected no pending requests");
    }

    private void seedCatalog() {
        vectorStore.createCollection(PRODUCTS, DIMENSION);
        vectorStore.upsert(PRODUCTS, List.of(
            product("shoe-1", "Trail Runner", "running", 120, 4.5, 1.0f, 0.0f, 0.0f),
            product("shoe-2", "Road Runner", "running", 90, 4.0, 0.95f, 0.05f, 0.0f),
            product("shoe-3", "Budget Jogger", "running", 60, 3.5, 0.9f, 0.1f, 0.0f),
            product("hat-1", "Sun Hat", "hats", 20, 4.8, 0.0f, 1.0f, 0.0f),
            product("tent-1", "Dome Tent", "camping", 300, 4.2, 0.0f, 0.0f, 1.0f),
            product("tent-2", "Trail Tent", "camping", 90, 3.9, 0.1f, 0.0f, 0.95f),
            product("stove-1", "Camp Stove", "camping", 45, 4.1, 0.0f, 0.3f, 0.9f)
        ));

        vectorStore.createCollection(USER_PROFILES, DIMENSION);
        vectorStore.upsert(USER_PROFILES, List.of(
            new Point(USER_ID, Embedding.of(1.0f, 0.0f, 0.0f), Map.of("budget_max", 100.0))
        ));
    }

    private static Point product(String id, String name, String category, double price, double rating,
                                 float x, float y, float z) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", name);
        payload.put("category", category);
        payload.put("price", price);
        payload.put("rating_avg", rating);
        return new Point(id, Embedding.of(x, y, z), payload);
    }
}
