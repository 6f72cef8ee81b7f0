package com.ryuqq.finfind.adapter.agent;

import com.ryuqq.finfind.core.capability.Agent;
import com.ryuqq.finfind.core.retrieval.FilterCompiler;
import com.ryuqq.finfind.core.retrieval.RetrievalEngine;
import com.ryuqq.finfind.core.spi.EmbeddingClient;
import com.ryuqq.finfind.core.spi.LlmClient;
import com.ryuqq.finfind.core.spi.VectorStore;
import com.ryuqq.finfind.core.workflow.WorkflowRegistry;

import java.util.List;

/**
 * Reference Agent 조립 유틸리티.
 *
 * <p>하나의 VectorStore / EmbeddingClient / LlmClient 위에 5개 Capability를 모두 제공하는
 * Agent 세트를 생성합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ReferenceAgents {

    private ReferenceAgents() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전체 Reference Agent 생성.
     *
     * @param store 상품/프로필 벡터 저장소
     * @param embeddings 임베딩 클라이언트
     * @param llm LLM 클라이언트
     * @param registry 분류 대상 Workflow 레지스트리
     * @param config Agent 설정
     * @return intent, search, recommendation, alternative, explainability 순서의 Agent 목록
     */
    public static List<Agent> create(
        VectorStore store,
        EmbeddingClient embeddings,
        LlmClient llm,
        WorkflowRegistry registry,
        AgentConfig config
    ) {
        RetrievalEngine engine = new RetrievalEngine(store);
        return List.of(
            new IntentAgent(llm, registry),
            new SearchAgent(engine, embeddings, FilterCompiler.forProducts(), config),
            new RecommendationAgent(engine, embeddings, store, config),
            new AlternativeAgent(engine, embeddings, config),
            new ExplainabilityAgent(llm, config)
        );
    }
}
