package com.ryuqq.finfind.core.retrieval;

import com.ryuqq.finfind.core.exception.ValidationException;
import com.ryuqq.finfind.core.spi.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 벡터 검색 엔진.
 *
 * <p>에이전트가 사용하는 네 가지 읽기 전용 연산을 제공합니다:</p>
 * <ul>
 *   <li>{@link #semanticSearch}: 코사인 유사도 상위 limit건</li>
 *   <li>{@link #mmrSearch}: MMR(Maximal Marginal Relevance) 다양성 재정렬</li>
 *   <li>{@link #recommend}: 긍정/부정 예시 기반 추천</li>
 *   <li>필터 컴파일은 {@link FilterCompiler}가 담당</li>
 * </ul>
 *
 * <p><strong>점수:</strong> 결과 점수는 코사인 유사도를 [0, 1]로 자른 값입니다.
 * scoreThreshold가 있으면 그 미만의 결과는 limit보다 적어지더라도 제외됩니다.</p>
 *
 * <p><strong>MMR 알고리즘:</strong></p>
 * <pre>
 * λ = 1 − diversity
 * pool = semantic(max(limit × oversampleFactor, prefetchLimit))
 * 매 단계: argmax_d [ λ·sim(d, q) − (1−λ)·max_{s∈S} sim(d, s) ]
 * </pre>
 * <p>diversity = 0이면 의미 검색 순서와 동일하며, 동점은 먼저 나온 후보가 선택됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RetrievalEngine {

    private static final Logger log = LoggerFactory.getLogger(RetrievalEngine.class);

    private final VectorStore store;
    private final RetrievalConfig config;

    /**
     * 기본 설정으로 생성.
     *
     * @param store 벡터 저장소
     */
    public RetrievalEngine(VectorStore store) {
        this(store, new RetrievalConfig());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param store 벡터 저장소
     * @param config 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RetrievalEngine(VectorStore store, RetrievalConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.config = config;
    }

    /**
     * 의미 검색.
     *
     * @param query 질의 (vector 필수)
     * @return 점수 내림차순 결과 (최대 limit건)
     * @throws ValidationException vector가 없는 경우
     */
    public List<RetrievalResult> semanticSearch(RetrievalQuery query) {
        requireVector(query);
        List<ScoredPoint> points = store.query(query.collection(), query.vector(), query.limit(), query.filter());
        List<RetrievalResult> results = new ArrayList<>();
        for (ScoredPoint point : points) {
            double score = clamp(point.similarity());
            if (passes(score, query.scoreThreshold())) {
                results.add(new RetrievalResult(point.id(), score, point.point().payload()));
            }
            if (results.size() == query.limit()) {
                break;
            }
        }
        return results;
    }

    /**
     * MMR 다양성 검색.
     *
     * <p>결과 순서는 선택 순서이며, 각 결과의 score는 질의와의 관련도입니다.</p>
     *
     * @param query 질의 (vector 필수, diversity 없으면 설정 기본값)
     * @return 선택 순서대로 정렬된 결과 (최대 limit건)
     * @throws ValidationException vector가 없는 경우
     */
    public List<RetrievalResult> mmrSearch(RetrievalQuery query) {
        requireVector(query);
        double diversity = query.diversity() == null ? config.defaultDiversity() : query.diversity();
        double lambda = 1.0 - diversity;
        int poolSize = Math.max(query.limit() * config.oversampleFactor(), config.prefetchLimit());

        List<Candidate> remaining = new ArrayList<>();
        for (ScoredPoint point : store.query(query.collection(), query.vector(), poolSize, query.filter())) {
            double relevance = clamp(point.similarity());
            if (passes(relevance, query.scoreThreshold())) {
                remaining.add(new Candidate(point.point(), relevance));
            }
        }

        List<Candidate> selected = new ArrayList<>();
        while (selected.size() < query.limit() && !remaining.isEmpty()) {
            Candidate best = null;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (Candidate candidate : remaining) {
                double maxSimilarity = 0.0;
                for (Candidate chosen : selected) {
                    maxSimilarity = Math.max(maxSimilarity, clamp(candidate.point.vector().cosine(chosen.point.vector())));
                }
                double mmr = lambda * candidate.relevance - (1.0 - lambda) * maxSimilarity;
                if (mmr > bestScore) {
                    bestScore = mmr;
                    best = candidate;
                }
            }
            selected.add(best);
            remaining.remove(best);
        }

        log.debug("MMR selected {} of {} candidates (diversity: {})", selected.size(), selected.size() + remaining.size(), diversity);
        List<RetrievalResult> results = new ArrayList<>(selected.size());
        for (Candidate candidate : selected) {
            results.add(new RetrievalResult(candidate.point.id(), candidate.relevance, candidate.point.payload()));
        }
        return results;
    }

    /**
     * 예시 기반 추천.
     *
     * <p>긍정 예시 벡터의 centroid에서 부정 예시 centroid × negativeWeight를 뺀 벡터로 검색합니다.
     * 부정 예시는 앞에서부터 maxNegativeExamples개만 사용하며, 예시 자체는 결과에서 제외됩니다.
     * 컬렉션에 없는 ID는 {@link Recommendation#rejectedIds()}로 보고됩니다.</p>
     *
     * @param query 질의 (positiveIds 필수)
     * @return 추천 결과와 거부된 ID
     * @throws ValidationException positiveIds가 비어 있는 경우
     */
    public Recommendation recommend(RetrievalQuery query) {
        if (query.positiveIds().isEmpty()) {
            throw new ValidationException("recommend requires at least one positive id");
        }

        List<String> rejected = new ArrayList<>();
        List<Embedding> positives = vectorsOf(query.collection(), query.positiveIds(), rejected);
        List<String> negativeIds = query.negativeIds().subList(0, Math.min(query.negativeIds().size(), config.maxNegativeExamples()));
        List<Embedding> negatives = vectorsOf(query.collection(), negativeIds, rejected);

        if (!rejected.isEmpty()) {
            log.warn("Ignoring unknown example ids in {}: {}", query.collection(), rejected);
        }
        if (positives.isEmpty()) {
            return new Recommendation(List.of(), rejected);
        }

        Embedding target = Embedding.centroid(positives);
        if (!negatives.isEmpty()) {
            target = target.minus(Embedding.centroid(negatives), config.negativeWeight());
        }

        Set<String> examples = new LinkedHashSet<>(query.positiveIds());
        examples.addAll(query.negativeIds());
        RetrievalQuery search = new RetrievalQuery(query.collection(), target, query.limit(), query.scoreThreshold(),
            query.filter().excludingIds(examples), null, null, null);
        return new Recommendation(semanticSearch(search), rejected);
    }

    public RetrievalConfig getConfig() {
        return config;
    }

    private List<Embedding> vectorsOf(String collection, List<String> ids, List<String> rejected) {
        if (ids.isEmpty()) {
            return List.of();
        }
        List<Point> found = store.retrieve(collection, ids);
        Set<String> foundIds = new HashSet<>();
        List<Embedding> vectors = new ArrayList<>();
        for (Point point : found) {
            foundIds.add(point.id());
            vectors.add(point.vector());
        }
        for (String id : ids) {
            if (!foundIds.contains(id) && !rejected.contains(id)) {
                rejected.add(id);
            }
        }
        return vectors;
    }

    private static void requireVector(RetrievalQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (query.vector() == null) {
            throw new ValidationException("query vector is required for " + query.collection());
        }
    }

    private static boolean passes(double score, Double threshold) {
        return threshold == null || score >= threshold;
    }

    private static double clamp(double similarity) {
        return Math.max(0.0, Math.min(1.0, similarity));
    }

    private static final class Candidate {
        private final Point point;
        private final double relevance;

        Candidate(Point point, double relevance) {
            this.point = point;
            this.relevance = relevance;
        }
    }
}
