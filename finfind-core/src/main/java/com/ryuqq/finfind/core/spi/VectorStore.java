package com.ryuqq.finfind.core.spi;

import com.ryuqq.finfind.core.retrieval.Embedding;
import com.ryuqq.finfind.core.retrieval.PayloadFilter;
import com.ryuqq.finfind.core.retrieval.Point;
import com.ryuqq.finfind.core.retrieval.ScoredPoint;

import java.util.Collection;
import java.util.List;

/**
 * Vector store SPI used by the retrieval engine.
 *
 * <p>All operations are collection scoped and accept a compiled {@link PayloadFilter}.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently by several agents</li>
 *   <li>{@code query} returns points in descending similarity, ties broken by ascending id</li>
 *   <li>Transport failures are reported as
 *       {@link com.ryuqq.finfind.core.exception.UpstreamFailureException}</li>
 *   <li>Vector dimension mismatches are reported as
 *       {@link com.ryuqq.finfind.core.exception.ValidationException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface VectorStore {

    /**
     * Returns the points most similar to {@code vector} that pass {@code filter}.
     *
     * @param collection collection name
     * @param vector query vector
     * @param limit maximum number of points
     * @param filter payload filter
     * @return scored points, most similar first
     */
    List<ScoredPoint> query(String collection, Embedding vector, int limit, PayloadFilter filter);

    /**
     * Fetches points by id. Unknown ids are silently absent from the result.
     *
     * @param collection collection name
     * @param ids point ids
     * @return found points in the order of {@code ids}
     */
    List<Point> retrieve(String collection, Collection<String> ids);

    /**
     * Lists points that pass {@code filter}, ordered by id.
     *
     * @param collection collection name
     * @param filter payload filter
     * @param limit maximum number of points
     * @return matching points
     */
    List<Point> scroll(String collection, PayloadFilter filter, int limit);

    /**
     * Inserts or replaces points.
     *
     * @param collection collection name
     * @param points points to write
     */
    void upsert(String collection, List<Point> points);
}
