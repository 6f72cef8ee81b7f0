package com.ryuqq.finfind.adapter.inmemory.vector;

import com.ryuqq.finfind.core.exception.UpstreamFailureException;
import com.ryuqq.finfind.core.exception.ValidationException;
import com.ryuqq.finfind.core.retrieval.Embedding;
import com.ryuqq.finfind.core.retrieval.PayloadFilter;
import com.ryuqq.finfind.core.retrieval.Point;
import com.ryuqq.finfind.core.retrieval.ScoredPoint;
import com.ryuqq.finfind.core.spi.VectorStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of {@link VectorStore} SPI for testing and reference purposes.
 *
 * <p>Every query is an exact linear scan with cosine similarity, so results are deterministic:
 * descending similarity, ties broken by ascending point id.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>collections:</strong> ConcurrentHashMap&lt;String, Collection&gt; - collection name to points</li>
 *   <li><strong>points:</strong> ConcurrentSkipListMap&lt;String, Point&gt; - id-ordered for {@code scroll}</li>
 * </ul>
 *
 * <p><strong>Error Mapping:</strong></p>
 * <ul>
 *   <li>Unknown collection → {@link UpstreamFailureException}</li>
 *   <li>Vector dimension differs from the collection's → {@link ValidationException}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>O(N) per query, no index</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryVectorStore implements VectorStore {

    private final ConcurrentHashMap<String, VectorCollection> collections = new ConcurrentHashMap<>();

    /**
     * Creates an empty collection with a fixed vector dimension.
     *
     * @param name collection name
     * @param dimension vector dimension
     * @throws IllegalArgumentException if the collection already exists or dimension is not positive
     */
    public void createCollection(String name, int dimension) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive (current: " + dimension + ")");
        }
        if (collections.putIfAbsent(name, new VectorCollection(dimension)) != null) {
            throw new IllegalArgumentException("Collection already exists: " + name);
        }
    }

    @Override
    public List<ScoredPoint> query(String collection, Embedding vector, int limit, PayloadFilter filter) {
        VectorCollection target = collectionOf(collection);
        target.checkDimension(vector);
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        PayloadFilter effective = filter == null ? PayloadFilter.empty() : filter;

        List<ScoredPoint> scored = new ArrayList<>();
        for (Point point : target.points.values()) {
            if (effective.test(point.id(), point.payload())) {
                scored.add(new ScoredPoint(point, vector.cosine(point.vector())));
            }
        }
        scored.sort(Comparator.comparingDouble(ScoredPoint::similarity).reversed()
            .thenComparing(ScoredPoint::id));
        return List.copyOf(scored.subList(0, Math.min(limit, scored.size())));
    }

    @Override
    public List<Point> retrieve(String collection, Collection<String> ids) {
        VectorCollection target = collectionOf(collection);
        List<Point> found = new ArrayList<>();
        for (String id : ids) {
            Point point = target.points.get(id);
            if (point != null) {
                found.add(point);
            }
        }
        return found;
    }

    @Override
    public List<Point> scroll(String collection, PayloadFilter filter, int limit) {
        VectorCollection target = collectionOf(collection);
        PayloadFilter effective = filter == null ? PayloadFilter.empty() : filter;
        List<Point> matched = new ArrayList<>();
        for (Point point : target.points.values()) {
            if (matched.size() == limit) {
                break;
            }
            if (effective.test(point.id(), point.payload())) {
                matched.add(point);
            }
        }
        return matched;
    }

    @Override
    public void upsert(String collection, List<Point> points) {
        VectorCollection target = collectionOf(collection);
        for (Point point : points) {
            target.checkDimension(point.vector());
        }
        for (Point point : points) {
            target.points.put(point.id(), point);
        }
    }

    /**
     * Number of points in a collection.
     *
     * @param collection collection name
     * @return point count
     */
    public int size(String collection) {
        return collectionOf(collection).points.size();
    }

    private VectorCollection collectionOf(String name) {
        VectorCollection collection = collections.get(name);
        if (collection == null) {
            throw new UpstreamFailureException("Collection not found: " + name);
        }
        return collection;
    }

    private static final class VectorCollection {
        private final int dimension;
        private final ConcurrentSkipListMap<String, Point> points = new ConcurrentSkipListMap<>();

        VectorCollection(int dimension) {
            this.dimension = dimension;
        }

        void checkDimension(Embedding vector) {
            if (vector == null) {
                throw new ValidationException("vector cannot be null");
            }
            if (vector.dimension() != dimension) {
                throw new ValidationException(
                    "Vector dimension " + vector.dimension() + " does not match collection dimension " + dimension
                );
            }
        }
    }
}
