package com.ryuqq.finfind.core.retrieval;

import java.util.Arrays;
import java.util.List;

/**
 * 고정 길이 임베딩 벡터.
 *
 * <p><strong>불변성:</strong> 생성 시 배열을 복사하며, 조회 시에도 복사본을 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Embedding {

    private final float[] values;

    private Embedding(float[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("values cannot be null or empty");
        }
        for (float value : values) {
            if (Float.isNaN(value) || Float.isInfinite(value)) {
                throw new IllegalArgumentException("values must be finite");
            }
        }
        this.values = values.clone();
    }

    /**
     * Embedding 생성.
     *
     * @param values 벡터 성분
     * @return Embedding 인스턴스
     * @throws IllegalArgumentException 비어 있거나 유한하지 않은 값이 있는 경우
     */
    public static Embedding of(float... values) {
        return new Embedding(values);
    }

    /**
     * double 목록으로부터 생성.
     *
     * @param values 벡터 성분
     * @return Embedding 인스턴스
     */
    public static Embedding of(List<? extends Number> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null or empty");
        }
        float[] array = new float[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i).floatValue();
        }
        return new Embedding(array);
    }

    /**
     * 차원 수.
     *
     * @return 벡터 길이
     */
    public int dimension() {
        return values.length;
    }

    /**
     * i번째 성분.
     *
     * @param index 인덱스
     * @return 성분 값
     */
    public float get(int index) {
        return values[index];
    }

    /**
     * 성분 배열의 복사본.
     *
     * @return 새 배열
     */
    public float[] toArray() {
        return values.clone();
    }

    /**
     * 코사인 유사도 (-1 ~ 1).
     *
     * <p>어느 한쪽이 영벡터이면 0을 반환합니다.</p>
     *
     * @param other 비교 대상
     * @return 코사인 유사도
     * @throws IllegalArgumentException 차원이 다른 경우
     */
    public double cosine(Embedding other) {
        if (other.values.length != values.length) {
            throw new IllegalArgumentException(
                "dimension mismatch (this: " + values.length + ", other: " + other.values.length + ")"
            );
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < values.length; i++) {
            dot += (double) values[i] * other.values[i];
            normA += (double) values[i] * values[i];
            normB += (double) other.values[i] * other.values[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * 여러 벡터의 평균 (centroid).
     *
     * @param embeddings 같은 차원의 벡터들 (1개 이상)
     * @return 평균 벡터
     * @throws IllegalArgumentException 비어 있거나 차원이 다른 경우
     */
    public static Embedding centroid(List<Embedding> embeddings) {
        if (embeddings == null || embeddings.isEmpty()) {
            throw new IllegalArgumentException("embeddings cannot be null or empty");
        }
        int dimension = embeddings.get(0).dimension();
        double[] sum = new double[dimension];
        for (Embedding embedding : embeddings) {
            if (embedding.dimension() != dimension) {
                throw new IllegalArgumentException("dimension mismatch in centroid");
            }
            for (int i = 0; i < dimension; i++) {
                sum[i] += embedding.values[i];
            }
        }
        float[] mean = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            mean[i] = (float) (sum[i] / embeddings.size());
        }
        return new Embedding(mean);
    }

    /**
     * this − weight × other.
     *
     * @param other 뺄 벡터
     * @param weight 가중치
     * @return 새 벡터
     */
    public Embedding minus(Embedding other, double weight) {
        if (other.values.length != values.length) {
            throw new IllegalArgumentException(
                "dimension mismatch (this: " + values.length + ", other: " + other.values.length + ")"
            );
        }
        float[] result = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (float) (values[i] - weight * other.values[i]);
        }
        return new Embedding(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(values, ((Embedding) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Embedding{dimension=" + values.length + '}';
    }
}
