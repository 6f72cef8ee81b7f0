package com.ryuqq.finfind.core.protocol;

import com.ryuqq.finfind.core.context.CompressedContext;
import com.ryuqq.finfind.core.model.CorrelationId;
import com.ryuqq.finfind.core.outcome.ErrorKind;
import com.ryuqq.finfind.core.outcome.Fail;
import com.ryuqq.finfind.core.outcome.Ok;
import com.ryuqq.finfind.core.outcome.Result;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A2A 메시지 봉투.
 *
 * <p>에이전트 간 모든 통신은 이 봉투로 전달됩니다. 메시지는 전송마다 생성되고
 * 매칭/전달 후 폐기되며 영속화되지 않습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>REQUEST, RESPONSE는 correlationId를 반드시 가짐</li>
 *   <li>EVENT, BROADCAST는 correlationId를 가지지 않음</li>
 *   <li>REQUEST는 deadline을 반드시 가짐</li>
 *   <li>context는 REQUEST에만 첨부 가능</li>
 * </ul>
 *
 * <p>RESPONSE의 실패 결과는 payload의 {@value #ERROR_KIND_KEY}, {@value #ERROR_MESSAGE_KEY}
 * 항목으로 표현되며 {@link #toResult()}로 복원합니다.</p>
 *
 * @param id 메시지 ID
 * @param type 메시지 유형
 * @param topic 대상 토픽
 * @param correlationId 상관관계 ID (EVENT/BROADCAST는 null)
 * @param sender 발신자
 * @param recipient 수신자 (EVENT/BROADCAST는 null 가능)
 * @param payload 페이로드 (불변)
 * @param priority 우선순위
 * @param createdAt 생성 시각
 * @param deadline 응답 기한 (REQUEST 외에는 null 가능)
 * @param context 압축 컨텍스트 (REQUEST 외에는 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Message(
    String id,
    MessageType type,
    String topic,
    CorrelationId correlationId,
    String sender,
    String recipient,
    Map<String, Object> payload,
    Priority priority,
    Instant createdAt,
    Instant deadline,
    CompressedContext context
) {

    public static final String ERROR_KIND_KEY = "errorKind";
    public static final String ERROR_MESSAGE_KEY = "errorMessage";

    public Message {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (sender == null || sender.isBlank()) {
            throw new IllegalArgumentException("sender cannot be null or blank");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (type.isCorrelated() && correlationId == null) {
            throw new IllegalArgumentException(type + " message requires a correlationId");
        }
        if (!type.isCorrelated() && correlationId != null) {
            throw new IllegalArgumentException(type + " message cannot carry a correlationId");
        }
        if (type == MessageType.REQUEST && deadline == null) {
            throw new IllegalArgumentException("REQUEST message requires a deadline");
        }
        if (type != MessageType.REQUEST && context != null) {
            throw new IllegalArgumentException("context can only be attached to a REQUEST message");
        }
        payload = payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * REQUEST 메시지 생성 (새 correlationId 발급).
     *
     * @param topic 대상 토픽
     * @param sender 발신자
     * @param payload 페이로드
     * @param priority 우선순위
     * @param timeout 응답 대기 시간
     * @param context 압축 컨텍스트 (null 가능)
     * @return REQUEST 메시지
     */
    public static Message request(
        String topic,
        String sender,
        Map<String, Object> payload,
        Priority priority,
        Duration timeout,
        CompressedContext context
    ) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        Instant now = Instant.now();
        return new Message(newId(), MessageType.REQUEST, topic, CorrelationId.generate(), sender, topic,
            payload, priority, now, now.plus(timeout), context);
    }

    /**
     * REQUEST에 대한 RESPONSE 메시지 생성.
     *
     * @param request 원본 REQUEST
     * @param sender 응답자
     * @param result 처리 결과
     * @return RESPONSE 메시지
     * @throws IllegalArgumentException request가 REQUEST가 아닌 경우
     */
    public static Message response(Message request, String sender, Result<Map<String, Object>> result) {
        if (request == null || request.type() != MessageType.REQUEST) {
            throw new IllegalArgumentException("response requires a REQUEST message");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        Map<String, Object> payload;
        if (result instanceof Ok<Map<String, Object>> ok) {
            payload = ok.value();
        } else {
            Fail<Map<String, Object>> fail = (Fail<Map<String, Object>>) result;
            payload = new LinkedHashMap<>();
            payload.put(ERROR_KIND_KEY, fail.kind().name());
            payload.put(ERROR_MESSAGE_KEY, fail.message());
        }
        return new Message(newId(), MessageType.RESPONSE, request.topic(), request.correlationId(), sender,
            request.sender(), payload, request.priority(), Instant.now(), null, null);
    }

    /**
     * EVENT 메시지 생성.
     *
     * @param topic 토픽
     * @param sender 발신자
     * @param payload 페이로드
     * @return EVENT 메시지
     */
    public static Message event(String topic, String sender, Map<String, Object> payload) {
        return new Message(newId(), MessageType.EVENT, topic, null, sender, null, payload,
            Priority.NORMAL, Instant.now(), null, null);
    }

    /**
     * BROADCAST 메시지 생성.
     *
     * @param topic 토픽
     * @param sender 발신자
     * @param payload 페이로드
     * @param priority 우선순위
     * @return BROADCAST 메시지
     */
    public static Message broadcast(String topic, String sender, Map<String, Object> payload, Priority priority) {
        return new Message(newId(), MessageType.BROADCAST, topic, null, sender, null, payload,
            priority, Instant.now(), null, null);
    }

    /**
     * 응답 기한이 지났는지 확인.
     *
     * @param now 기준 시각
     * @return deadline이 있고 now 이후가 아니면 true
     */
    public boolean isExpired(Instant now) {
        return deadline != null && !now.isBefore(deadline);
    }

    /**
     * RESPONSE 페이로드를 Result로 복원.
     *
     * @return 성공 페이로드 또는 실패 결과
     * @throws IllegalStateException RESPONSE가 아닌 경우
     */
    public Result<Map<String, Object>> toResult() {
        if (type != MessageType.RESPONSE) {
            throw new IllegalStateException("Only RESPONSE messages carry a result (type: " + type + ")");
        }
        Object kind = payload.get(ERROR_KIND_KEY);
        if (kind == null) {
            return Result.ok(payload);
        }
        Object message = payload.get(ERROR_MESSAGE_KEY);
        return Fail.of(ErrorKind.valueOf(kind.toString()), message == null ? "unknown error" : message.toString());
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
