package com.ryuqq.gateway.core.contract;

import java.util.Map;

/**
 * 전송 계층 요청 봉투 (Envelope).
 *
 * <p>전송 계층이 호출마다 생성하며, 타입이 지정된 요청 메시지와 헤더 메타데이터를 담습니다.
 * 서비스는 {@link #message()}로 한 번만 꺼내어 사용합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * RequestEnvelope&lt;DeleteCollection&gt; envelope = RequestEnvelope.of(new DeleteCollection("books", 30L));
 * service.delete(envelope);
 * </pre>
 *
 * @param message 요청 메시지
 * @param metadata 전송 헤더 (빈 맵 허용)
 * @param <T> 요청 메시지 타입
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public record RequestEnvelope<T>(
    T message,
    Map<String, String> metadata
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message 또는 metadata가 null인 경우
     */
    public RequestEnvelope {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        metadata = Map.copyOf(metadata);
    }

    /**
     * 메타데이터 없이 Envelope 생성.
     *
     * @param message 요청 메시지
     * @param <T> 요청 메시지 타입
     * @return 생성된 Envelope
     * @throws IllegalArgumentException message가 null인 경우
     */
    public static <T> RequestEnvelope<T> of(T message) {
        return new RequestEnvelope<>(message, Map.of());
    }
}
