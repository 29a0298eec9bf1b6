package com.ryuqq.coalescer.core.model;

import java.util.UUID;

/**
 * 제출된 요청의 프로세스 내 고유 식별자.
 *
 * <p>RequestKey가 "무엇을 요청했는가"를 나타낸다면, RequestId는
 * "어떤 제출 건인가"를 나타냅니다. 같은 키로 들어온 요청들은
 * 최초 제출 시 생성된 하나의 RequestId를 공유합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public final class RequestId {

    private static final String PREFIX = "req_";

    private final String value;

    private RequestId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RequestId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("RequestId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("RequestId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * RequestId 생성.
     *
     * @param value RequestId 값
     * @return RequestId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RequestId of(String value) {
        return new RequestId(value);
    }

    /**
     * 새 RequestId 발급 (UUID 기반).
     *
     * @return 새 RequestId (예: req_550e8400-e29b-41d4-a716-446655440000)
     */
    public static RequestId generate() {
        return new RequestId(PREFIX + UUID.randomUUID());
    }

    /**
     * RequestId 값 조회.
     *
     * @return RequestId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequestId requestId = (RequestId) o;
        return value.equals(requestId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RequestId{" + value + '}';
    }
}
