package com.ryuqq.coalescer.core.model;

/**
 * 요청 중복 제거 키.
 *
 * <p>동일한 RequestKey를 가진 요청은 "같은 요청"으로 간주되어
 * 하나의 실행으로 병합(coalescing)됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~512자</li>
 * </ul>
 *
 * <p>일반적으로 {@link com.ryuqq.coalescer.core.key.KeyDeriver}가 생성하지만,
 * 호출자가 직접 만든 키도 허용합니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public final class RequestKey {

    private static final int MAX_LENGTH = 512;

    private final String value;

    private RequestKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RequestKey cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("RequestKey length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = value;
    }

    /**
     * RequestKey 생성.
     *
     * @param value 키 값
     * @return RequestKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RequestKey of(String value) {
        return new RequestKey(value);
    }

    /**
     * 키 값 조회.
     *
     * @return 키 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequestKey that = (RequestKey) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RequestKey{" + value + '}';
    }
}
