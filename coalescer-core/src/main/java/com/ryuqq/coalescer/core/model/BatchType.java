package com.ryuqq.coalescer.core.model;

import java.util.regex.Pattern;

/**
 * 배치 그룹 구분자.
 *
 * <p>같은 BatchType의 배치 가능 요청만 하나의 배치 윈도우에 모입니다.
 * 서로 다른 BatchType은 절대 윈도우를 공유하지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>BatchType.of("embed") - 임베딩 요청</li>
 *   <li>BatchType.of("completion") - 완성(completion) 요청</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~50자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public final class BatchType {

    /**
     * 타입을 지정하지 않은 배치 요청이 사용하는 기본 타입.
     */
    public static final BatchType DEFAULT = new BatchType("default");

    private static final Pattern VALID_PATTERN = Pattern.compile("^[A-Za-z0-9_.\\-]+$");

    private final String value;

    private BatchType(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("BatchType cannot be null or blank");
        }
        if (value.length() > 50) {
            throw new IllegalArgumentException("BatchType length cannot exceed 50 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("BatchType must contain only letters, digits, '_', '-' or '.'");
        }
        this.value = value;
    }

    /**
     * BatchType 생성.
     *
     * @param value 타입 값 (예: embed, completion)
     * @return BatchType 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static BatchType of(String value) {
        return new BatchType(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BatchType batchType = (BatchType) o;
        return value.equals(batchType.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "BatchType{" + value + '}';
    }
}
