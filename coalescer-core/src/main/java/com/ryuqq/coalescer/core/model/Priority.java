package com.ryuqq.coalescer.core.model;

/**
 * 요청 우선순위.
 *
 * <p>우선순위는 배치 내 실행 순서와 즉시 flush 여부에만 영향을 줍니다.
 * 중복 제거(dedup) 판단에는 사용되지 않습니다.</p>
 *
 * <ul>
 *   <li>{@link #HIGH}: 배치에 합류하는 즉시 윈도우를 flush</li>
 *   <li>{@link #NORMAL}: 기본값</li>
 *   <li>{@link #LOW}: 배치 내에서 가장 나중에 실행</li>
 * </ul>
 *
 * <p>선언 순서가 곧 실행 순서이므로 {@link Enum#compareTo}로 정렬할 수 있습니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public enum Priority {

    HIGH,

    NORMAL,

    LOW;

    /**
     * 즉시 flush를 유발하는 우선순위인지 확인.
     *
     * @return HIGH인 경우 true
     */
    public boolean flushesImmediately() {
        return this == HIGH;
    }
}
