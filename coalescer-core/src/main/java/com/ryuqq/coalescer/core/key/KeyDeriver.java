package com.ryuqq.coalescer.core.key;

import com.ryuqq.coalescer.core.model.RequestKey;

import java.util.Map;

/**
 * 요청 내용과 파라미터로부터 중복 제거 키를 만드는 순수 함수.
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>결정적(deterministic): 같은 입력은 항상 같은 키</li>
 *   <li>파라미터 삽입 순서와 무관: 이름 기준으로 정렬 후 직렬화</li>
 *   <li>다른 입력은 높은 확률로 다른 키</li>
 *   <li>실패하지 않음: 어떤 입력에도 키를 반환</li>
 * </ul>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface KeyDeriver {

    /**
     * 중복 제거 키 생성.
     *
     * @param content 요청 본문 (null이면 빈 문자열로 취급)
     * @param parameters 요청 파라미터 (null이면 빈 map으로 취급)
     * @return 중복 제거 키
     */
    RequestKey deriveKey(String content, Map<String, ?> parameters);
}
