package com.ryuqq.coalescer.core.key;

import com.ryuqq.coalescer.core.model.RequestKey;

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 암호학적 해시 기반 {@link KeyDeriver} 구현체.
 *
 * <p>키 형식: {@code <contentDigest>_<parameterDigest>}.
 * 각 digest는 SHA-256 결과의 앞 128비트를 16진수로 표현한 값입니다.</p>
 *
 * <p><strong>파라미터 정규화:</strong></p>
 * <ul>
 *   <li>Map은 키 이름 기준으로 정렬 (중첩 Map 포함)</li>
 *   <li>Collection/배열(원시 타입 배열 포함)은 원소 순서를 유지한 채 원소별로 정규화</li>
 *   <li>그 외 값은 {@link String#valueOf(Object)}</li>
 *   <li>각 토큰은 길이 접두사를 붙여 구분자 충돌을 방지 (예: {@code 3:abc})</li>
 * </ul>
 *
 * <p>상태가 없으므로 thread-safe합니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public final class DigestKeyDeriver implements KeyDeriver {

    private static final String DEFAULT_ALGORITHM = "SHA-256";
    private static final int DIGEST_BYTES = 16;

    private final String algorithm;

    /**
     * 생성자 (SHA-256).
     */
    public DigestKeyDeriver() {
        this(DEFAULT_ALGORITHM);
    }

    /**
     * 생성자 (digest 알고리즘 지정).
     *
     * @param algorithm {@link MessageDigest} 알고리즘 이름 (출력이 128비트 이상이어야 함)
     * @throws IllegalArgumentException 알고리즘을 사용할 수 없거나 출력이 128비트 미만인 경우
     */
    public DigestKeyDeriver(String algorithm) {
        if (algorithm == null || algorithm.isBlank()) {
            throw new IllegalArgumentException("algorithm cannot be null or blank");
        }
        MessageDigest probe = newDigest(algorithm);
        if (probe.getDigestLength() < DIGEST_BYTES) {
            throw new IllegalArgumentException(
                "algorithm must produce at least 128 bits (current: " + algorithm + ", "
                    + probe.getDigestLength() * 8 + " bits)"
            );
        }
        this.algorithm = algorithm;
    }

    @Override
    public RequestKey deriveKey(String content, Map<String, ?> parameters) {
        String contentDigest = digest(content == null ? "" : content);
        String parameterDigest = digest(canonicalize(parameters == null ? Map.of() : parameters));
        return RequestKey.of(contentDigest + "_" + parameterDigest);
    }

    /**
     * 파라미터를 순서 무관한 정규 문자열로 직렬화.
     *
     * @param parameters 파라미터
     * @return 정규 문자열
     */
    static String canonicalize(Map<String, ?> parameters) {
        StringBuilder sb = new StringBuilder();
        appendValue(sb, parameters);
        return sb.toString();
    }

    private static void appendValue(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append('~');
        } else if (value instanceof Map<?, ?> map) {
            TreeMap<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                sorted.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            sb.append('{');
            for (Map.Entry<String, Object> entry : sorted.entrySet()) {
                appendToken(sb, entry.getKey());
                sb.append('=');
                appendValue(sb, entry.getValue());
                sb.append(';');
            }
            sb.append('}');
        } else if (value instanceof Collection<?> collection) {
            appendSequence(sb, new ArrayList<>(collection));
        } else if (value instanceof Object[] array) {
            appendSequence(sb, Arrays.asList(array));
        } else if (value.getClass().isArray()) {
            // 원시 타입 배열(float[], int[] 등)은 원소 순서대로 직렬화
            int length = Array.getLength(value);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            appendSequence(sb, elements);
        } else {
            appendToken(sb, String.valueOf(value));
        }
    }

    private static void appendSequence(StringBuilder sb, List<?> values) {
        sb.append('[');
        for (Object element : values) {
            appendValue(sb, element);
            sb.append(',');
        }
        sb.append(']');
    }

    private static void appendToken(StringBuilder sb, String token) {
        sb.append(token.length()).append(':').append(token);
    }

    private String digest(String input) {
        byte[] hash = newDigest(algorithm).digest(input.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(hash, 0, DIGEST_BYTES);
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported digest algorithm: " + algorithm, e);
        }
    }
}
