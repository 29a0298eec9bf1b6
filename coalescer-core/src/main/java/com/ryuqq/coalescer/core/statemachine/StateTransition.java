package com.ryuqq.coalescer.core.statemachine;

/**
 * 요청 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → IN_FLIGHT | BATCHED | FAILED</li>
 *   <li>BATCHED → IN_FLIGHT | FAILED</li>
 *   <li>IN_FLIGHT → COMPLETED | FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태(COMPLETED, FAILED)에서는 어떤 상태로도 전이 불가.
 * 이 불변식 덕분에 늦게 도착한 작업 결과가 이미 타임아웃/취소된 대기자를
 * 두 번 해소하지 않습니다.</p>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 확인 (예외 없음).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이이면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(RequestState from, RequestState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case PENDING -> to == RequestState.IN_FLIGHT || to == RequestState.BATCHED || to == RequestState.FAILED;
            case BATCHED -> to == RequestState.IN_FLIGHT || to == RequestState.FAILED;
            case IN_FLIGHT -> to == RequestState.COMPLETED || to == RequestState.FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RequestState from, RequestState to) {
        if (!isAllowed(from, to)) {
            if (from.isTerminal()) {
                throw new IllegalStateException(
                    String.format("Cannot transition from terminal state: %s → %s", from, to)
                );
            }
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RequestState transition(RequestState current, RequestState next) {
        validate(current, next);
        return next;
    }
}
