package com.ryuqq.coalescer.core.operation;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * 지연 실행되는 원격 작업.
 *
 * <p>엔진은 작업의 내용을 알지 못하며, 인자 없이 호출하면 값 또는 실패를 돌려주는
 * 계산으로만 다룹니다. 엔진은 같은 키에 대해 이 작업을 최대 한 번만 호출합니다.</p>
 *
 * <p><strong>실패 규칙:</strong></p>
 * <ul>
 *   <li>반환된 stage가 예외로 완료되면 그 예외가 모든 대기자에게 그대로 전달됩니다.</li>
 *   <li>{@link #invoke()}가 동기적으로 예외를 던져도 동일하게 처리됩니다.</li>
 *   <li>null stage 반환은 {@link NullPointerException} 실패로 취급됩니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * // 이미 비동기 API가 있는 경우
 * Operation&lt;Completion&gt; op = () -&gt; client.completeAsync(prompt);
 *
 * // 블로킹 호출을 별도 스레드 풀에서 실행하는 경우
 * Operation&lt;Completion&gt; op = Operation.blocking(() -&gt; client.complete(prompt), ioPool);
 * </pre>
 *
 * @param <T> 결과 타입
 * @author Coalescer Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Operation<T> {

    /**
     * 작업 실행 시작.
     *
     * @return 작업 결과 stage
     * @throws Exception 작업을 시작하지 못한 경우
     */
    CompletionStage<T> invoke() throws Exception;

    /**
     * 블로킹 호출을 주어진 Executor에서 실행하는 Operation 생성.
     *
     * @param callable 블로킹 호출
     * @param executor 실행할 Executor
     * @param <T> 결과 타입
     * @return Operation
     * @throws IllegalArgumentException callable 또는 executor가 null인 경우
     */
    static <T> Operation<T> blocking(Callable<T> callable, Executor executor) {
        if (callable == null) {
            throw new IllegalArgumentException("callable cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        return () -> {
            CompletableFuture<T> future = new CompletableFuture<>();
            executor.execute(() -> {
                try {
                    future.complete(callable.call());
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                }
            });
            return future;
        };
    }

    /**
     * 이미 알려진 값으로 즉시 완료되는 Operation 생성.
     *
     * @param value 결과 값
     * @param <T> 결과 타입
     * @return Operation
     */
    static <T> Operation<T> completed(T value) {
        return () -> CompletableFuture.completedFuture(value);
    }
}
