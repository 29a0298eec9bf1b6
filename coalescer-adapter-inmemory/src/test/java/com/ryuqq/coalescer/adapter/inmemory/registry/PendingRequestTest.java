package com.ryuqq.coalescer.adapter.inmemory.registry;

import com.ryuqq.coalescer.core.model.Priority;
import com.ryuqq.coalescer.core.model.RequestKey;
import com.ryuqq.coalescer.core.model.RequestOptions;
import com.ryuqq.coalescer.core.operation.Operation;
import com.ryuqq.coalescer.core.statemachine.RequestState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PendingRequest 테스트.
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
class PendingRequestTest {

    private static PendingRequest<Integer> newRequest() {
        return new PendingRequest<>(
            RequestKey.of("k1"),
            Operation.completed(42),
            RequestOptions.defaults().withPriority(Priority.LOW).withCost(0.5),
            1_000L
        );
    }

    @Test
    void 생성_직후_PENDING_상태이며_옵션을_보관함() {
        // when
        PendingRequest<Integer> request = newRequest();

        // then
        assertThat(request.getState()).isEqualTo(RequestState.PENDING);
        assertThat(request.getPriority()).isEqualTo(Priority.LOW);
        assertThat(request.getCost()).isEqualTo(0.5);
        assertThat(request.getId().getValue()).startsWith("req_");
        assertThat(request.waiterCount()).isZero();
    }

    @Test
    void null_인자는_예외() {
        assertThatThrownBy(() -> new PendingRequest<>(null, Operation.completed(1), RequestOptions.defaults(), 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("key cannot be null");
        assertThatThrownBy(() -> new PendingRequest<Integer>(RequestKey.of("k"), null, RequestOptions.defaults(), 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("operation cannot be null");
        assertThatThrownBy(() -> new PendingRequest<>(RequestKey.of("k"), Operation.completed(1), null, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("options cannot be null");
    }

    @Test
    void complete는_대기자를_합류_순서대로_비우고_종료함() {
        // given
        PendingRequest<Integer> request = newRequest();
        CompletableFuture<Integer> first = request.attachWaiter();
        CompletableFuture<Integer> second = request.attachWaiter();
        request.markInFlight();

        // when
        List<CompletableFuture<Integer>> drained = request.complete();

        // then
        assertThat(drained).containsExactly(first, second);
        assertThat(request.getState()).isEqualTo(RequestState.COMPLETED);
        assertThat(request.waiterCount()).isZero();
    }

    @Test
    void 종료된_요청은_다시_비워도_빈_목록() {
        // given
        PendingRequest<Integer> request = newRequest();
        request.attachWaiter();
        request.fail();

        // when & then
        assertThat(request.complete()).isEmpty();
        assertThat(request.fail()).isEmpty();
        assertThat(request.getState()).isEqualTo(RequestState.FAILED);
    }

    @Test
    void 종료된_요청에는_대기자_합류_불가() {
        // given
        PendingRequest<Integer> request = newRequest();
        request.fail();

        // when & then
        assertThatThrownBy(request::attachWaiter)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("terminal");
    }

    @Test
    void 종료된_요청은_markInFlight가_false() {
        // given
        PendingRequest<Integer> request = newRequest();
        request.markBatched();
        request.fail();

        // when & then
        assertThat(request.markInFlight()).isFalse();
        assertThat(request.getState()).isEqualTo(RequestState.FAILED);
    }

    @Test
    void BATCHED에서_IN_FLIGHT로_전이됨() {
        // given
        PendingRequest<Integer> request = newRequest();

        // when
        request.markBatched();
        boolean started = request.markInFlight();

        // then
        assertThat(started).isTrue();
        assertThat(request.getState()).isEqualTo(RequestState.IN_FLIGHT);
    }

    @Test
    void succeed와_failAll은_모든_대기자를_순서대로_완료함() {
        // given
        List<String> order = new ArrayList<>();
        CompletableFuture<Integer> a = new CompletableFuture<>();
        CompletableFuture<Integer> b = new CompletableFuture<>();
        a.thenRun(() -> order.add("a"));
        b.thenRun(() -> order.add("b"));

        // when
        PendingRequest.succeed(List.of(a, b), 7);

        // then
        assertThat(order).containsExactly("a", "b");
        assertThat(a.join()).isEqualTo(7);

        // given
        CompletableFuture<Integer> c = new CompletableFuture<>();
        IllegalStateException error = new IllegalStateException("boom");

        // when
        PendingRequest.failAll(List.of(c), error);

        // then
        assertThat(c).isCompletedExceptionally();
    }

    @Test
    void ageMs는_음수가_되지_않음() {
        PendingRequest<Integer> request = newRequest();

        assertThat(request.ageMs(1_500L)).isEqualTo(500L);
        assertThat(request.ageMs(500L)).isZero();
    }
}
