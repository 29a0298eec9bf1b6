package com.ryuqq.coalescer.adapter.inmemory.registry;

import com.ryuqq.coalescer.core.model.RequestKey;
import com.ryuqq.coalescer.core.model.RequestOptions;
import com.ryuqq.coalescer.core.operation.Operation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InFlightRegistry 테스트.
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
class InFlightRegistryTest {

    private InFlightRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InFlightRegistry();
    }

    private static PendingRequest<String> request(String key, long createdAt) {
        return new PendingRequest<>(RequestKey.of(key), Operation.completed(key), RequestOptions.defaults(), createdAt);
    }

    @Test
    void register_후_find로_조회됨() {
        // given
        PendingRequest<String> entry = request("k1", 0);

        // when
        registry.register(entry);

        // then
        assertThat(registry.find(RequestKey.of("k1"))).isSameAs(entry);
        assertThat(registry.find(RequestKey.of("k2"))).isNull();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void 같은_키로_다른_엔트리_등록시_예외() {
        // given
        registry.register(request("k1", 0));

        // when & then
        assertThatThrownBy(() -> registry.register(request("k1", 10)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("k1");
    }

    @Test
    void 같은_엔트리_재등록은_허용됨() {
        PendingRequest<String> entry = request("k1", 0);
        registry.register(entry);

        registry.register(entry);

        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void remove는_동일_인스턴스일_때만_제거함() {
        // given
        PendingRequest<String> stale = request("k1", 0);
        PendingRequest<String> current = request("k1", 10);
        registry.register(current);

        // when
        boolean removedStale = registry.remove(stale);

        // then
        assertThat(removedStale).isFalse();
        assertThat(registry.find(RequestKey.of("k1"))).isSameAs(current);
        assertThat(registry.remove(current)).isTrue();
        assertThat(registry.size()).isZero();
    }

    @Test
    void removeExpired는_최대_경과시간_초과_엔트리만_제거함() {
        // given
        PendingRequest<String> old = request("old", 0);
        PendingRequest<String> edge = request("edge", 70);
        PendingRequest<String> fresh = request("fresh", 90);
        registry.register(old);
        registry.register(edge);
        registry.register(fresh);

        // when
        List<PendingRequest<?>> expired = registry.removeExpired(100, 30);

        // then
        assertThat(expired).containsExactly(old);
        assertThat(registry.snapshot()).containsExactly(edge, fresh);
    }

    @Test
    void removeAll은_모든_엔트리를_등록순으로_반환하고_비움() {
        PendingRequest<String> a = request("a", 0);
        PendingRequest<String> b = request("b", 0);
        registry.register(a);
        registry.register(b);

        assertThat(registry.removeAll()).containsExactly(a, b);
        assertThat(registry.size()).isZero();
    }

    @Test
    void null_인자는_예외() {
        assertThatThrownBy(() -> registry.find(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.remove((RequestKey) null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
