package com.ryuqq.coalescer.application.telemetry;

import com.ryuqq.coalescer.core.model.Priority;
import com.ryuqq.coalescer.core.model.RequestKey;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CoalescerStats / PendingRequestView 테스트.
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
class CoalescerStatsTest {

    @Test
    void efficiency는_중복과_배치의_합을_전체로_나눈_값() {
        // given
        CoalescerStats stats = new CoalescerStats(10, 3, 2, 0.3, 12.5, 1, 0);

        // when & then
        assertThat(stats.efficiency()).isEqualTo(0.5);
    }

    @Test
    void 요청이_없으면_efficiency는_0() {
        CoalescerStats stats = new CoalescerStats(0, 0, 0, 0, 0, 0, 0);

        assertThat(stats.efficiency()).isZero();
    }

    @Test
    void 음수_값은_예외() {
        assertThatThrownBy(() -> new CoalescerStats(-1, 0, 0, 0, 0, 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CoalescerStats(1, 0, 0, -0.5, 0, 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CoalescerStats(1, 0, 0, 0, 0, -1, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void PendingRequestView는_키와_우선순위가_필수() {
        assertThatThrownBy(() -> new PendingRequestView(null, 0, Priority.NORMAL, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("key cannot be null");
        assertThatThrownBy(() -> new PendingRequestView(RequestKey.of("k"), 0, null, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("priority cannot be null");
    }
}
