package com.yunhwan.rabbit.retry.infra.messaging.rabbit;

import com.yunhwan.rabbit.retry.domain.retry.RetryTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RetryTopologyNamesTest {

    @Test
    @DisplayName("route/tier 조합으로 결정적인 exchange/queue 이름을 만든다")
    void 이름_생성_규칙() {
        assertThat(RetryTopologyNames.exchangeName("orders", RetryTier.INSTANT)).isEqualTo("orders.instant.exchange");
        assertThat(RetryTopologyNames.queueName("orders", RetryTier.DELAY)).isEqualTo("orders.delay.queue");
        assertThat(RetryTopologyNames.queueName("orders", RetryTier.DEAD_LETTER)).isEqualTo("orders.dead_letter.queue");
        assertThat(RetryTopologyNames.consumerTag("orders")).isEqualTo("orders.instant.queue_retry_ctag");
    }

    @Test
    @DisplayName("route 이름이 tier 이름을 포함해도 서로 다른 (route, tier) 쌍은 충돌하지 않는다")
    void 이름_충돌_없음() {
        List<String> routes = List.of("a", "b", "a.delay", "a.instant", "a.dead", "dead_letter", "a.dead_letter", "delay");

        Set<String> names = new HashSet<>();
        int expected = 0;
        for (String route : routes) {
            for (RetryTier tier : RetryTier.values()) {
                names.add(RetryTopologyNames.exchangeName(route, tier));
                names.add(RetryTopologyNames.queueName(route, tier));
                expected += 2;
            }
        }

        assertThat(names).hasSize(expected);
    }

    @Test
    @DisplayName("같은 입력이면 항상 같은 이름이다 (재기동 시 재선언 멱등)")
    void 이름_결정성() {
        assertThat(RetryTopologyNames.exchangeName("orders", RetryTier.DELAY))
                .isEqualTo(RetryTopologyNames.exchangeName("orders", RetryTier.DELAY));
    }
}
