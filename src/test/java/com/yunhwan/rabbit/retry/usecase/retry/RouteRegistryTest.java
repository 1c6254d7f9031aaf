package com.yunhwan.rabbit.retry.usecase.retry;

import com.yunhwan.rabbit.retry.common.exception.RouteNotFoundException;
import com.yunhwan.rabbit.retry.domain.retry.Event;
import com.yunhwan.rabbit.retry.domain.retry.InboundEvent;
import com.yunhwan.rabbit.retry.domain.retry.RouteConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouteRegistryTest {

    private final RouteRegistry registry = new RouteRegistry(List.of(
            new RouteConfig("a", 1, "100"),
            new RouteConfig("b", 3, "1000")
    ));

    @Test
    @DisplayName("route 헤더로 설정을 찾는다")
    void route_헤더_조회() {
        Event event = new InboundEvent(new byte[]{1}, Map.of(Event.HEADER_ROUTE, "b"));

        assertThat(registry.routeOf(event).maxRetryCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("route 헤더가 없으면 기본값 없이 조회 실패")
    void route_헤더_누락() {
        Event event = new InboundEvent(new byte[]{1}, Map.of("other", "x"));

        assertThatThrownBy(() -> registry.routeOf(event))
                .isInstanceOf(RouteNotFoundException.class)
                .hasMessageContaining("missing route header");
    }

    @Test
    @DisplayName("설정되지 않은 route 는 조회 실패")
    void 미설정_route() {
        assertThatThrownBy(() -> registry.lookup("unknown"))
                .isInstanceOf(RouteNotFoundException.class);
    }

    @Test
    @DisplayName("route 이름 중복과 잘못된 정책은 생성 시점에 거부한다")
    void 잘못된_설정_거부() {
        assertThatThrownBy(() -> new RouteRegistry(List.of(new RouteConfig("a", 1, "1"), new RouteConfig("a", 2, "2"))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RouteConfig("a", -1, "100"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RouteConfig("a", 1, "2s"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("설정 순서를 유지하고 외부에서 변경할 수 없다")
    void 읽기_전용() {
        assertThat(registry.all()).extracting(RouteConfig::route).containsExactly("a", "b");
        assertThatThrownBy(() -> registry.all().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
