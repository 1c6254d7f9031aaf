package com.yunhwan.rabbit.retry.infra.messaging.rabbit;

import com.yunhwan.rabbit.retry.domain.retry.RouteConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 브로커 주소 목록은 spring.rabbitmq.addresses 를 그대로 쓰고,
 * 여기에는 재시도 정책과 타임아웃만 둔다.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "rabbit-retry")
public class RabbitRetryProperties {

    /**
     * 기동 시 publisher 연결 + 토폴로지 선언 + consumer 기동을 자동 수행할지
     */
    private boolean autoStart = true;

    /**
     * publisher 세션 연결 제한 시간
     */
    private Duration connectTimeout = Duration.ofSeconds(30);

    /**
     * 재발행 시 broker confirm 대기 시간
     */
    private Duration confirmTimeout = Duration.ofSeconds(3);

    /**
     * route 이름 -> 재시도 정책
     */
    private Map<String, Route> routes = new LinkedHashMap<>();

    @Getter @Setter
    public static class Route {
        private int maxRetryCount;
        private String delayExpirationMs;
    }

    public List<RouteConfig> toRouteConfigs() {
        return routes.entrySet().stream()
                .map(e -> new RouteConfig(
                        e.getKey(),
                        e.getValue().getMaxRetryCount(),
                        e.getValue().getDelayExpirationMs()))
                .toList();
    }
}
