package com.yunhwan.rabbit.retry.domain.retry;

import java.util.Objects;

/**
 * route 별 재시도 정책. 기동 이후 변경되지 않는다.
 *
 * @param route             route 이름
 * @param maxRetryCount     delay 왕복 허용 횟수 (0 이상)
 * @param delayExpirationMs delay 큐 보관 시간(ms). AMQP expiration 속성에 그대로 실린다.
 */
public record RouteConfig(String route, int maxRetryCount, String delayExpirationMs) {

    public RouteConfig {
        Objects.requireNonNull(route, "route");
        if (route.isBlank()) {
            throw new IllegalArgumentException("route must not be blank");
        }
        if (maxRetryCount < 0) {
            throw new IllegalArgumentException(
                    "maxRetryCount must be >= 0. route=" + route + ", maxRetryCount=" + maxRetryCount);
        }
        if (delayExpirationMs == null || !delayExpirationMs.matches("\\d+")) {
            throw new IllegalArgumentException(
                    "delayExpirationMs must be a non-negative integer. route=" + route
                            + ", delayExpirationMs=" + delayExpirationMs);
        }
    }
}
