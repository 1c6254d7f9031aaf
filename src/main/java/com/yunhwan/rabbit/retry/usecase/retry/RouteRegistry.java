package com.yunhwan.rabbit.retry.usecase.retry;

import com.yunhwan.rabbit.retry.common.exception.RouteNotFoundException;
import com.yunhwan.rabbit.retry.domain.retry.Event;
import com.yunhwan.rabbit.retry.domain.retry.RouteConfig;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 기동 시 고정되는 route 설정 목록. 생성 이후 읽기 전용이라 동시 조회에 안전하다.
 */
public class RouteRegistry {

    private final Map<String, RouteConfig> routes;
    private final List<RouteConfig> ordered;

    public RouteRegistry(Collection<RouteConfig> configs) {
        Map<String, RouteConfig> m = new LinkedHashMap<>();
        for (RouteConfig config : configs) {
            if (m.putIfAbsent(config.route(), config) != null) {
                throw new IllegalArgumentException("duplicate route. route=" + config.route());
            }
        }
        this.routes = Collections.unmodifiableMap(m);
        this.ordered = List.copyOf(m.values());
    }

    public RouteConfig lookup(String route) {
        RouteConfig config = route == null ? null : routes.get(route);
        if (config == null) {
            throw new RouteNotFoundException("route not configured. route=" + route);
        }
        return config;
    }

    /**
     * 메시지의 route 헤더로 설정을 찾는다. 헤더가 없으면 기본값 없이 실패한다.
     */
    public RouteConfig routeOf(Event event) {
        String route = event.route();
        if (route == null || route.isBlank()) {
            throw new RouteNotFoundException("missing route header. header=" + Event.HEADER_ROUTE);
        }
        return lookup(route);
    }

    public List<RouteConfig> all() {
        return ordered;
    }
}
