package com.yunhwan.rabbit.retry.infra.messaging.consumer;

import com.yunhwan.rabbit.retry.common.exception.ConsumerClosedException;
import com.yunhwan.rabbit.retry.infra.metrics.MetricsConfig;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * route 별 consumer 상태.
 * <p>
 * consumer 가 닫혀도 자동 재시작은 하지 않는다. 대신 이 상태를 gauge/health 로 노출해서
 * 운영자나 외부 supervisor 가 감지하고 재기동하도록 한다.
 */
@Component
@RequiredArgsConstructor
public class ConsumerStatusRegistry {

    public enum State { RUNNING, CLOSED }

    public record ConsumerStatus(State state, OffsetDateTime since, String reason) {
        public boolean isUp() { return state == State.RUNNING; }
    }

    private final Map<String, ConsumerStatus> statuses = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * consumer 기동 직전에 호출한다. 이미 CLOSED 로 기록된 route 는 되돌리지 않는다.
     */
    public void markRunning(String route) {
        ConsumerStatus prev = statuses.putIfAbsent(route, new ConsumerStatus(State.RUNNING, OffsetDateTime.now(clock), null));
        if (prev == null) {
            Gauge.builder(MetricsConfig.METRIC_CONSUMER_UP, this, r -> r.isUp(route) ? 1 : 0)
                    .tag(MetricsConfig.TAG_ROUTE, route)
                    .register(meterRegistry);
        }
    }

    /**
     * @return 이번 호출로 CLOSED 가 되었으면 true, 이미 CLOSED 였으면 false
     */
    public boolean markClosed(ConsumerClosedException closed) {
        AtomicBoolean changed = new AtomicBoolean(false);
        statuses.compute(closed.getRoute(), (route, prev) -> {
            if (prev != null && prev.state() == State.CLOSED) {
                return prev;
            }
            changed.set(true);
            return new ConsumerStatus(State.CLOSED, OffsetDateTime.now(clock), closed.getMessage());
        });
        return changed.get();
    }

    public Optional<ConsumerStatus> status(String route) {
        return Optional.ofNullable(statuses.get(route));
    }

    public boolean isUp(String route) {
        ConsumerStatus s = statuses.get(route);
        return s != null && s.isUp();
    }

    public Map<String, ConsumerStatus> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(statuses));
    }
}
