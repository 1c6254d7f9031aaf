package com.yunhwan.rabbit.retry.infra.logging;

import com.yunhwan.rabbit.retry.domain.retry.Event;
import com.yunhwan.rabbit.retry.domain.retry.RetryEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static net.logstash.logback.argument.StructuredArguments.entries;

/**
 * 재시도 경로의 상태 전이를 구조화 로그(JSON field)로 남긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryEventLogger {

    private final Clock clock;

    public void retryScheduled(String route, RetryEnvelope envelope, String ttlMs) {
        Map<String, Object> evt = createBaseEvent("retry.scheduled", route);
        evt.put("retry_count", envelope.retryCount());
        evt.put("ttl_ms", ttlMs);
        log.info("retry_event {}", entries(evt));
    }

    public void deadLettered(String route, RetryEnvelope envelope) {
        Map<String, Object> evt = createBaseEvent("retry.dead_lettered", route);
        evt.put("retry_count", envelope.retryCount());
        log.warn("retry_event {}", entries(evt));
    }

    public void publishFailed(Event event, Throwable cause) {
        Map<String, Object> evt = createBaseEvent("retry.publish_failed", event.route());
        evt.put("error", mapOfNonNull(
                "exception", cause.getClass().getSimpleName(),
                "message", cause.getMessage()
        ));
        log.error("retry_event {}", entries(evt));
    }

    public void routeNotFound(Event event, Throwable cause) {
        Map<String, Object> evt = createBaseEvent("retry.route_not_found", event.route());
        evt.put("error", mapOfNonNull(
                "exception", cause.getClass().getSimpleName(),
                "message", cause.getMessage()
        ));
        log.error("retry_event {}", entries(evt));
    }

    public void consumerClosed(String route, String reason) {
        Map<String, Object> evt = createBaseEvent("consumer.closed", route);
        if (reason != null) evt.put("reason", reason);
        log.error("retry_event {}", entries(evt));
    }

    private Map<String, Object> createBaseEvent(String eventType, String route) {
        Map<String, Object> evt = new LinkedHashMap<>();
        evt.put("event_type", eventType);
        evt.put("event_id", UUID.randomUUID().toString());
        evt.put("occurred_at", OffsetDateTime.now(clock).toString());
        // 헤더 누락 케이스도 로그는 남겨야 하므로 null 대신 고정값
        evt.put("route", route == null ? "unknown" : route);
        return evt;
    }

    private Map<String, Object> mapOfNonNull(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            if (kv[i + 1] != null) {
                m.put(String.valueOf(kv[i]), kv[i + 1]);
            }
        }
        return m;
    }
}
