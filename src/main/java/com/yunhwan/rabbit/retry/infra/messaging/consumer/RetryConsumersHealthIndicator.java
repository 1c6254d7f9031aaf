package com.yunhwan.rabbit.retry.infra.messaging.consumer;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class RetryConsumersHealthIndicator implements HealthIndicator {

    private final ConsumerStatusRegistry statusRegistry;

    @Override
    public Health health() {
        Map<String, ConsumerStatusRegistry.ConsumerStatus> snapshot = statusRegistry.snapshot();
        boolean allUp = snapshot.values().stream().allMatch(ConsumerStatusRegistry.ConsumerStatus::isUp);
        Health.Builder builder = allUp ? Health.up() : Health.down();
        snapshot.forEach((route, status) -> builder.withDetail(route, status));
        return builder.build();
    }
}
