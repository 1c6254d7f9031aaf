package com.yunhwan.rabbit.retry.config;

import com.yunhwan.rabbit.retry.infra.messaging.rabbit.RabbitRetryProperties;
import com.yunhwan.rabbit.retry.usecase.retry.RouteRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RabbitRetryConfig {

    @Bean
    public RouteRegistry routeRegistry(RabbitRetryProperties properties) {
        return new RouteRegistry(properties.toRouteConfigs());
    }

    @Bean
    public Clock utcClock() {
        return Clock.systemUTC();
    }
}
