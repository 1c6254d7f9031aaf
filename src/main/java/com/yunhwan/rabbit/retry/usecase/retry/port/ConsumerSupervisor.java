package com.yunhwan.rabbit.retry.usecase.retry.port;

import com.yunhwan.rabbit.retry.domain.retry.RouteConfig;

import java.util.Collection;

public interface ConsumerSupervisor {
    void runConsumers(Collection<RouteConfig> routes, MessageHandler handler);
}
