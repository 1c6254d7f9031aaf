package com.yunhwan.rabbit.retry.usecase.retry;

import com.yunhwan.rabbit.retry.common.exception.RabbitRetryException;
import com.yunhwan.rabbit.retry.common.exception.RouteNotFoundException;
import com.yunhwan.rabbit.retry.domain.retry.Event;
import com.yunhwan.rabbit.retry.domain.retry.ProcessStatus;
import com.yunhwan.rabbit.retry.domain.retry.RetryDecision;
import com.yunhwan.rabbit.retry.domain.retry.RetryEnvelope;
import com.yunhwan.rabbit.retry.domain.retry.RouteConfig;
import com.yunhwan.rabbit.retry.infra.logging.RetryEventLogger;
import com.yunhwan.rabbit.retry.usecase.retry.port.ConsumerSupervisor;
import com.yunhwan.rabbit.retry.usecase.retry.port.MessageHandler;
import com.yunhwan.rabbit.retry.usecase.retry.port.RetryPublisher;
import com.yunhwan.rabbit.retry.usecase.retry.port.TopologyProvisioner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * RabbitRetrier
 * <p>
 * 재시도 흐름의 진입점.
 * 1. {@link #runPublisher()} : 발행 세션 연결 + route 별 토폴로지 선언 (기동 시 1회)
 * 2. {@link #runConsumers(MessageHandler)} : route 별 instant 큐 consumer 기동
 * 3. {@link #retrier(MessageHandler)} : 핸들러가 RETRY 를 반환하면 delay/DLQ 로 재발행하는 미들웨어
 * <p>
 * 재발행 실패는 로그만 남기고 흡수한다. 즉 재시도 경로에서 메시지가 유실될 수 있다 (best-effort).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RabbitRetrier {

    private final RouteRegistry routeRegistry;
    private final RetryDecisionEngine decisionEngine;
    private final RetryPublisher publisher;
    private final TopologyProvisioner topologyProvisioner;
    private final ConsumerSupervisor consumerSupervisor;
    private final RetryEventLogger eventLogger;

    public void runPublisher() {
        publisher.start();
        topologyProvisioner.provision(routeRegistry.all());
    }

    public void runConsumers(MessageHandler handler) {
        consumerSupervisor.runConsumers(routeRegistry.all(), handler);
    }

    public MessageHandler retrier(MessageHandler next) {
        return event -> {
            if (!publisher.isRunning()) {
                throw new IllegalStateException("retry publisher is not running: call runPublisher() first");
            }
            ProcessStatus status = next.handle(event);
            if (status.isRetry()) {
                try {
                    retry(event);
                } catch (RouteNotFoundException e) {
                    log.error("[RabbitRetrier] no route for message, retry skipped. route={}, err={}", event.route(), e.getMessage());
                    eventLogger.routeNotFound(event, e);
                } catch (RabbitRetryException e) {
                    // ack 여부는 원래 status 기준이므로 여기서 전파하지 않는다
                    log.error("[RabbitRetrier] error retrying message. route={}, err={}", event.route(), e.getMessage(), e);
                    eventLogger.publishFailed(event, e);
                }
            }
            return status;
        };
    }

    /**
     * 한 건을 delay 또는 dead_letter 로 재발행한다.
     *
     * @throws RouteNotFoundException route 헤더 누락 또는 미설정 route
     * @throws com.yunhwan.rabbit.retry.common.exception.RetryPublishException 발행 실패
     */
    public RetryDecision retry(Event event) {
        RouteConfig route = routeRegistry.routeOf(event);
        RetryEnvelope envelope = RetryEnvelope.first(event);

        RetryDecision decision = decisionEngine.decide(envelope, route);
        publisher.publish(route.route(), decision.nextEnvelope(), decision.targetTier(), decision.expiration());

        if (decision.isDeadLetter()) {
            log.warn("[RabbitRetrier] DEAD -> dead_letter. route={}, retryCount={}",
                    route.route(), decision.nextEnvelope().retryCount());
            eventLogger.deadLettered(route.route(), decision.nextEnvelope());
        } else {
            log.info("[RabbitRetrier] RETRY -> delay. route={}, nextRetryCount={}, ttlMs={}",
                    route.route(), decision.nextEnvelope().retryCount(), decision.expiration());
            eventLogger.retryScheduled(route.route(), decision.nextEnvelope(), decision.expiration());
        }
        return decision;
    }
}
