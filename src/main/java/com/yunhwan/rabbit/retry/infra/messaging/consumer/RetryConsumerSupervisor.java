package com.yunhwan.rabbit.retry.infra.messaging.consumer;

import com.yunhwan.rabbit.retry.common.exception.BrokerConnectException;
import com.yunhwan.rabbit.retry.common.exception.ConsumerClosedException;
import com.yunhwan.rabbit.retry.domain.retry.RetryTier;
import com.yunhwan.rabbit.retry.domain.retry.RouteConfig;
import com.yunhwan.rabbit.retry.infra.logging.RetryEventLogger;
import com.yunhwan.rabbit.retry.infra.messaging.rabbit.RabbitRetryProperties;
import com.yunhwan.rabbit.retry.infra.messaging.rabbit.RetryTopologyNames;
import com.yunhwan.rabbit.retry.usecase.retry.port.ConsumerSupervisor;
import com.yunhwan.rabbit.retry.usecase.retry.port.MessageHandler;
import com.yunhwan.rabbit.retry.usecase.retry.port.RetryEnvelopeCodec;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.AsyncConsumerStoppedEvent;
import org.springframework.amqp.rabbit.listener.ConsumeOkEvent;
import org.springframework.amqp.rabbit.listener.ListenerContainerConsumerFailedEvent;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.FixedBackOff;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * route 마다 instant 큐에 consumer 1개를 띄우고 종료를 감시한다.
 * <p>
 * recovery back-off 의 재시도 횟수를 0 으로 두어 consumer 가 죽으면 컨테이너가 멈춘다 (자동 재시작 없음).
 * 종료 이벤트는 error 로그 + {@link ConsumerStatusRegistry} 에 기록한다.
 * <p>
 * 컨테이너 start() 는 consumer 연결 실패에도 정상 반환하므로,
 * 브로커의 consume-ok 를 받아야 기동 성공으로 본다.
 */
@Slf4j
@Component
public class RetryConsumerSupervisor implements ConsumerSupervisor, DisposableBean {

    private static final long RECOVERY_INTERVAL_MS = 5_000L;

    private final ConnectionFactory connectionFactory;
    private final RetryEnvelopeCodec codec;
    private final ConsumerStatusRegistry statusRegistry;
    private final RetryEventLogger eventLogger;
    private final MeterRegistry meterRegistry;
    private final RabbitRetryProperties properties;
    private final List<SimpleMessageListenerContainer> containers = new CopyOnWriteArrayList<>();
    // route -> consume-ok 수신(true) / 기동 중 종료(false)
    private final Map<String, CompletableFuture<Boolean>> startups = new ConcurrentHashMap<>();
    private volatile boolean stopping;

    public RetryConsumerSupervisor(ConnectionFactory connectionFactory,
                                   RetryEnvelopeCodec codec,
                                   ConsumerStatusRegistry statusRegistry,
                                   RetryEventLogger eventLogger,
                                   MeterRegistry meterRegistry,
                                   RabbitRetryProperties properties) {
        this.connectionFactory = connectionFactory;
        this.codec = codec;
        this.statusRegistry = statusRegistry;
        this.eventLogger = eventLogger;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
    }

    @Override
    public void runConsumers(Collection<RouteConfig> routes, MessageHandler handler) {
        for (RouteConfig route : routes) {
            String name = route.route();
            CompletableFuture<Boolean> started = new CompletableFuture<>();
            startups.put(name, started);

            SimpleMessageListenerContainer container = createContainer(name, handler);
            containers.add(container);
            statusRegistry.markRunning(name);

            try {
                container.start();
            } catch (AmqpException e) {
                recordClosed(name, "consumer start failed: " + e.getMessage(), e);
                throw new BrokerConnectException("failed to start consumer. route=" + name, e);
            }

            awaitStarted(name, container, started);
            log.info("[RetryConsumerSupervisor] consumer started. route={}, queue={}, consumerTag={}",
                    name,
                    RetryTopologyNames.queueName(name, RetryTier.INSTANT),
                    RetryTopologyNames.consumerTag(name));
        }
    }

    private void awaitStarted(String route, SimpleMessageListenerContainer container, CompletableFuture<Boolean> started) {
        long timeoutMs = properties.getConnectTimeout().toMillis();
        try {
            if (started.get(timeoutMs, TimeUnit.MILLISECONDS) && container.isRunning() && statusRegistry.isUp(route)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordClosed(route, "interrupted while starting consumer", e);
            container.stop();
            throw new BrokerConnectException("interrupted while starting consumer. route=" + route, e);
        } catch (TimeoutException | ExecutionException e) {
            recordClosed(route, "consumer did not start within " + timeoutMs + "ms", e);
            container.stop();
            throw new BrokerConnectException("consumer start timeout. route=" + route + ", timeoutMs=" + timeoutMs, e);
        }

        recordClosed(route, "consumer stopped during startup", null);
        if (container.isRunning()) {
            container.stop();
        }
        throw new BrokerConnectException("consumer closed during startup. route=" + route, null);
    }

    SimpleMessageListenerContainer createContainer(String route, MessageHandler handler) {
        SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(connectionFactory);
        container.setQueueNames(RetryTopologyNames.queueName(route, RetryTier.INSTANT));
        container.setConcurrentConsumers(1);
        container.setConsumerTagStrategy(queue -> RetryTopologyNames.consumerTag(route));
        container.setAcknowledgeMode(AcknowledgeMode.AUTO);
        container.setDefaultRequeueRejected(false);
        container.setRecoveryBackOff(new FixedBackOff(RECOVERY_INTERVAL_MS, 0));
        container.setApplicationEventPublisher(event -> onContainerEvent(route, event));
        container.setMessageListener(new RetryMessageListener(route, handler, codec, meterRegistry));
        container.afterPropertiesSet();
        return container;
    }

    void onContainerEvent(String route, Object event) {
        if (event instanceof ConsumeOkEvent) {
            completeStartup(route, true);
        } else if (event instanceof ListenerContainerConsumerFailedEvent failed) {
            recordClosed(route, "reason=" + failed.getReason() + ", fatal=" + failed.isFatal(), failed.getThrowable());
        } else if (event instanceof AsyncConsumerStoppedEvent && !stopping) {
            // recovery 시도 소진으로 컨테이너가 스스로 멈춘 경우
            recordClosed(route, "consumer stopped, recovery attempts exhausted", null);
        }
    }

    private void recordClosed(String route, String reason, Throwable cause) {
        ConsumerClosedException closed = new ConsumerClosedException(
                route, "consumer closed. route=" + route + ", " + reason, cause);
        if (statusRegistry.markClosed(closed)) {
            log.error("[RetryConsumerSupervisor] consumer closed. route={}, {}", route, reason, cause);
            eventLogger.consumerClosed(route, reason);
        }
        // 상태 기록이 끝난 뒤에 기동 대기를 깨운다
        completeStartup(route, false);
    }

    private void completeStartup(String route, boolean ok) {
        CompletableFuture<Boolean> started = startups.get(route);
        if (started != null) {
            started.complete(ok);
        }
    }

    List<SimpleMessageListenerContainer> containers() {
        return List.copyOf(containers);
    }

    @Override
    public void destroy() {
        stopping = true;
        for (SimpleMessageListenerContainer container : containers) {
            container.stop();
        }
        containers.clear();
    }
}
