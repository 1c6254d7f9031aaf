package com.yunhwan.rabbit.retry.infra.messaging.rabbit;

import com.yunhwan.rabbit.retry.common.exception.BrokerConnectException;
import com.yunhwan.rabbit.retry.common.exception.RetryPublishException;
import com.yunhwan.rabbit.retry.domain.retry.Event;
import com.yunhwan.rabbit.retry.domain.retry.RetryEnvelope;
import com.yunhwan.rabbit.retry.domain.retry.RetryTier;
import com.yunhwan.rabbit.retry.infra.metrics.MetricsConfig;
import com.yunhwan.rabbit.retry.usecase.retry.port.RetryEnvelopeCodec;
import com.yunhwan.rabbit.retry.usecase.retry.port.RetryPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.ReturnedMessage;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 재시도 메시지를 delay / dead_letter exchange 로 발행하는 세션.
 * <p>
 * 연결은 CachingConnectionFactory 의 publisher 전용 연결 하나를 모든 재시도가 공유하고,
 * 발행 1건마다 캐시된 채널을 빌려 쓰고 반납한다 (RabbitTemplate 이 실패 시에도 반납 보장).
 * 단순 전송이 아니라 Publisher Confirm(Ack/Nack)과 Return 을 확인한 뒤 성공으로 본다.
 */
@Slf4j
@Component
public class RabbitRetryPublisher implements RetryPublisher {

    private final RabbitTemplate rabbitTemplate;
    private final RetryEnvelopeCodec codec;
    private final RabbitRetryProperties properties;
    private final MeterRegistry meterRegistry;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RabbitRetryPublisher(RabbitTemplate rabbitTemplate,
                                RetryEnvelopeCodec codec,
                                RabbitRetryProperties properties,
                                MeterRegistry meterRegistry) {
        this.rabbitTemplate = rabbitTemplate;
        this.codec = codec;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void start() {
        ConnectionFactory connectionFactory = publisherConnectionFactory();
        long timeoutMs = properties.getConnectTimeout().toMillis();
        log.info("[RabbitRetryPublisher] dialing rabbitmq server. host={}, port={}, timeoutMs={}",
                connectionFactory.getHost(), connectionFactory.getPort(), timeoutMs);

        try {
            Connection connection = CompletableFuture
                    .supplyAsync(connectionFactory::createConnection)
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
            if (!connection.isOpen()) {
                throw new BrokerConnectException("publisher connection is not open", null);
            }
        } catch (TimeoutException e) {
            throw new BrokerConnectException("rabbitmq connect timeout. timeoutMs=" + timeoutMs, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerConnectException("interrupted while connecting to rabbitmq", e);
        } catch (ExecutionException e) {
            throw new BrokerConnectException("failed to connect to rabbitmq. err=" + e.getCause().getMessage(), e.getCause());
        }

        running.set(true);
        log.info("[RabbitRetryPublisher] publisher session started.");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void publish(String route, RetryEnvelope envelope, RetryTier targetTier, String expiration) {
        String exchange = RetryTopologyNames.exchangeName(route, targetTier);
        String tier = targetTier.value();

        MessageProperties props = new MessageProperties();
        props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        props.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        props.setHeader(Event.HEADER_ROUTE, route);
        props.setHeader(RetryHeaders.RETRY_COUNT, envelope.retryCount());
        props.setHeader(RetryHeaders.ENVELOPE, RetryHeaders.ENVELOPE_VERSION);
        if (targetTier == RetryTier.DELAY) {
            props.setExpiration(expiration);
        }

        Message message = new Message(codec.encode(envelope), props);

        // CorrelationData 생성: 비동기 응답(Ack/Nack) 및 Return 추적
        CorrelationData cd = new CorrelationData("retry-" + route + "-" + UUID.randomUUID());
        props.setCorrelationId(cd.getId());

        try {
            rabbitTemplate.send(exchange, "", message, cd);

            CorrelationData.Confirm confirm = cd.getFuture()
                    .get(properties.getConfirmTimeout().toMillis(), TimeUnit.MILLISECONDS);

            if (!confirm.isAck()) {
                publishCounter(route, tier, MetricsConfig.RESULT_NACK).increment();
                throw new RetryPublishException("Broker NACK. exchange=" + exchange + ", reason=" + confirm.getReason());
            }

            // Return 은 Ack 보다 먼저 도착하므로 Ack 시점에 존재하면 라우팅 실패
            ReturnedMessage returned = cd.getReturned();
            if (returned != null) {
                publishCounter(route, tier, MetricsConfig.RESULT_RETURNED).increment();
                throw new RetryPublishException("Routing failed. exchange=" + exchange + ", replyCode=" + returned.getReplyCode());
            }

            log.debug("[RabbitRetryPublisher] Publish SUCCESS. exchange={}, retryCount={}", exchange, envelope.retryCount());
            publishCounter(route, tier, MetricsConfig.RESULT_SUCCESS).increment();

        } catch (TimeoutException e) {
            publishCounter(route, tier, MetricsConfig.RESULT_TIMEOUT).increment();
            throw new RetryPublishException("Confirm timeout. exchange=" + exchange, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            publishCounter(route, tier, MetricsConfig.RESULT_ERROR).increment();
            throw new RetryPublishException("Interrupted while waiting confirm. exchange=" + exchange, e);
        } catch (ExecutionException | AmqpException e) {
            publishCounter(route, tier, MetricsConfig.RESULT_ERROR).increment();
            throw new RetryPublishException("Publish ERROR. exchange=" + exchange + ", err=" + e.getMessage(), e);
        }
    }

    private ConnectionFactory publisherConnectionFactory() {
        ConnectionFactory connectionFactory = rabbitTemplate.getConnectionFactory();
        ConnectionFactory publisherFactory = connectionFactory.getPublisherConnectionFactory();
        return publisherFactory != null ? publisherFactory : connectionFactory;
    }

    private Counter publishCounter(String route, String tier, String result) {
        return Counter.builder(MetricsConfig.METRIC_PUBLISH)
                .tag(MetricsConfig.TAG_ROUTE, route)
                .tag(MetricsConfig.TAG_TIER, tier)
                .tag(MetricsConfig.TAG_RESULT, result)
                .register(meterRegistry);
    }
}
