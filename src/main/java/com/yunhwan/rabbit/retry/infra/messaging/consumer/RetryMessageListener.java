package com.yunhwan.rabbit.retry.infra.messaging.consumer;

import com.yunhwan.rabbit.retry.common.exception.EnvelopeDecodeException;
import com.yunhwan.rabbit.retry.domain.retry.Event;
import com.yunhwan.rabbit.retry.domain.retry.InboundEvent;
import com.yunhwan.rabbit.retry.domain.retry.ProcessStatus;
import com.yunhwan.rabbit.retry.infra.messaging.rabbit.RetryHeaders;
import com.yunhwan.rabbit.retry.infra.metrics.MetricsConfig;
import com.yunhwan.rabbit.retry.usecase.retry.port.MessageHandler;
import com.yunhwan.rabbit.retry.usecase.retry.port.RetryEnvelopeCodec;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageListener;

import java.util.Map;

/**
 * instant 큐 메시지를 Event 로 바꿔 핸들러에 위임한다.
 * <p>
 * - x-retry-envelope 헤더 없음: 첫 시도. 원본 body/헤더 그대로 (retryCount=0)
 * - 헤더 있음: envelope 로 decode. 실패하면 retryCount 를 0 으로 되돌리지 않고 reject(drop)
 * <p>
 * 처리 결과(COMPLETED/RETRY)와 관계없이 ack 한다. RETRY 는 미들웨어가 이미 재발행했다.
 */
@Slf4j
public class RetryMessageListener implements MessageListener {

    private final String route;
    private final MessageHandler handler;
    private final RetryEnvelopeCodec codec;
    private final MeterRegistry meterRegistry;

    public RetryMessageListener(String route, MessageHandler handler, RetryEnvelopeCodec codec, MeterRegistry meterRegistry) {
        this.route = route;
        this.handler = handler;
        this.codec = codec;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onMessage(Message message) {
        Event event;
        try {
            event = toEvent(message);
        } catch (EnvelopeDecodeException e) {
            log.error("[RetryConsumer] invalid retry envelope -> reject. route={}, err={}", route, e.getMessage());
            consumeCounter(MetricsConfig.RESULT_REJECT).increment();
            throw new AmqpRejectAndDontRequeueException("invalid retry envelope. route=" + route, e);
        }

        ProcessStatus status;
        try {
            status = handler.handle(event);
        } catch (RuntimeException e) {
            log.error("[RetryConsumer] handler FAILED -> reject. route={}, err={}", route, e.getMessage(), e);
            consumeCounter(MetricsConfig.RESULT_REJECT).increment();
            throw new AmqpRejectAndDontRequeueException("handler failed. route=" + route, e);
        }

        consumeCounter(status.isRetry() ? MetricsConfig.RESULT_RETRY : MetricsConfig.RESULT_COMPLETED).increment();
    }

    Event toEvent(Message message) {
        Map<String, Object> headers = message.getMessageProperties().getHeaders();
        if (RetryHeaders.isEnvelope(headers)) {
            return codec.decode(message.getBody());
        }
        return new InboundEvent(message.getBody(), RetryHeaders.toEventHeaders(headers));
    }

    private Counter consumeCounter(String result) {
        return Counter.builder(MetricsConfig.METRIC_CONSUME)
                .tag(MetricsConfig.TAG_ROUTE, route)
                .tag(MetricsConfig.TAG_RESULT, result)
                .register(meterRegistry);
    }
}
