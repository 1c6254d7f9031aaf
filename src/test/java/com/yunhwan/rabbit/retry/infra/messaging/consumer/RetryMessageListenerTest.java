package com.yunhwan.rabbit.retry.infra.messaging.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yunhwan.rabbit.retry.domain.retry.Event;
import com.yunhwan.rabbit.retry.domain.retry.InboundEvent;
import com.yunhwan.rabbit.retry.domain.retry.ProcessStatus;
import com.yunhwan.rabbit.retry.domain.retry.RetryEnvelope;
import com.yunhwan.rabbit.retry.infra.messaging.codec.JacksonRetryEnvelopeCodec;
import com.yunhwan.rabbit.retry.infra.messaging.rabbit.RetryHeaders;
import com.yunhwan.rabbit.retry.infra.metrics.MetricsConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryMessageListenerTest {

    private final JacksonRetryEnvelopeCodec codec = new JacksonRetryEnvelopeCodec(new ObjectMapper());
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final List<Event> received = new CopyOnWriteArrayList<>();

    @Test
    @DisplayName("envelope 헤더가 없으면 첫 시도: 원본 body/헤더 그대로 전달")
    void 첫_시도_메시지() {
        RetryMessageListener listener = listener(ProcessStatus.COMPLETED);
        MessageProperties props = new MessageProperties();
        props.setHeader(Event.HEADER_ROUTE, "orders");
        props.setHeader("trace-id", "t-1".getBytes(StandardCharsets.UTF_8));

        listener.onMessage(new Message("hello".getBytes(StandardCharsets.UTF_8), props));

        assertThat(received).hasSize(1);
        Event event = received.get(0);
        assertThat(event).isInstanceOf(InboundEvent.class);
        assertThat(event.value()).isEqualTo("hello".getBytes(StandardCharsets.UTF_8));
        assertThat(event.headers()).containsEntry(Event.HEADER_ROUTE, "orders").containsEntry("trace-id", "t-1");
        assertThat(consumeCount(MetricsConfig.RESULT_COMPLETED)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("envelope 헤더가 있으면 decode 한 envelope(retryCount 유지)를 전달")
    void 재시도_메시지() {
        RetryMessageListener listener = listener(ProcessStatus.RETRY);
        RetryEnvelope envelope = new RetryEnvelope(
                "hello".getBytes(StandardCharsets.UTF_8), Map.of(Event.HEADER_ROUTE, "orders"), 2);
        MessageProperties props = new MessageProperties();
        props.setHeader(RetryHeaders.ENVELOPE, RetryHeaders.ENVELOPE_VERSION);
        props.setHeader(RetryHeaders.RETRY_COUNT, 2);

        listener.onMessage(new Message(codec.encode(envelope), props));

        assertThat(received).containsExactly(envelope);
        assertThat(consumeCount(MetricsConfig.RESULT_RETRY)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("envelope 헤더가 있는데 decode 실패면 retryCount 를 초기화하지 않고 reject")
    void 깨진_envelope() {
        RetryMessageListener listener = listener(ProcessStatus.COMPLETED);
        MessageProperties props = new MessageProperties();
        props.setHeader(RetryHeaders.ENVELOPE, RetryHeaders.ENVELOPE_VERSION);

        assertThatThrownBy(() -> listener.onMessage(new Message("{broken".getBytes(StandardCharsets.UTF_8), props)))
                .isInstanceOf(AmqpRejectAndDontRequeueException.class);
        assertThat(received).isEmpty();
        assertThat(consumeCount(MetricsConfig.RESULT_REJECT)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("핸들러 예외는 requeue 없이 reject")
    void 핸들러_예외() {
        RetryMessageListener listener = new RetryMessageListener("orders", event -> {
            throw new IllegalStateException("boom");
        }, codec, meterRegistry);

        assertThatThrownBy(() -> listener.onMessage(new Message(new byte[]{1}, new MessageProperties())))
                .isInstanceOf(AmqpRejectAndDontRequeueException.class)
                .hasRootCauseInstanceOf(IllegalStateException.class);
    }

    private RetryMessageListener listener(ProcessStatus status) {
        return new RetryMessageListener("orders", event -> {
            received.add(event);
            return status;
        }, codec, meterRegistry);
    }

    private double consumeCount(String result) {
        return meterRegistry.get(MetricsConfig.METRIC_CONSUME)
                .tag(MetricsConfig.TAG_ROUTE, "orders")
                .tag(MetricsConfig.TAG_RESULT, result)
                .counter()
                .count();
    }
}
