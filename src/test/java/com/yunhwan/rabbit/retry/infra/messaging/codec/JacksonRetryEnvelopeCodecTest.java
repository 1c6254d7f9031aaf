package com.yunhwan.rabbit.retry.infra.messaging.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yunhwan.rabbit.retry.common.exception.EnvelopeDecodeException;
import com.yunhwan.rabbit.retry.domain.retry.Event;
import com.yunhwan.rabbit.retry.domain.retry.RetryEnvelope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonRetryEnvelopeCodecTest {

    private final JacksonRetryEnvelopeCodec codec = new JacksonRetryEnvelopeCodec(new ObjectMapper());

    @Test
    @DisplayName("encode 후 decode 하면 값/헤더/retryCount 가 그대로 복원된다")
    void 왕복_복원() {
        // Given: 바이너리 값 + route 헤더
        RetryEnvelope envelope = new RetryEnvelope(
                new byte[]{0, 1, 2, (byte) 0xFF, 'x'},
                Map.of(Event.HEADER_ROUTE, "orders", "trace-id", "abc-123"),
                2
        );

        // When
        RetryEnvelope decoded = codec.decode(codec.encode(envelope));

        // Then
        assertThat(decoded).isEqualTo(envelope);
        assertThat(decoded.route()).isEqualTo("orders");
    }

    @Test
    @DisplayName("빈 값과 빈 헤더도 복원된다")
    void 빈_값_복원() {
        RetryEnvelope envelope = new RetryEnvelope(new byte[0], Map.of(), 0);

        assertThat(codec.decode(codec.encode(envelope))).isEqualTo(envelope);
    }

    @Test
    @DisplayName("JSON 이 아닌 body 는 EnvelopeDecodeException")
    void 잘못된_body() {
        byte[] body = "plain text log".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.decode(body))
                .isInstanceOf(EnvelopeDecodeException.class);
    }

    @Test
    @DisplayName("value 누락 / 음수 retryCount / 빈 body 는 EnvelopeDecodeException")
    void 계약_위반_body() {
        assertThatThrownBy(() -> codec.decode("{\"headers\":{},\"retryCount\":1}".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(EnvelopeDecodeException.class)
                .hasMessageContaining("missing value");

        assertThatThrownBy(() -> codec.decode("{\"value\":\"AA==\",\"retryCount\":-1}".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(EnvelopeDecodeException.class)
                .hasMessageContaining("retryCount");

        assertThatThrownBy(() -> codec.decode(new byte[0]))
                .isInstanceOf(EnvelopeDecodeException.class);
    }
}
