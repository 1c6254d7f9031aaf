package com.yunhwan.rabbit.retry.infra.messaging.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yunhwan.rabbit.retry.common.exception.EnvelopeDecodeException;
import com.yunhwan.rabbit.retry.common.exception.RabbitRetryException;
import com.yunhwan.rabbit.retry.domain.retry.RetryEnvelope;
import com.yunhwan.rabbit.retry.usecase.retry.port.RetryEnvelopeCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * envelope <-> JSON body.
 * <pre>
 * {"value":"base64...","headers":{"x-route":"orders"},"retryCount":1}
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class JacksonRetryEnvelopeCodec implements RetryEnvelopeCodec {

    private final ObjectMapper objectMapper;

    @Override
    public byte[] encode(RetryEnvelope envelope) {
        try {
            return objectMapper.writeValueAsBytes(
                    new EnvelopeBody(envelope.value(), envelope.headers(), envelope.retryCount()));
        } catch (JsonProcessingException e) {
            throw new RabbitRetryException("failed to encode retry envelope. route=" + envelope.route(), e);
        }
    }

    @Override
    public RetryEnvelope decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new EnvelopeDecodeException("empty retry envelope body");
        }
        EnvelopeBody parsed;
        try {
            parsed = objectMapper.readValue(body, EnvelopeBody.class);
        } catch (IOException e) {
            throw new EnvelopeDecodeException("invalid retry envelope json", e);
        }
        if (parsed == null || parsed.value() == null) {
            throw new EnvelopeDecodeException("missing value in retry envelope");
        }
        if (parsed.retryCount() == null || parsed.retryCount() < 0) {
            throw new EnvelopeDecodeException("invalid retryCount in retry envelope. retryCount=" + parsed.retryCount());
        }
        return new RetryEnvelope(parsed.value(), parsed.headers(), parsed.retryCount());
    }

    record EnvelopeBody(byte[] value, Map<String, String> headers, Integer retryCount) {
    }
}
