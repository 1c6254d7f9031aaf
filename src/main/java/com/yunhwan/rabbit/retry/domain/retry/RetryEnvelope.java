package com.yunhwan.rabbit.retry.domain.retry;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 재발행 사이에 retry count 를 운반하는 envelope.
 * <p>
 * 원본 값과 헤더를 그대로 보존하고, retryCount 는 같은 메시지에 대해 감소하지 않는다.
 * 처음 실패한 메시지는 {@link #first(Event)} 로 retryCount=0 envelope 를 만든다.
 */
public record RetryEnvelope(byte[] value, Map<String, String> headers, int retryCount) implements Event {

    public RetryEnvelope {
        Objects.requireNonNull(value, "value");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0. retryCount=" + retryCount);
        }
        headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static RetryEnvelope first(Event event) {
        if (event instanceof RetryEnvelope envelope) {
            return envelope;
        }
        return new RetryEnvelope(event.value(), event.headers(), 0);
    }

    public RetryEnvelope withRetryCount(int nextRetryCount) {
        return new RetryEnvelope(value, headers, nextRetryCount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryEnvelope that)) return false;
        return retryCount == that.retryCount
                && Arrays.equals(value, that.value)
                && headers.equals(that.headers);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(headers, retryCount);
        return 31 * result + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "RetryEnvelope[valueLength=" + value.length
                + ", headers=" + headers
                + ", retryCount=" + retryCount + "]";
    }
}
