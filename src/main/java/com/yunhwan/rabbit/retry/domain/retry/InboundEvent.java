package com.yunhwan.rabbit.retry.domain.retry;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 아직 envelope 로 감싸지지 않은(첫 시도) 메시지.
 */
public record InboundEvent(byte[] value, Map<String, String> headers) implements Event {

    public InboundEvent {
        Objects.requireNonNull(value, "value");
        headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InboundEvent that)) return false;
        return Arrays.equals(value, that.value) && headers.equals(that.headers);
    }

    @Override
    public int hashCode() {
        return 31 * headers.hashCode() + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "InboundEvent[valueLength=" + value.length + ", headers=" + headers + "]";
    }
}
