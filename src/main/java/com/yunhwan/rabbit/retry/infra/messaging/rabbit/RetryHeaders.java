package com.yunhwan.rabbit.retry.infra.messaging.rabbit;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

public final class RetryHeaders {

    public static final String RETRY_COUNT = "x-retry-count";
    public static final String ENVELOPE = "x-retry-envelope";
    public static final String ENVELOPE_VERSION = "v1";

    private RetryHeaders() {}

    public static boolean isEnvelope(Map<String, Object> headers) {
        return headers != null && headers.get(ENVELOPE) != null;
    }

    /**
     * AMQP 헤더(Object 값)를 Event 헤더(String 값)로 변환한다.
     * byte[] 는 UTF-8 문자열로, null 값은 제외한다.
     */
    public static Map<String, String> toEventHeaders(Map<String, Object> headers) {
        Map<String, String> m = new LinkedHashMap<>();
        if (headers == null) {
            return m;
        }
        headers.forEach((k, v) -> {
            if (v instanceof byte[] bytes) {
                m.put(k, new String(bytes, StandardCharsets.UTF_8));
            } else if (v != null) {
                m.put(k, String.valueOf(v));
            }
        });
        return m;
    }
}
