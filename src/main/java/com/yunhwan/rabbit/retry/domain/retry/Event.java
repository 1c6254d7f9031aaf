package com.yunhwan.rabbit.retry.domain.retry;

import java.util.Map;

/**
 * 핸들러에 전달되는 메시지 (값 + 헤더).
 * <p>
 * 모든 메시지는 {@link #HEADER_ROUTE} 헤더에 route 이름을 가져야 한다.
 * 이 헤더가 없거나 바뀌면 재시도 라우팅이 불가능하다.
 */
public interface Event {

    String HEADER_ROUTE = "x-route";

    byte[] value();

    Map<String, String> headers();

    default String route() {
        Map<String, String> headers = headers();
        return headers == null ? null : headers.get(HEADER_ROUTE);
    }
}
