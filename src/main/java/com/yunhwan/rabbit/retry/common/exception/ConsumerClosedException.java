package com.yunhwan.rabbit.retry.common.exception;

/**
 * 브로커가 consumer 를 예기치 않게 닫은 경우. 자동 재시작은 하지 않는다.
 */
public class ConsumerClosedException extends RabbitRetryException {

    private final String route;

    public ConsumerClosedException(String route, String message, Throwable cause) {
        super(message, cause);
        this.route = route;
    }

    public String getRoute() {
        return route;
    }
}
