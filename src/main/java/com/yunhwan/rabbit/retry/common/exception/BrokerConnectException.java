package com.yunhwan.rabbit.retry.common.exception;

/**
 * 기동 시 제한 시간 안에 브로커 연결을 맺지 못한 경우. 기동 실패로 처리한다.
 */
public class BrokerConnectException extends RabbitRetryException {

    public BrokerConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
