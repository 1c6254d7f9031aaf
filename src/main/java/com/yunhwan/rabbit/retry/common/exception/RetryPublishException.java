package com.yunhwan.rabbit.retry.common.exception;

/**
 * 재시도 재발행 실패 (NACK, 라우팅 실패, confirm timeout, 채널 오류 등).
 * 호출 측에서 로그만 남기고 흡수한다.
 */
public class RetryPublishException extends RabbitRetryException {

    public RetryPublishException(String message) {
        super(message);
    }

    public RetryPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
