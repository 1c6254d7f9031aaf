package com.yunhwan.rabbit.retry.common.exception;

/**
 * 재시도/DLQ 처리 중 발생하는 예외의 공통 부모.
 */
public class RabbitRetryException extends RuntimeException {

    public RabbitRetryException(String message) {
        super(message);
    }

    public RabbitRetryException(String message, Throwable cause) {
        super(message, cause);
    }
}
