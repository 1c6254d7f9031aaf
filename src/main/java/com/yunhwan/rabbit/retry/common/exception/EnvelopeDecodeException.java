package com.yunhwan.rabbit.retry.common.exception;

public class EnvelopeDecodeException extends RabbitRetryException {

    public EnvelopeDecodeException(String message) {
        super(message);
    }

    public EnvelopeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
