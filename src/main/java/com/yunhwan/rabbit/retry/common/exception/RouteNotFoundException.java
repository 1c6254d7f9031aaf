package com.yunhwan.rabbit.retry.common.exception;

public class RouteNotFoundException extends RabbitRetryException {

    public RouteNotFoundException(String message) {
        super(message);
    }
}
