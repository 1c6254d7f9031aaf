package com.yunhwan.rabbit.retry.usecase.retry.port;

import com.yunhwan.rabbit.retry.domain.retry.Event;
import com.yunhwan.rabbit.retry.domain.retry.ProcessStatus;

@FunctionalInterface
public interface MessageHandler {
    ProcessStatus handle(Event event);
}
