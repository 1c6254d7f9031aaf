package com.yunhwan.rabbit.retry.testsupport;

import com.yunhwan.rabbit.retry.domain.retry.Event;
import com.yunhwan.rabbit.retry.domain.retry.ProcessStatus;
import com.yunhwan.rabbit.retry.domain.retry.RetryEnvelope;
import com.yunhwan.rabbit.retry.usecase.retry.port.MessageHandler;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 통합 테스트용 핸들러. 첫 N번은 RETRY, 이후 COMPLETED 를 반환하고
 * 매 호출의 retryCount 를 기록한다.
 */
public class StubMessageHandler implements MessageHandler {

    private final AtomicInteger retryRemaining = new AtomicInteger(0);
    private final List<Integer> observedRetryCounts = new CopyOnWriteArrayList<>();

    @Override
    public ProcessStatus handle(Event event) {
        observedRetryCounts.add(event instanceof RetryEnvelope envelope ? envelope.retryCount() : 0);
        if (retryRemaining.get() > 0) {
            retryRemaining.decrementAndGet();
            return ProcessStatus.RETRY;
        }
        return ProcessStatus.COMPLETED;
    }

    public void retryFirst(int n) {
        retryRemaining.set(n);
    }

    public List<Integer> observedRetryCounts() {
        return List.copyOf(observedRetryCounts);
    }

    public void reset() {
        retryRemaining.set(0);
        observedRetryCounts.clear();
    }
}
