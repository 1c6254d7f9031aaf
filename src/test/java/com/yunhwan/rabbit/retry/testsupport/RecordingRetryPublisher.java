package com.yunhwan.rabbit.retry.testsupport;

import com.yunhwan.rabbit.retry.common.exception.RetryPublishException;
import com.yunhwan.rabbit.retry.domain.retry.RetryEnvelope;
import com.yunhwan.rabbit.retry.domain.retry.RetryTier;
import com.yunhwan.rabbit.retry.usecase.retry.port.RetryPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 브로커 없이 발행 내역만 기록하는 테스트용 RetryPublisher.
 */
public class RecordingRetryPublisher implements RetryPublisher {

    public record Published(String route, RetryEnvelope envelope, RetryTier tier, String expiration) {}

    private final List<Published> published = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean failNext = new AtomicBoolean(false);

    @Override
    public void start() {
        running.set(true);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void publish(String route, RetryEnvelope envelope, RetryTier targetTier, String expiration) {
        if (failNext.getAndSet(false)) {
            throw new RetryPublishException("TEST_FAIL");
        }
        published.add(new Published(route, envelope, targetTier, expiration));
    }

    public void failNextPublish() {
        failNext.set(true);
    }

    public List<Published> published() {
        return List.copyOf(published);
    }
}
