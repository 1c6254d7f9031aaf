package com.yunhwan.rabbit.retry.usecase.retry.port;

import com.yunhwan.rabbit.retry.domain.retry.RetryEnvelope;
import com.yunhwan.rabbit.retry.domain.retry.RetryTier;

/**
 * 재시도 메시지 발행용 세션.
 * <p>
 * 기동 시 한 번 {@link #start()} 하고 이후 모든 재시도 발행이 공유한다.
 */
public interface RetryPublisher {

    void start();

    boolean isRunning();

    /**
     * @param expiration DELAY 일 때만 사용하는 메시지 만료(ms). DEAD_LETTER 면 null.
     */
    void publish(String route, RetryEnvelope envelope, RetryTier targetTier, String expiration);
}
