package com.yunhwan.rabbit.retry.usecase.retry;

import com.yunhwan.rabbit.retry.domain.retry.RetryDecision;
import com.yunhwan.rabbit.retry.domain.retry.RetryEnvelope;
import com.yunhwan.rabbit.retry.domain.retry.RouteConfig;
import org.springframework.stereotype.Component;

/**
 * RetryDecisionEngine
 * <p>
 * 현재 retryCount 와 route 예산으로 다음 목적지를 결정한다. (부작용 없음)
 * <ul>
 *     <li>retryCount >= maxRetryCount -> DEAD_LETTER, envelope 그대로 (더 이상 증가하지 않음)</li>
 *     <li>그 외 -> DELAY, TTL = delayExpirationMs, retryCount + 1</li>
 * </ul>
 * maxRetryCount=2 이면 delay 왕복 2회 후 세 번째 실패에서 DLQ 로 간다.
 */
@Component
public class RetryDecisionEngine {

    public RetryDecision decide(RetryEnvelope envelope, RouteConfig route) {
        if (envelope.retryCount() >= route.maxRetryCount()) {
            return RetryDecision.ofDeadLetter(envelope);
        }
        return RetryDecision.ofDelay(
                route.delayExpirationMs(),
                envelope.withRetryCount(envelope.retryCount() + 1)
        );
    }
}
