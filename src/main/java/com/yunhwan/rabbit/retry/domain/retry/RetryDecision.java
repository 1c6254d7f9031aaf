package com.yunhwan.rabbit.retry.domain.retry;

/**
 * 재시도 판단 결과.
 *
 * @param targetTier   DELAY 또는 DEAD_LETTER
 * @param expiration   DELAY 일 때만 값이 있다 (ms 문자열)
 * @param nextEnvelope 다음에 발행할 envelope
 */
public record RetryDecision(RetryTier targetTier, String expiration, RetryEnvelope nextEnvelope) {

    public static RetryDecision ofDelay(String expiration, RetryEnvelope nextEnvelope) {
        return new RetryDecision(RetryTier.DELAY, expiration, nextEnvelope);
    }

    public static RetryDecision ofDeadLetter(RetryEnvelope envelope) {
        return new RetryDecision(RetryTier.DEAD_LETTER, null, envelope);
    }

    public boolean isDeadLetter() { return targetTier == RetryTier.DEAD_LETTER; }
    public boolean isDelay() { return targetTier == RetryTier.DELAY; }
}
