package com.yunhwan.rabbit.retry.domain.retry;

/**
 * route 하나에 선언되는 3단 토폴로지.
 * <p>
 * 선언 순서(instant -> delay -> dead_letter)도 이 enum 순서를 따른다.
 */
public enum RetryTier {

    /** 실제 소비가 일어나는 큐 */
    INSTANT("instant"),
    /** TTL 동안 보관 후 instant exchange로 되돌아가는 대기 큐 */
    DELAY("delay"),
    /** 재시도 예산 소진 후 적재되는 종착 큐 (수동 확인용) */
    DEAD_LETTER("dead_letter");

    private final String value;

    RetryTier(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
