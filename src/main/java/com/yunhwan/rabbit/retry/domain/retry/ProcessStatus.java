package com.yunhwan.rabbit.retry.domain.retry;

/**
 * 핸들러 처리 결과. 이 두 값 외에는 해석하지 않는다.
 */
public enum ProcessStatus {
    COMPLETED,
    RETRY;

    public boolean isRetry() {
        return this == RETRY;
    }
}
