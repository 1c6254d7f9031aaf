package com.yunhwan.rabbit.retry.common.exception;

/**
 * exchange/queue 선언 또는 binding 실패.
 * <p>
 * 같은 이름을 다른 argument 로 재선언하면 브로커가 PRECONDITION_FAILED 를 돌려주며,
 * 이 경우 {@link #isConflict()} 가 true 다. 어느 쪽이든 재시도하지 않는다.
 */
public class TopologyException extends RabbitRetryException {

    private final boolean conflict;

    public TopologyException(String message, boolean conflict, Throwable cause) {
        super(message, cause);
        this.conflict = conflict;
    }

    public boolean isConflict() {
        return conflict;
    }
}
