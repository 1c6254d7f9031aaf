package com.yunhwan.rabbit.retry.infra.metrics;

public final class MetricsConfig {

    private MetricsConfig() {}

    public static final String METRIC_PUBLISH = "rabbit_retry.publish";
    public static final String METRIC_CONSUME = "rabbit_retry.consume";
    public static final String METRIC_CONSUMER_UP = "rabbit_retry.consumer.up";

    // 고카디널리티 금지(메시지ID/에러메시지 제외)
    public static final String TAG_ROUTE = "route";
    public static final String TAG_TIER = "tier";
    public static final String TAG_RESULT = "result";

    // 고정 결과값(집계 안정성)
    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_NACK = "nack";
    public static final String RESULT_RETURNED = "returned";
    public static final String RESULT_TIMEOUT = "timeout";
    public static final String RESULT_ERROR = "error";
    public static final String RESULT_COMPLETED = "completed";
    public static final String RESULT_RETRY = "retry";
    public static final String RESULT_REJECT = "reject";
}
