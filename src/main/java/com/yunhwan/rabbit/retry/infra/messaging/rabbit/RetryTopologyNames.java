package com.yunhwan.rabbit.retry.infra.messaging.rabbit;

import com.yunhwan.rabbit.retry.domain.retry.RetryTier;

/**
 * route + tier -> exchange/queue 이름.
 * <p>
 * 이름은 재기동해도 같아야 한다 (같은 이름/argument 재선언이어야 멱등).
 * tier 접미사(".instant.", ".delay.", ".dead_letter.")가 서로의 접미사가 아니므로
 * 서로 다른 (route, tier) 쌍이 같은 이름을 갖지 않는다.
 * <pre>
 * orders.instant.exchange / orders.instant.queue
 * orders.delay.exchange   / orders.delay.queue   (x-dead-letter-exchange = orders.instant.exchange)
 * orders.dead_letter.exchange / orders.dead_letter.queue
 * </pre>
 */
public final class RetryTopologyNames {

    private static final String EXCHANGE_SUFFIX = "exchange";
    private static final String QUEUE_SUFFIX = "queue";
    private static final String CONSUMER_TAG_SUFFIX = "_retry_ctag";

    private RetryTopologyNames() {}

    public static String exchangeName(String route, RetryTier tier) {
        return route + "." + tier.value() + "." + EXCHANGE_SUFFIX;
    }

    public static String queueName(String route, RetryTier tier) {
        return route + "." + tier.value() + "." + QUEUE_SUFFIX;
    }

    public static String consumerTag(String route) {
        return queueName(route, RetryTier.INSTANT) + CONSUMER_TAG_SUFFIX;
    }
}
