package com.yunhwan.rabbit.retry.infra.messaging.rabbit;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.ShutdownSignalException;
import com.yunhwan.rabbit.retry.common.exception.TopologyException;
import com.yunhwan.rabbit.retry.domain.retry.RetryTier;
import com.yunhwan.rabbit.retry.domain.retry.RouteConfig;
import com.yunhwan.rabbit.retry.usecase.retry.port.TopologyProvisioner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.FanoutExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * route 별 3단 토폴로지(instant / delay / dead_letter)를 선언한다.
 * <p>
 * - exchange: fanout, durable
 * - queue: durable, non-exclusive, non-auto-delete
 * - delay 큐만 x-dead-letter-exchange = instant exchange (TTL 만료 시 브로커가 instant 로 되돌림)
 * <p>
 * 선언/바인딩 하나라도 실패하면 즉시 중단한다. 이미 만든 것은 되돌리지 않는다.
 * argument 가 같으면 재선언은 멱등이다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryTopologyProvisioner implements TopologyProvisioner {

    static final String ARG_DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";

    private final AmqpAdmin amqpAdmin;

    @Override
    public void provision(Collection<RouteConfig> routes) {
        for (Declarable declarable : topologyFor(routes).getDeclarables()) {
            if (declarable instanceof Exchange exchange) {
                declare("exchange", exchange.getName(), () -> amqpAdmin.declareExchange(exchange));
            } else if (declarable instanceof Queue queue) {
                declare("queue", queue.getName(), () -> amqpAdmin.declareQueue(queue));
            } else if (declarable instanceof Binding binding) {
                declare("binding", binding.getDestination() + "->" + binding.getExchange(),
                        () -> amqpAdmin.declareBinding(binding));
            }
        }
        log.info("[RetryTopologyProvisioner] topology provisioned. routes={}",
                routes.stream().map(RouteConfig::route).toList());
    }

    /**
     * 선언 대상만 계산한다 (브로커 호출 없음).
     * route 마다 tier 순서대로 exchange -> queue -> binding.
     */
    public Declarables topologyFor(Collection<RouteConfig> routes) {
        List<Declarable> declarables = new ArrayList<>();
        for (RouteConfig route : routes) {
            for (RetryTier tier : RetryTier.values()) {
                FanoutExchange exchange = exchange(route.route(), tier);
                Queue queue = queue(route.route(), tier);
                declarables.add(exchange);
                declarables.add(queue);
                declarables.add(BindingBuilder.bind(queue).to(exchange));
            }
        }
        return new Declarables(declarables);
    }

    static FanoutExchange exchange(String route, RetryTier tier) {
        return new FanoutExchange(RetryTopologyNames.exchangeName(route, tier), true, false);
    }

    static Queue queue(String route, RetryTier tier) {
        QueueBuilder builder = QueueBuilder.durable(RetryTopologyNames.queueName(route, tier));
        if (tier == RetryTier.DELAY) {
            builder.withArgument(ARG_DEAD_LETTER_EXCHANGE, RetryTopologyNames.exchangeName(route, RetryTier.INSTANT));
        }
        return builder.build();
    }

    private void declare(String kind, String name, Runnable declaration) {
        try {
            declaration.run();
        } catch (AmqpException e) {
            boolean conflict = isConflict(e);
            log.error("[RetryTopologyProvisioner] declare FAILED. kind={}, name={}, conflict={}, err={}",
                    kind, name, conflict, e.getMessage());
            throw new TopologyException(
                    "failed to declare " + kind + ". name=" + name + (conflict ? " (PRECONDITION_FAILED)" : ""),
                    conflict,
                    e
            );
        }
    }

    /**
     * 같은 이름을 다른 argument 로 재선언하면 브로커가 406 으로 채널을 닫는다.
     */
    static boolean isConflict(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ShutdownSignalException sse
                    && sse.getReason() instanceof AMQP.Channel.Close close) {
                return close.getReplyCode() == AMQP.PRECONDITION_FAILED;
            }
        }
        return false;
    }
}
