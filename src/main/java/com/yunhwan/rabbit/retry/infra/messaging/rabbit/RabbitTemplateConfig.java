package com.yunhwan.rabbit.retry.infra.messaging.rabbit;

import com.yunhwan.rabbit.retry.domain.retry.Event;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.amqp.RabbitTemplateCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class RabbitTemplateConfig {

    /**
     * RabbitTemplate 전역 설정
     * - usePublisherConnection: true (재발행은 consumer 와 다른 전용 연결 사용)
     * - mandatory: true (라우팅 실패 시 Return 콜백 수신)
     * - ReturnsCallback: 라우팅 실패 시 로그 기록
     */
    @Bean
    public RabbitTemplateCustomizer rabbitTemplateCustomizer() {
        return template -> {
            template.setUsePublisherConnection(true);
            template.setMandatory(true);
            template.setReturnsCallback(returned -> {
                var props = returned.getMessage().getMessageProperties();
                log.warn("[RabbitTemplate] Message RETURNED (Routing Failed). route={}, correlationId={}, replyCode={}, replyText={}, exchange={}",
                        props.getHeaders().get(Event.HEADER_ROUTE),
                        props.getCorrelationId(),
                        returned.getReplyCode(),
                        returned.getReplyText(),
                        returned.getExchange()
                );
            });
        };
    }
}
