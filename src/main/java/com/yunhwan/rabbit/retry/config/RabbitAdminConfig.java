package com.yunhwan.rabbit.retry.config;

import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RabbitAdminConfig {

    /**
     * 선언은 RetryTopologyProvisioner 가 명시적으로 수행한다.
     * 선언 실패를 삼키지 않도록 ignoreDeclarationExceptions 는 기본값(false) 유지.
     */
    @Bean
    public RabbitAdmin rabbitAdmin(ConnectionFactory connectionFactory) {
        RabbitAdmin admin = new RabbitAdmin(connectionFactory);
        admin.setAutoStartup(false);
        return admin;
    }
}
