package com.yunhwan.rabbit.retry.app;

import com.yunhwan.rabbit.retry.usecase.retry.RabbitRetrier;
import com.yunhwan.rabbit.retry.usecase.retry.port.MessageHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 기동 순서: publisher 연결 + 토폴로지 선언 -> (핸들러가 있으면) route 별 consumer 기동.
 * 여기서 발생한 예외는 그대로 전파되어 애플리케이션 기동을 중단시킨다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "rabbit-retry", name = "auto-start", havingValue = "true", matchIfMissing = true)
public class RetryStartupRunner implements ApplicationRunner {

    private final RabbitRetrier rabbitRetrier;
    private final ObjectProvider<MessageHandler> handlerProvider;

    @Override
    public void run(ApplicationArguments args) {
        rabbitRetrier.runPublisher();

        MessageHandler handler = handlerProvider.getIfUnique();
        if (handler == null) {
            log.warn("[RetryStartupRunner] no unique MessageHandler bean -> consumers not started");
            return;
        }
        rabbitRetrier.runConsumers(rabbitRetrier.retrier(handler));
    }
}
