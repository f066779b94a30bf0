package com.tiklog.delivery.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Redis Pub/Sub 리스너 컨테이너 설정.
 *
 * <p>채널 구독은 여기서 고정하지 않는다. 애플리케이션 기동 후
 * {@code BusSubscriptionRegistrar}가 {@code MessageBus.subscribe()}로 exchange별 리스너를 추가한다.</p>
 */
@Configuration
public class RedisPubSubConfig {

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(
            RedisConnectionFactory connectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        return container;
    }
}
