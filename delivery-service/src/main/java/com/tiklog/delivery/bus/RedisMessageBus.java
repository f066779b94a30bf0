package com.tiklog.delivery.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tiklog.common.exception.BusinessException;
import com.tiklog.common.exception.ErrorCode;
import com.tiklog.delivery.metrics.DispatchMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Redis Pub/Sub 기반 메시지 버스.
 *
 * <p>exchange 하나가 Redis 채널 하나에 대응한다. PUBLISH는 해당 채널을 구독 중인
 * 모든 인스턴스에 전달되므로 fanout exchange와 같은 의미를 갖는다.</p>
 *
 * <h3>동작 흐름</h3>
 * <pre>
 * publish: payload → BusMessage(봉투, expiresAt) → JSON → PUBLISH {exchange}
 * 수신:    SUBSCRIBE {exchange} → BusMessageListener → 만료 검사 → handler
 * </pre>
 *
 * <h3>메시지 만료</h3>
 * <p>package_request는 {@code tiklog.dispatch.request-expiration} 동안만 유효하다.
 * 리스너 컨테이너의 실행 큐에 오래 머문 메시지는 소비 시점에 버려진다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisMessageBus implements MessageBus {

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final DispatchMetrics metrics;

    @Override
    public void connect() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
            log.info("Message bus connected: {}", pong);
        } catch (DataAccessException e) {
            log.error("Message bus connection failed", e);
            throw new BusinessException(ErrorCode.BROKER_UNAVAILABLE,
                    "Failed to connect to message broker", e);
        }
        if (!listenerContainer.isRunning()) {
            listenerContainer.start();
        }
    }

    @Override
    public void disconnect() {
        if (listenerContainer.isRunning()) {
            listenerContainer.stop();
        }
        log.info("Message bus disconnected");
    }

    @Override
    public void publish(String exchange, Object payload, PublishOptions options) {
        long now = clock.millis();
        Long expiresAt = options.expiration() != null ? now + options.expiration().toMillis() : null;
        BusMessage envelope = new BusMessage(UUID.randomUUID().toString(), exchange, now, expiresAt,
                objectMapper.valueToTree(payload));
        try {
            redisTemplate.convertAndSend(exchange, objectMapper.writeValueAsString(envelope));
            log.debug("Published message: exchange={}, messageId={}", exchange, envelope.messageId());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize bus message for " + exchange, e);
        }
    }

    @Override
    public <T> void subscribe(String exchange, Class<T> payloadType, Consumer<T> handler) {
        listenerContainer.addMessageListener(
                new BusMessageListener<>(exchange, payloadType, handler, objectMapper, clock, metrics),
                new ChannelTopic(exchange));
        log.info("Subscribed to exchange: {}", exchange);
    }
}
