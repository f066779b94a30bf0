package com.tiklog.delivery.bus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tiklog.delivery.metrics.DispatchMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;

import java.time.Clock;
import java.util.function.Consumer;

/**
 * 한 exchange 구독을 위한 Redis 리스너.
 *
 * <p>봉투를 역직렬화한 뒤 만료된 메시지는 버리고, 나머지를 타입 변환하여 핸들러에 넘긴다.
 * 핸들러 예외는 여기서 끝난다 (로그 + 실패 카운터). 리스너 컨테이너로 전파하지 않는다.</p>
 */
@Slf4j
class BusMessageListener<T> implements MessageListener {

    private final String exchange;
    private final Class<T> payloadType;
    private final Consumer<T> handler;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final DispatchMetrics metrics;

    BusMessageListener(String exchange, Class<T> payloadType, Consumer<T> handler,
                       ObjectMapper objectMapper, Clock clock, DispatchMetrics metrics) {
        this.exchange = exchange;
        this.payloadType = payloadType;
        this.handler = handler;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            BusMessage envelope = objectMapper.readValue(message.getBody(), BusMessage.class);
            if (envelope.isExpired(clock.millis())) {
                log.debug("Dropping expired message: exchange={}, messageId={}", exchange, envelope.messageId());
                metrics.recordExpiredMessage(exchange);
                return;
            }
            T payload = objectMapper.treeToValue(envelope.payload(), payloadType);
            handler.accept(payload);
        } catch (Exception e) {
            log.error("Failed to handle bus message: exchange={}", exchange, e);
            metrics.recordAsyncFailure("bus:" + exchange);
        }
    }
}
