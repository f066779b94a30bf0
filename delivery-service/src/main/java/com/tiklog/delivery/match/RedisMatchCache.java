package com.tiklog.delivery.match;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tiklog.delivery.config.DispatchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Redis 기반 매칭 캐시.
 *
 * <h3>키 구조</h3>
 * <pre>
 * match:delivery:{deliveryId}  → MatchRecord JSON (TTL = match-ttl)
 * match:customer:{customerId}  → deliveryId       (TTL = match-ttl)
 * </pre>
 *
 * <p>배달별 키를 쓰기 때문에 같은 고객의 동시 배달이나 서로 다른 고객의 배달이 서로의 레코드를 덮어쓰지 않는다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisMatchCache implements MatchCache {

    static final String DELIVERY_KEY_PREFIX = "match:delivery:";
    static final String CUSTOMER_KEY_PREFIX = "match:customer:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final DispatchProperties properties;

    @Override
    public void save(MatchRecord record) {
        String json;
        try {
            json = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize match record for delivery " + record.deliveryId(), e);
        }
        redisTemplate.opsForValue().set(DELIVERY_KEY_PREFIX + record.deliveryId(), json, properties.matchTtl());
        redisTemplate.opsForValue().set(CUSTOMER_KEY_PREFIX + record.customerId(),
                String.valueOf(record.deliveryId()), properties.matchTtl());
        log.debug("Match saved: deliveryId={}, riderId={}", record.deliveryId(), record.riderId());
    }

    @Override
    public Optional<MatchRecord> find(Long deliveryId) {
        if (deliveryId == null) {
            return Optional.empty();
        }
        String json = redisTemplate.opsForValue().get(DELIVERY_KEY_PREFIX + deliveryId);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, MatchRecord.class));
        } catch (JsonProcessingException e) {
            log.error("Unreadable match record: deliveryId={}", deliveryId, e);
            return Optional.empty();
        }
    }

    @Override
    public Optional<MatchRecord> findByCustomer(String customerId) {
        if (customerId == null) {
            return Optional.empty();
        }
        String deliveryId = redisTemplate.opsForValue().get(CUSTOMER_KEY_PREFIX + customerId);
        if (deliveryId == null) {
            return Optional.empty();
        }
        return find(Long.valueOf(deliveryId));
    }

    @Override
    public void evict(MatchRecord record) {
        redisTemplate.delete(DELIVERY_KEY_PREFIX + record.deliveryId());
        String customerKey = CUSTOMER_KEY_PREFIX + record.customerId();
        // 고객 인덱스가 이미 다른 배달을 가리키면 남겨둔다
        if (String.valueOf(record.deliveryId()).equals(redisTemplate.opsForValue().get(customerKey))) {
            redisTemplate.delete(customerKey);
        }
        log.debug("Match evicted: deliveryId={}", record.deliveryId());
    }
}
