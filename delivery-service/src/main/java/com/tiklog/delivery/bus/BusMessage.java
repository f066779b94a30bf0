package com.tiklog.delivery.bus;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 버스 메시지 봉투(envelope).
 *
 * <p>Redis Pub/Sub 자체에는 메시지 TTL이 없으므로 만료 시각을 봉투에 담고,
 * 소비자가 수신 시점에 만료 여부를 판단해 버린다.</p>
 *
 * @param messageId   메시지 고유 ID
 * @param exchange    발행된 exchange
 * @param publishedAt 발행 시각 (epoch millis)
 * @param expiresAt   만료 시각 (epoch millis), 없으면 null
 * @param payload     JSON 페이로드
 */
public record BusMessage(
        String messageId,
        String exchange,
        long publishedAt,
        Long expiresAt,
        JsonNode payload
) {

    public boolean isExpired(long nowMillis) {
        return expiresAt != null && nowMillis >= expiresAt;
    }
}
