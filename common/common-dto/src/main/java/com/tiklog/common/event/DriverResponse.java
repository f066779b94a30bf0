package com.tiklog.common.event;

import java.util.UUID;

/**
 * 라이더 응답 이벤트 (Driver Response)
 *
 * <p>라이더가 배송 요청을 수락/거절하면 {@code driver_responses} exchange로 브로드캐스트된다.
 * 모든 인스턴스가 같은 메시지를 받으므로, {@code eventId}로 영속화를 한 번만 수행한다
 * (Idempotent Consumer).</p>
 *
 * <p>{@code deliveryId}가 없으면 고객 ID로 진행 중인 매칭을 찾는다.</p>
 */
public record DriverResponse(
        String eventId,        // 멱등성 보장을 위한 이벤트 고유 ID (UUID)
        Long deliveryId,       // 대상 배달 ID (nullable)
        String riderId,
        String customerId,
        boolean availability,  // true = 수락, false = 거절
        Integer arrivalTime    // 라이더가 안내한 도착 예정 시간(분)
) {
    /** eventId가 비어 있으면 새 UUID를 부여한 사본을 반환 */
    public DriverResponse withEventId() {
        if (eventId != null && !eventId.isBlank()) {
            return this;
        }
        return new DriverResponse(UUID.randomUUID().toString(),
                deliveryId, riderId, customerId, availability, arrivalTime);
    }
}
