package com.tiklog.delivery.match;

import com.tiklog.delivery.entity.Delivery;

/**
 * 현재 매칭 레코드 - 한 배달에 대해 탐색된 라이더와 도착 예정 시간.
 *
 * <p>라이더 탐색이 만들고, 배차/응답 중계/배송 시작·종료가 읽는다.
 * 거절 또는 배송 종료 시 제거되며, 그 외에는 TTL로 만료된다.</p>
 */
public record MatchRecord(
        Long deliveryId,
        String riderId,
        String customerId,
        String deliveryRefNumber,
        String senderName,
        String senderAddress,
        String recipientAddress,
        String estimatedDeliveryTime,
        int arrivalTimeMinutes,
        RiderSnapshot rider
) {

    public static MatchRecord of(Delivery delivery, RiderSnapshot rider, int arrivalTimeMinutes) {
        return new MatchRecord(
                delivery.getId(),
                rider.id(),
                delivery.getCustomerId(),
                delivery.getDeliveryRefNumber(),
                delivery.getSenderName(),
                delivery.getSenderAddress(),
                delivery.getRecipientAddress(),
                delivery.getEstimatedDeliveryTime(),
                arrivalTimeMinutes,
                rider);
    }
}
