package com.tiklog.delivery.service;

import java.math.BigDecimal;

/**
 * 배송 견적 - 픽업지와 수령지 사이 거리로 계산한 배송비와 예상 배송 시간.
 *
 * @param distanceKm            Haversine 거리 (소수 둘째 자리 반올림)
 * @param deliveryFee           distanceKm × 차량별 km당 요금
 * @param estimatedDeliveryTime "{시간}hrs:{분}min"
 */
public record DeliveryQuote(
        BigDecimal distanceKm,
        BigDecimal deliveryFee,
        String estimatedDeliveryTime
) {
}
