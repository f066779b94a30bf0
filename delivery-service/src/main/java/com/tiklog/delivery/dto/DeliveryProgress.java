package com.tiklog.delivery.dto;

/**
 * 배송 시작/종료 이벤트 페이로드. deliveryId가 없으면 고객 ID로 매칭을 찾는다.
 */
public record DeliveryProgress(String customerId, String riderId, Long deliveryId) {
}
