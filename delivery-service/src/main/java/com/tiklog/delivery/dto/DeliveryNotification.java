package com.tiklog.delivery.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tiklog.delivery.entity.Delivery;
import com.tiklog.delivery.match.MatchRecord;

import java.math.BigDecimal;

/** 배송 시작/종료 시 고객에게 보내는 알림 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeliveryNotification(
        Long deliveryId,
        String deliveryRefNumber,
        String customerId,
        String riderId,
        String status,
        String estimatedDeliveryTime,
        Integer arrivalTime,
        BigDecimal riderFee
) {

    public static DeliveryNotification of(Delivery delivery, MatchRecord match, BigDecimal riderFee) {
        return new DeliveryNotification(
                delivery.getId(),
                delivery.getDeliveryRefNumber(),
                match.customerId(),
                match.riderId(),
                delivery.getStatus().name(),
                delivery.getEstimatedDeliveryTime(),
                match.arrivalTimeMinutes(),
                riderFee);
    }
}
