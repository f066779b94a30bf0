package com.tiklog.delivery.dto;

import com.tiklog.delivery.entity.Delivery;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record DeliveryResponse(
        Long id,
        String deliveryRefNumber,
        String customerId,
        String riderId,
        String senderName,
        String senderAddress,
        String recipientAddress,
        BigDecimal deliveryFee,
        String estimatedDeliveryTime,
        String status,
        LocalDateTime createdAt
) {

    public static DeliveryResponse from(Delivery delivery) {
        return new DeliveryResponse(
                delivery.getId(),
                delivery.getDeliveryRefNumber(),
                delivery.getCustomerId(),
                delivery.getRiderId(),
                delivery.getSenderName(),
                delivery.getSenderAddress(),
                delivery.getRecipientAddress(),
                delivery.getDeliveryFee(),
                delivery.getEstimatedDeliveryTime(),
                delivery.getStatus().name(),
                delivery.getCreatedAt());
    }
}
