package com.tiklog.delivery.dto;

import com.tiklog.common.event.PackageRequest;

/** 라이더에게 보내는 신규 배송 요청 알림 */
public record RiderNotification(
        String title,
        String body,
        Long deliveryId,
        String customerId,
        String deliveryRefNumber,
        String senderAddress,
        String recipientAddress
) {

    public static RiderNotification newRequest(PackageRequest request) {
        return new RiderNotification(
                "New Delivery Request",
                "You have been assigned a new delivery request from " + request.senderName() + ".",
                request.deliveryId(),
                request.customerId(),
                request.deliveryRefNumber(),
                request.senderAddress(),
                request.recipientAddress());
    }
}
