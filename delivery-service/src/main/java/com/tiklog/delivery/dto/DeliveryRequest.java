package com.tiklog.delivery.dto;

import com.tiklog.delivery.entity.VehicleType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * 배송 생성/수정 요청. 수정 시 {@code customerId}는 무시된다.
 */
public record DeliveryRequest(
        String customerId,
        String senderName,
        @NotBlank String senderAddress,
        @NotBlank String recipientAddress,
        @NotNull @DecimalMin("-90.0") @DecimalMax("90.0") Double senderLat,
        @NotNull @DecimalMin("-180.0") @DecimalMax("180.0") Double senderLon,
        @NotNull @DecimalMin("-90.0") @DecimalMax("90.0") Double recipientLat,
        @NotNull @DecimalMin("-180.0") @DecimalMax("180.0") Double recipientLon,
        VehicleType vehicle
) {
}
