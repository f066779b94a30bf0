package com.tiklog.delivery.service;

import com.tiklog.delivery.config.DispatchProperties;
import com.tiklog.delivery.entity.VehicleType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 배송 견적 계산기.
 *
 * <pre>
 * 거리(km)   = Haversine(픽업지, 수령지), 소수 둘째 자리 반올림
 * 배송비     = 거리 × price-per-km[차량]       (차량 없음 → average)
 * 이동 시간  = 거리 / speed[차량]
 * 예상 시간  = "{floor(h)}hrs:{round((h - floor(h)) × 60)}min"
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class DeliveryQuoteCalculator {

    private final DispatchProperties properties;

    public DeliveryQuote quote(double senderLatitude, double senderLongitude,
                               double recipientLatitude, double recipientLongitude,
                               VehicleType vehicleType) {
        BigDecimal distanceKm = BigDecimal.valueOf(GeoDistance.kilometers(
                        senderLatitude, senderLongitude, recipientLatitude, recipientLongitude))
                .setScale(2, RoundingMode.HALF_UP);

        BigDecimal fee = distanceKm.multiply(properties.pricePerKm().forVehicle(vehicleType))
                .setScale(2, RoundingMode.HALF_UP);

        double hours = distanceKm.doubleValue() / properties.speed().forVehicle(vehicleType);
        String estimatedDeliveryTime = (long) Math.floor(hours) + "hrs:"
                + EtaMinutes.HOUR_REMAINDER.toMinutes(hours) + "min";

        return new DeliveryQuote(distanceKm, fee, estimatedDeliveryTime);
    }
}
