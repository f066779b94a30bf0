package com.tiklog.delivery.config;

import com.tiklog.delivery.entity.VehicleType;
import com.tiklog.delivery.service.EtaMinutes;
import com.tiklog.delivery.service.EtaMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * 배차 엔진 설정 ({@code tiklog.dispatch.*}).
 *
 * <pre>
 * tiklog:
 *   dispatch:
 *     admin-charges-percent: 10     # 플랫폼 수수료(%)
 *     max-distance-km: 10           # 라이더 탐색 반경
 *     request-expiration: 30s       # package_request 메시지 TTL
 *     match-ttl: 3600s              # 매칭 레코드 TTL
 *     claim-ttl: 3600s              # 배달별 배차 claim TTL
 *     minimum-arrival-minutes: 2    # 도착 예정 시간 하한
 *     eta-mode: ALL_CANDIDATES
 *     eta-minutes: HOUR_REMAINDER   # 시간(h) → 분 환산 방식
 *     speed: { bike: 30, car: 50, bus: 40, average: 35 }
 *     price-per-km: { bike: 150, car: 250, bus: 200, average: 180 }
 * </pre>
 */
@ConfigurationProperties(prefix = "tiklog.dispatch")
public record DispatchProperties(
        @DefaultValue("10") BigDecimal adminChargesPercent,
        @DefaultValue("10") double maxDistanceKm,
        @DefaultValue("30s") Duration requestExpiration,
        @DefaultValue("3600s") Duration matchTtl,
        @DefaultValue("3600s") Duration claimTtl,
        @DefaultValue("2") int minimumArrivalMinutes,
        @DefaultValue("ALL_CANDIDATES") EtaMode etaMode,
        @DefaultValue("HOUR_REMAINDER") EtaMinutes etaMinutes,
        @DefaultValue Speed speed,
        @DefaultValue PricePerKm pricePerKm,
        @DefaultValue("*") List<String> allowedOrigins
) {

    /** 차량 종류별 평균 주행 속도 (km/h) */
    public record Speed(
            @DefaultValue("30") double bike,
            @DefaultValue("50") double car,
            @DefaultValue("40") double bus,
            @DefaultValue("35") double average
    ) {
        /** 차량 정보가 없거나 알 수 없는 종류면 평균 속도 */
        public double forVehicle(VehicleType vehicleType) {
            if (vehicleType == null) {
                return average;
            }
            return switch (vehicleType) {
                case BIKE -> bike;
                case CAR -> car;
                case BUS -> bus;
                default -> average;
            };
        }
    }

    /** 차량 종류별 km당 배송비 */
    public record PricePerKm(
            @DefaultValue("150") BigDecimal bike,
            @DefaultValue("250") BigDecimal car,
            @DefaultValue("200") BigDecimal bus,
            @DefaultValue("180") BigDecimal average
    ) {
        public BigDecimal forVehicle(VehicleType vehicleType) {
            if (vehicleType == null) {
                return average;
            }
            return switch (vehicleType) {
                case BIKE -> bike;
                case CAR -> car;
                case BUS -> bus;
                default -> average;
            };
        }
    }
}
