package com.tiklog.delivery.service;

import com.tiklog.delivery.config.DispatchProperties;
import com.tiklog.delivery.repository.RiderDistance;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 도착 예정 시간(분) 계산기.
 *
 * <pre>
 * 시간(h) = Σ distanceKm / speedKmh      (ALL_CANDIDATES: 반경 내 전체, SELECTED_RIDER: 선택된 라이더만)
 * 분      = eta-minutes 방식으로 환산        (HOUR_REMAINDER 기본, TOTAL 선택)
 * 결과    = max(분, minimum-arrival-minutes)
 * </pre>
 *
 * <p>속도는 선택된 라이더의 차량 기준이며 모든 후보에 동일하게 적용한다.</p>
 */
@Component
@RequiredArgsConstructor
public class ArrivalTimeEstimator {

    private final DispatchProperties properties;

    public int estimateMinutes(List<RiderDistance> candidates, RiderDistance selected, double speedKmh) {
        if (speedKmh <= 0) {
            throw new IllegalArgumentException("speed must be positive: " + speedKmh);
        }
        double hours = switch (properties.etaMode()) {
            case ALL_CANDIDATES -> candidates.stream()
                    .mapToDouble(candidate -> candidate.distanceKm() / speedKmh)
                    .sum();
            case SELECTED_RIDER -> selected.distanceKm() / speedKmh;
        };
        int minutes = properties.etaMinutes().toMinutes(hours);
        return Math.max(minutes, properties.minimumArrivalMinutes());
    }
}
