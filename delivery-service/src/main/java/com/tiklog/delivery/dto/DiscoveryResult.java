package com.tiklog.delivery.dto;

import com.tiklog.delivery.match.RiderSnapshot;

/**
 * 라이더 탐색 결과.
 *
 * @param deliveryId         기준이 된 배달
 * @param rider              선택된 라이더
 * @param arrivalTimeMinutes 도착 예정 시간 (분)
 */
public record DiscoveryResult(Long deliveryId, RiderSnapshot rider, int arrivalTimeMinutes) {

    public String arrivalMessage() {
        return "Rider will arrive in " + arrivalTimeMinutes + "min";
    }
}
