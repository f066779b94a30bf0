package com.tiklog.delivery.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tiklog.delivery.match.RiderSnapshot;

/** 라이더 수락 시 고객에게 보내는 알림 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RiderResponseNotification(
        String title,
        boolean availability,
        String riderId,
        Long deliveryId,
        Integer arrivalTime,
        RiderSnapshot rider
) {

    public static RiderResponseNotification accepted(String riderId, Long deliveryId,
                                                     Integer arrivalTime, RiderSnapshot rider) {
        return new RiderResponseNotification("Rider response", true, riderId, deliveryId, arrivalTime, rider);
    }
}
