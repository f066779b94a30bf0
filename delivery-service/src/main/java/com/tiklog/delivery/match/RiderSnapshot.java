package com.tiklog.delivery.match;

import com.tiklog.delivery.entity.Rider;
import com.tiklog.delivery.repository.RiderDistance;

/**
 * 매칭 시점의 라이더 정보 스냅샷. 고객 화면에 그대로 노출된다.
 */
public record RiderSnapshot(
        String id,
        String firstName,
        String lastName,
        String email,
        String phone,
        String gender,
        String status,
        Location location
) {

    public record Location(double longitude, double latitude) {
    }

    public static RiderSnapshot of(Rider rider, RiderDistance position) {
        return new RiderSnapshot(
                rider.getId(),
                rider.getFirstName(),
                rider.getLastName(),
                rider.getEmail(),
                rider.getPhone(),
                rider.getGender(),
                rider.getStatus().name(),
                new Location(position.longitude(), position.latitude()));
    }
}
