package com.tiklog.delivery.service;

import com.tiklog.common.exception.BusinessException;
import com.tiklog.common.exception.ErrorCode;
import com.tiklog.delivery.config.DispatchProperties;
import com.tiklog.delivery.dto.DiscoveryResult;
import com.tiklog.delivery.entity.Delivery;
import com.tiklog.delivery.entity.Rider;
import com.tiklog.delivery.entity.Vehicle;
import com.tiklog.delivery.entity.VehicleType;
import com.tiklog.delivery.match.MatchCache;
import com.tiklog.delivery.match.MatchRecord;
import com.tiklog.delivery.match.RiderSnapshot;
import com.tiklog.delivery.repository.DeliveryRepository;
import com.tiklog.delivery.repository.RiderDistance;
import com.tiklog.delivery.repository.RiderLocationRepository;
import com.tiklog.delivery.repository.RiderRepository;
import com.tiklog.delivery.repository.VehicleRepository;
import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 라이더 탐색 서비스 - Redis GEO 반경 검색으로 고객의 최근 배달에 가장 가까운 라이더를 찾는다.
 *
 * <h3>동작 흐름</h3>
 * <pre>
 * 1. 고객의 가장 최근 배달 조회 → 픽업 좌표 확보
 * 2. GEORADIUS (max-distance-km, 거리 오름차순)
 * 3. 가까운 순으로 첫 번째 "ONLINE + active" 라이더 선택
 * 4. 차량 종류 → 속도 → 도착 예정 시간 계산
 * 5. 매칭 레코드 저장 (match-ttl)
 * </pre>
 *
 * <h3>실패</h3>
 * <ul>
 *   <li>배달 없음 → DELIVERY_NOT_FOUND</li>
 *   <li>반경 내 라이더 없음 → NO_AVAILABLE_RIDER</li>
 *   <li>반경 내 라이더는 있으나 자격 있는 라이더 없음 → NO_ONLINE_RIDER</li>
 * </ul>
 *
 * <p>@Bulkhead: 동시 GEO 쿼리 수를 제한하여 Redis 연결 풀 고갈 방지</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RiderDiscoveryService {

    private final DeliveryRepository deliveryRepository;
    private final RiderRepository riderRepository;
    private final VehicleRepository vehicleRepository;
    private final RiderLocationRepository riderLocationRepository;
    private final ArrivalTimeEstimator arrivalTimeEstimator;
    private final MatchCache matchCache;
    private final DispatchProperties properties;

    @Bulkhead(name = "riderMatching")
    public DiscoveryResult findRider(String customerId) {
        Delivery delivery = deliveryRepository.findFirstByCustomerIdOrderByCreatedAtDesc(customerId)
                .orElseThrow(() -> new BusinessException(ErrorCode.DELIVERY_NOT_FOUND));

        List<RiderDistance> nearby = riderLocationRepository.findNearby(
                delivery.getSenderLongitude(), delivery.getSenderLatitude(), properties.maxDistanceKm());
        if (nearby.isEmpty()) {
            log.warn("No riders within {}km of delivery {}", properties.maxDistanceKm(), delivery.getId());
            throw new BusinessException(ErrorCode.NO_AVAILABLE_RIDER);
        }

        Map<String, Rider> riders = riderRepository.findAllById(
                        nearby.stream().map(RiderDistance::riderId).toList())
                .stream()
                .collect(Collectors.toMap(Rider::getId, Function.identity()));

        RiderDistance selected = null;
        Rider rider = null;
        for (RiderDistance candidate : nearby) {
            Rider found = riders.get(candidate.riderId());
            if (found != null && found.isDispatchable()) {
                selected = candidate;
                rider = found;
                break;
            }
        }
        if (rider == null) {
            log.warn("{} riders nearby but none online for delivery {}", nearby.size(), delivery.getId());
            throw new BusinessException(ErrorCode.NO_ONLINE_RIDER);
        }

        VehicleType vehicleType = vehicleRepository.findFirstByRiderId(rider.getId())
                .map(Vehicle::getVehicleType)
                .orElse(null);
        double speed = properties.speed().forVehicle(vehicleType);
        int arrivalTime = arrivalTimeEstimator.estimateMinutes(nearby, selected, speed);

        RiderSnapshot snapshot = RiderSnapshot.of(rider, selected);
        matchCache.save(MatchRecord.of(delivery, snapshot, arrivalTime));

        log.info("Rider matched: deliveryId={}, riderId={}, distance={}km, arrivalTime={}min",
                delivery.getId(), rider.getId(), selected.distanceKm(), arrivalTime);
        return new DiscoveryResult(delivery.getId(), snapshot, arrivalTime);
    }

    /** 라이더 앱이 주기적으로 호출 */
    public void updateRiderLocation(String riderId, double longitude, double latitude) {
        riderLocationRepository.save(riderId, longitude, latitude);
    }

    /** 라이더가 오프라인으로 전환할 때 GEO 집합에서 제거 */
    public void removeRiderLocation(String riderId) {
        riderLocationRepository.remove(riderId);
    }
}
