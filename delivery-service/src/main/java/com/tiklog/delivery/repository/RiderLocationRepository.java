package com.tiklog.delivery.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.geo.*;
import org.springframework.data.redis.connection.RedisGeoCommands;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 라이더 실시간 위치 저장소 - Redis GEO 자료구조.
 *
 * <p>라이더 앱이 주기적으로 GPS 좌표를 보내면 GEOADD로 덮어쓰고(upsert),
 * 라이더 탐색 시 GEORADIUS로 반경 내 라이더를 거리 오름차순으로 조회한다.</p>
 *
 * <pre>
 * GEOADD   riders:location {lon} {lat} {riderId}
 * GEORADIUS riders:location {lon} {lat} {radius} km WITHDIST WITHCOORD ASC
 * </pre>
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RiderLocationRepository {

    static final String RIDER_GEO_KEY = "riders:location";

    private final StringRedisTemplate redisTemplate;

    public void save(String riderId, double longitude, double latitude) {
        redisTemplate.opsForGeo().add(RIDER_GEO_KEY, new Point(longitude, latitude), riderId);
        log.debug("Rider {} location updated: ({}, {})", riderId, longitude, latitude);
    }

    public void remove(String riderId) {
        redisTemplate.opsForGeo().remove(RIDER_GEO_KEY, riderId);
    }

    /**
     * 반경 내 라이더를 가까운 순으로 반환한다. 자격(온라인/활성) 필터링은 호출자 몫이다.
     */
    public List<RiderDistance> findNearby(double longitude, double latitude, double radiusKm) {
        GeoResults<RedisGeoCommands.GeoLocation<String>> results =
                redisTemplate.opsForGeo().radius(RIDER_GEO_KEY,
                        new Circle(new Point(longitude, latitude),
                                new Distance(radiusKm, Metrics.KILOMETERS)),
                        RedisGeoCommands.GeoRadiusCommandArgs.newGeoRadiusArgs()
                                .includeDistance()
                                .includeCoordinates()
                                .sortAscending());

        if (results == null) {
            return List.of();
        }
        return results.getContent().stream()
                .map(result -> {
                    RedisGeoCommands.GeoLocation<String> location = result.getContent();
                    return new RiderDistance(
                            location.getName(),
                            result.getDistance().getValue(),
                            location.getPoint().getX(),
                            location.getPoint().getY());
                })
                .toList();
    }
}
