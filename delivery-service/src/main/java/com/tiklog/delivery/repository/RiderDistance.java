package com.tiklog.delivery.repository;

/**
 * GEO 반경 검색 결과 한 건.
 *
 * @param riderId    라이더 ID (GEO 멤버)
 * @param distanceKm 기준점으로부터의 거리 (km)
 * @param longitude  라이더 경도
 * @param latitude   라이더 위도
 */
public record RiderDistance(String riderId, double distanceKm, double longitude, double latitude) {
}
