package com.tiklog.delivery.match;

import java.util.Optional;

/**
 * 매칭 레코드 저장소. 배달 ID별로 보관하고 고객 ID로도 찾을 수 있다.
 */
public interface MatchCache {

    void save(MatchRecord record);

    Optional<MatchRecord> find(Long deliveryId);

    /** 고객의 가장 최근 매칭 */
    Optional<MatchRecord> findByCustomer(String customerId);

    void evict(MatchRecord record);
}
