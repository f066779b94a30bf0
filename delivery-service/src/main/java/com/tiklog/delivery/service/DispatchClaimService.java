package com.tiklog.delivery.service;

import com.tiklog.delivery.config.DispatchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 배달별 배차 claim - 모든 인스턴스를 통틀어 한 배달의 라이더 알림은 한 번만 수행된다.
 *
 * <p>package_request는 모든 인스턴스에 fanout 된다. 매칭된 라이더의 소켓을 가진 인스턴스만
 * Redisson {@code RBucket.trySet}(SET NX PX)으로 claim을 시도한다.
 * claim 값은 제출 ID(requestId)라서 같은 제출의 재수신과 다른 제출을 구분할 수 있다.</p>
 *
 * <pre>
 * dispatch:claim:{deliveryId} → requestId (TTL = claim-ttl)
 * </pre>
 *
 * <p>거절/배송 종료/취소 시 claim을 해제해 재요청이 가능하게 한다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchClaimService {

    static final String CLAIM_KEY_PREFIX = "dispatch:claim:";

    private final RedissonClient redissonClient;
    private final DispatchProperties properties;

    public ClaimResult claim(Long deliveryId, String requestId) {
        RBucket<String> bucket = redissonClient.getBucket(CLAIM_KEY_PREFIX + deliveryId);
        ClaimResult result;
        if (bucket.trySet(requestId, properties.claimTtl().toMillis(), TimeUnit.MILLISECONDS)) {
            result = ClaimResult.ACQUIRED;
        } else {
            result = requestId.equals(bucket.get()) ? ClaimResult.SAME_REQUEST : ClaimResult.OTHER_REQUEST;
        }
        log.debug("Dispatch claim: deliveryId={}, requestId={}, result={}", deliveryId, requestId, result);
        return result;
    }

    /** 현재 claim을 가진 제출 ID */
    public Optional<String> holder(Long deliveryId) {
        RBucket<String> bucket = redissonClient.getBucket(CLAIM_KEY_PREFIX + deliveryId);
        return Optional.ofNullable(bucket.get());
    }

    public void release(Long deliveryId) {
        redissonClient.getBucket(CLAIM_KEY_PREFIX + deliveryId).delete();
    }

    public enum ClaimResult {
        /** 이번 호출이 claim을 획득함 */
        ACQUIRED,
        /** 같은 제출이 이미 claim함 (직접 호출 + 버스 재수신) */
        SAME_REQUEST,
        /** 다른 제출이 이미 배차함 */
        OTHER_REQUEST
    }
}
