package com.tiklog.delivery.service;

import com.tiklog.common.exception.BusinessException;
import com.tiklog.common.exception.ErrorCode;
import com.tiklog.delivery.config.DispatchProperties;
import com.tiklog.delivery.entity.AdminFee;
import com.tiklog.delivery.entity.Delivery;
import com.tiklog.delivery.entity.RiderWallet;
import com.tiklog.delivery.metrics.DispatchMetrics;
import com.tiklog.delivery.repository.AdminFeeRepository;
import com.tiklog.delivery.repository.RiderWalletRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 정산 서비스 - 배송 완료 시 수수료 기록 + 라이더 지갑 적립.
 *
 * <h3>실행 흐름</h3>
 * <ol>
 *   <li>Redisson 분산 락 획득 ({@code lock:settlement:{deliveryRefNumber}}, 5초 대기, 10초 자동 해제)</li>
 *   <li>AdminFee가 이미 있으면 중복 정산 → 아무것도 변경하지 않음</li>
 *   <li>수수료/라이더 몫 계산 ({@link FeeSplit})</li>
 *   <li>지갑 적립 (없으면 생성) + AdminFee 저장 - 같은 트랜잭션</li>
 * </ol>
 *
 * <p>분산 락이 만료된 뒤의 경합은 AdminFee.deliveryRefNumber unique 제약이 막는다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementService {

    static final String LOCK_KEY_PREFIX = "lock:settlement:";

    private final AdminFeeRepository adminFeeRepository;
    private final RiderWalletRepository riderWalletRepository;
    private final RedissonClient redissonClient;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;

    @Transactional
    public SettlementResult settle(Delivery delivery) {
        String refNumber = delivery.getDeliveryRefNumber();
        RLock lock = redissonClient.getLock(LOCK_KEY_PREFIX + refNumber);

        try {
            if (!lock.tryLock(5, 10, TimeUnit.SECONDS)) {
                log.warn("Failed to acquire settlement lock: deliveryRefNumber={}", refNumber);
                throw new BusinessException(ErrorCode.SETTLEMENT_IN_PROGRESS);
            }

            Optional<AdminFee> existing = adminFeeRepository.findByDeliveryRefNumber(refNumber);
            if (existing.isPresent()) {
                log.info("Delivery already settled: deliveryRefNumber={}", refNumber);
                metrics.recordSettlement("duplicate");
                return SettlementResult.alreadySettled(refNumber, existing.get().getAdminFee());
            }

            FeeSplit split = FeeSplit.of(delivery.getDeliveryFee(), properties.adminChargesPercent());
            String riderId = delivery.getRiderId();

            RiderWallet wallet = riderWalletRepository.findByRiderId(riderId)
                    .map(found -> {
                        found.credit(split.riderFee());
                        return found;
                    })
                    .orElseGet(() -> riderWalletRepository.save(RiderWallet.open(riderId, split.riderFee())));

            adminFeeRepository.save(AdminFee.builder()
                    .deliveryRefNumber(refNumber)
                    .riderId(riderId)
                    .adminFee(split.adminFee())
                    .build());

            log.info("Delivery settled: deliveryRefNumber={}, riderId={}, adminFee={}, riderFee={}",
                    refNumber, riderId, split.adminFee(), split.riderFee());
            metrics.recordSettlement("settled");
            return SettlementResult.settled(refNumber, split, wallet.getBalance());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.SETTLEMENT_IN_PROGRESS,
                    "Interrupted while waiting for settlement lock", e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }
}
