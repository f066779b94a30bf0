package com.tiklog.delivery.service;

import com.tiklog.common.exception.BusinessException;
import com.tiklog.common.exception.ErrorCode;
import com.tiklog.delivery.dto.DeliveryRequest;
import com.tiklog.delivery.entity.CustomerWallet;
import com.tiklog.delivery.entity.Delivery;
import com.tiklog.delivery.match.MatchCache;
import com.tiklog.delivery.repository.CustomerWalletRepository;
import com.tiklog.delivery.repository.DeliveryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * 배달 서비스 - 배송 생성/수정/취소와 조회.
 *
 * <h3>배송 생성</h3>
 * <pre>
 * 1. 견적 계산 (거리 × 차량별 km당 요금, 예상 배송 시간)
 * 2. 고객 지갑 확인: 없음 → WALLET_NOT_FOUND, 잔액 부족 → INSUFFICIENT_BALANCE
 * 3. Delivery 저장 (PENDING) + 배송비 차감 - 같은 트랜잭션
 * </pre>
 *
 * <h3>수정 (PENDING만)</h3>
 * <p>견적을 다시 계산하고 기존 배송비와의 차액만큼 지갑에서 차감하거나 환불한다.</p>
 *
 * <h3>취소 (PENDING, ASSIGNED만)</h3>
 * <p>배송비 전액 환불. 커밋 후 매칭 레코드와 배차 claim을 정리한다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DeliveryService {

    private final DeliveryRepository deliveryRepository;
    private final CustomerWalletRepository customerWalletRepository;
    private final DeliveryQuoteCalculator quoteCalculator;
    private final MatchCache matchCache;
    private final DispatchClaimService claimService;

    @Transactional
    public Delivery createDelivery(DeliveryRequest request) {
        if (request.customerId() == null || request.customerId().isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "customerId is required");
        }
        DeliveryQuote quote = quote(request);
        CustomerWallet wallet = findWallet(request.customerId());
        wallet.debit(quote.deliveryFee());

        Delivery delivery = deliveryRepository.save(Delivery.builder()
                .deliveryRefNumber(newRefNumber())
                .customerId(request.customerId())
                .senderName(request.senderName())
                .senderAddress(request.senderAddress())
                .recipientAddress(request.recipientAddress())
                .senderLatitude(request.senderLat())
                .senderLongitude(request.senderLon())
                .recipientLatitude(request.recipientLat())
                .recipientLongitude(request.recipientLon())
                .vehicleType(request.vehicle())
                .deliveryFee(quote.deliveryFee())
                .estimatedDeliveryTime(quote.estimatedDeliveryTime())
                .build());

        log.info("Delivery created: ref={}, customerId={}, distance={}km, fee={}",
                delivery.getDeliveryRefNumber(), delivery.getCustomerId(), quote.distanceKm(), quote.deliveryFee());
        return delivery;
    }

    @Transactional
    public Delivery editDelivery(Long deliveryId, DeliveryRequest request) {
        Delivery delivery = getDelivery(deliveryId);
        DeliveryQuote quote = quote(request);
        CustomerWallet wallet = findWallet(delivery.getCustomerId());

        // 양수면 환불, 음수면 추가 차감
        BigDecimal difference = delivery.getDeliveryFee().subtract(quote.deliveryFee());
        delivery.edit(request.senderName(), request.senderAddress(), request.recipientAddress(),
                request.senderLat(), request.senderLon(), request.recipientLat(), request.recipientLon(),
                request.vehicle(), quote.deliveryFee(), quote.estimatedDeliveryTime());
        if (difference.signum() < 0) {
            wallet.debit(difference.negate());
        } else {
            wallet.credit(difference);
        }

        log.info("Delivery edited: ref={}, fee={}, walletAdjustment={}",
                delivery.getDeliveryRefNumber(), quote.deliveryFee(), difference);
        return delivery;
    }

    @Transactional
    public Delivery cancelDelivery(Long deliveryId) {
        Delivery delivery = getDelivery(deliveryId);
        delivery.cancel();

        customerWalletRepository.findByCustomerId(delivery.getCustomerId())
                .ifPresentOrElse(wallet -> wallet.credit(delivery.getDeliveryFee()),
                        () -> log.warn("No wallet to refund: customerId={}", delivery.getCustomerId()));

        AfterCommit.run(() -> {
            matchCache.find(deliveryId).ifPresent(matchCache::evict);
            claimService.release(deliveryId);
        });

        log.info("Delivery canceled: ref={}, refunded={}", delivery.getDeliveryRefNumber(), delivery.getDeliveryFee());
        return delivery;
    }

    /** 지갑이 없으면 새로 연다 */
    @Transactional
    public CustomerWallet fundWallet(String customerId, BigDecimal amount) {
        CustomerWallet wallet = customerWalletRepository.findByCustomerId(customerId)
                .orElseGet(() -> customerWalletRepository.save(CustomerWallet.open(customerId)));
        wallet.credit(amount);
        log.info("Wallet funded: customerId={}, amount={}, balance={}", customerId, amount, wallet.getBalance());
        return wallet;
    }

    public CustomerWallet getWallet(String customerId) {
        return findWallet(customerId);
    }

    public Delivery getDelivery(Long deliveryId) {
        return deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> new BusinessException(ErrorCode.DELIVERY_NOT_FOUND));
    }

    public List<Delivery> getDeliveriesByCustomer(String customerId) {
        return deliveryRepository.findAllByCustomerIdOrderByCreatedAtDesc(customerId);
    }

    private DeliveryQuote quote(DeliveryRequest request) {
        return quoteCalculator.quote(request.senderLat(), request.senderLon(),
                request.recipientLat(), request.recipientLon(), request.vehicle());
    }

    private CustomerWallet findWallet(String customerId) {
        return customerWalletRepository.findByCustomerId(customerId)
                .orElseThrow(() -> new BusinessException(ErrorCode.WALLET_NOT_FOUND));
    }

    private String newRefNumber() {
        return "TKL-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase(Locale.ROOT);
    }
}
