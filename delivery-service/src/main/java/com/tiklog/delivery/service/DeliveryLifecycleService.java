package com.tiklog.delivery.service;

import com.tiklog.common.exception.BusinessException;
import com.tiklog.common.exception.ErrorCode;
import com.tiklog.delivery.connection.ConnectionRegistry;
import com.tiklog.delivery.connection.SocketEvents;
import com.tiklog.delivery.dto.DeliveryNotification;
import com.tiklog.delivery.dto.DeliveryProgress;
import com.tiklog.delivery.dto.RiderArrival;
import com.tiklog.delivery.entity.Delivery;
import com.tiklog.delivery.entity.Rider;
import com.tiklog.delivery.match.MatchCache;
import com.tiklog.delivery.match.MatchRecord;
import com.tiklog.delivery.repository.DeliveryRepository;
import com.tiklog.delivery.repository.RiderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 배송 생명주기 서비스 - 라이더 도착, 배송 시작, 배송 종료.
 *
 * <h3>상태 전이</h3>
 * <pre>
 * startDelivery: ASSIGNED → ON_TRANSIT, 라이더 busy
 * endDelivery:   ON_TRANSIT → DELIVERED, 라이더 available, 정산, 매칭 레코드 제거
 * </pre>
 *
 * <p>DB 변경이 먼저이고 고객 알림은 그 다음이다. 잘못된 전이면 알림 없이 INVALID_DELIVERY_STATUS.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryLifecycleService {

    private final DeliveryRepository deliveryRepository;
    private final RiderRepository riderRepository;
    private final MatchCache matchCache;
    private final ConnectionRegistry connectionRegistry;
    private final DispatchClaimService claimService;
    private final SettlementService settlementService;

    /** 라이더 도착 알림을 고객에게 그대로 전달. 상태 변경 없음. */
    public void riderArrived(RiderArrival arrival) {
        boolean sent = connectionRegistry.send(arrival.customerId(),
                SocketEvents.RIDER_ARRIVAL_NOTIFICATION, arrival.riderArrived());
        log.info("Rider arrival forwarded: customerId={}, riderId={}, delivered={}",
                arrival.customerId(), arrival.riderId(), sent);
    }

    @Transactional
    public DeliveryNotification startDelivery(DeliveryProgress progress) {
        MatchRecord match = resolveMatch(progress);
        Delivery delivery = findDelivery(match.deliveryId());

        delivery.startTransit();
        riderRepository.findById(match.riderId())
                .ifPresentOrElse(Rider::markBusy,
                        () -> log.warn("Rider not found on start: riderId={}", match.riderId()));

        DeliveryNotification notification = DeliveryNotification.of(delivery, match, null);
        connectionRegistry.send(match.customerId(), SocketEvents.START_DELIVERY_NOTIFICATION, notification);
        log.info("Delivery started: deliveryId={}, riderId={}", delivery.getId(), match.riderId());
        return notification;
    }

    @Transactional
    public SettlementResult endDelivery(DeliveryProgress progress) {
        MatchRecord match = resolveMatch(progress);
        Delivery delivery = findDelivery(match.deliveryId());

        delivery.complete();
        riderRepository.findById(match.riderId())
                .ifPresentOrElse(Rider::markAvailable,
                        () -> log.warn("Rider not found on end: riderId={}", match.riderId()));

        SettlementResult settlement = settlementService.settle(delivery);

        AfterCommit.run(() -> {
            matchCache.evict(match);
            claimService.release(match.deliveryId());
        });

        connectionRegistry.send(match.customerId(), SocketEvents.END_DELIVERY_NOTIFICATION,
                DeliveryNotification.of(delivery, match, settlement.riderFee()));
        log.info("Delivery completed: deliveryId={}, riderId={}", delivery.getId(), match.riderId());
        return settlement;
    }

    private MatchRecord resolveMatch(DeliveryProgress progress) {
        return (progress.deliveryId() != null
                ? matchCache.find(progress.deliveryId())
                : matchCache.findByCustomer(progress.customerId()))
                .orElseThrow(() -> new BusinessException(ErrorCode.MATCH_NOT_FOUND));
    }

    private Delivery findDelivery(Long deliveryId) {
        return deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> new BusinessException(ErrorCode.DELIVERY_NOT_FOUND));
    }
}
