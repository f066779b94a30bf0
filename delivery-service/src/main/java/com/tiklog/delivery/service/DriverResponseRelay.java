package com.tiklog.delivery.service;

import com.tiklog.common.event.DriverResponse;
import com.tiklog.common.exception.BusinessException;
import com.tiklog.common.exception.ErrorCode;
import com.tiklog.delivery.bus.Exchanges;
import com.tiklog.delivery.bus.MessageBus;
import com.tiklog.delivery.connection.ConnectionRegistry;
import com.tiklog.delivery.connection.SocketEvents;
import com.tiklog.delivery.dto.RiderResponseNotification;
import com.tiklog.delivery.entity.Delivery;
import com.tiklog.delivery.entity.Notification;
import com.tiklog.delivery.event.ProcessedEvent;
import com.tiklog.delivery.event.ProcessedEventRepository;
import com.tiklog.delivery.match.MatchCache;
import com.tiklog.delivery.match.MatchRecord;
import com.tiklog.delivery.metrics.DispatchMetrics;
import com.tiklog.delivery.repository.DeliveryRepository;
import com.tiklog.delivery.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * 라이더 응답 중계 서비스.
 *
 * <p>라이더의 수락/거절은 driver_responses exchange로 발행되고, 모든 인스턴스의 구독자가
 * {@link #relay(DriverResponse)}를 호출한다. 고객이 접속해 있는 인스턴스만 실제로 알림을 전송한다.</p>
 *
 * <h3>수락</h3>
 * <pre>
 * 고객 ← "riderResponse" {title, availability, riderId, arrivalTime}
 * Notification 기록 저장, Delivery → ASSIGNED
 * </pre>
 *
 * <h3>거절</h3>
 * <pre>
 * 고객 ← "riderDeclined" "Rider declined your request"
 * Notification 기록 저장, 매칭 레코드 제거, 배차 claim 해제
 * </pre>
 *
 * <p>매칭된 라이더가 아닌 라이더의 응답은 고객에게 전달하지 않고 버린다.
 * 영속화는 eventId 기준으로 한 번만 수행한다 ({@link ProcessedEvent}).</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriverResponseRelay {

    static final String DECLINED_MESSAGE = "Rider declined your request";

    private final MessageBus messageBus;
    private final MatchCache matchCache;
    private final ConnectionRegistry connectionRegistry;
    private final DispatchClaimService claimService;
    private final DeliveryRepository deliveryRepository;
    private final NotificationRepository notificationRepository;
    private final ProcessedEventRepository processedEventRepository;
    private final DispatchMetrics metrics;

    /** 라이더 앱의 응답을 버스에 발행 */
    public DriverResponse sendDriverResponse(DriverResponse response) {
        if (response == null || response.riderId() == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "riderId is required");
        }
        DriverResponse stamped = response.withEventId();
        messageBus.publish(Exchanges.DRIVER_RESPONSES, stamped);
        log.info("Driver response sent: eventId={}, riderId={}, availability={}",
                stamped.eventId(), stamped.riderId(), stamped.availability());
        return stamped;
    }

    @Transactional
    public void relay(DriverResponse response) {
        Optional<MatchRecord> match = resolveMatch(response);
        if (match.isPresent() && !match.get().riderId().equals(response.riderId())) {
            log.warn("Driver response from unmatched rider ignored: deliveryId={}, matched={}, responded={}",
                    match.get().deliveryId(), match.get().riderId(), response.riderId());
            return;
        }

        String customerId = match.map(MatchRecord::customerId).orElse(response.customerId());
        if (response.availability()) {
            Integer arrivalTime = response.arrivalTime() != null
                    ? response.arrivalTime()
                    : match.map(MatchRecord::arrivalTimeMinutes).orElse(null);
            connectionRegistry.send(customerId, SocketEvents.RIDER_RESPONSE,
                    RiderResponseNotification.accepted(response.riderId(),
                            match.map(MatchRecord::deliveryId).orElse(response.deliveryId()),
                            arrivalTime,
                            match.map(MatchRecord::rider).orElse(null)));
        } else {
            connectionRegistry.send(customerId, SocketEvents.RIDER_DECLINED, DECLINED_MESSAGE);
        }
        metrics.recordRiderResponse(response.availability());

        if (match.isEmpty()) {
            log.warn("No pending match for driver response: riderId={}, deliveryId={}, customerId={}",
                    response.riderId(), response.deliveryId(), response.customerId());
            return;
        }

        MatchRecord record = match.get();
        persistOnce(response, record);

        if (!response.availability()) {
            matchCache.evict(record);
            claimService.release(record.deliveryId());
            log.info("Rider declined, match cleared: deliveryId={}, riderId={}",
                    record.deliveryId(), record.riderId());
        }
    }

    private void persistOnce(DriverResponse response, MatchRecord record) {
        String eventId = response.eventId();
        if (eventId != null && processedEventRepository.existsById(eventId)) {
            log.debug("Driver response already persisted: eventId={}", eventId);
            return;
        }

        notificationRepository.save(Notification.builder()
                .deliveryRefNumber(record.deliveryRefNumber())
                .riderAvailabilityStatus(response.availability())
                .riderId(record.riderId())
                .customerId(record.customerId())
                .deliveryId(record.deliveryId())
                .build());

        if (response.availability()) {
            Delivery delivery = deliveryRepository.findById(record.deliveryId())
                    .orElseThrow(() -> new BusinessException(ErrorCode.DELIVERY_NOT_FOUND));
            delivery.assignRider(record.riderId());
            log.info("Rider accepted: deliveryId={}, riderId={}", record.deliveryId(), record.riderId());
        }

        if (eventId != null) {
            processedEventRepository.save(new ProcessedEvent(eventId));
        }
    }

    private Optional<MatchRecord> resolveMatch(DriverResponse response) {
        if (response.deliveryId() != null) {
            return matchCache.find(response.deliveryId());
        }
        return matchCache.findByCustomer(response.customerId());
    }
}
