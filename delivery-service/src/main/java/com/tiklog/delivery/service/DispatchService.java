package com.tiklog.delivery.service;

import com.tiklog.common.event.AssignedPackage;
import com.tiklog.common.event.PackageRequest;
import com.tiklog.common.exception.BusinessException;
import com.tiklog.common.exception.ErrorCode;
import com.tiklog.delivery.bus.Exchanges;
import com.tiklog.delivery.bus.MessageBus;
import com.tiklog.delivery.bus.PublishOptions;
import com.tiklog.delivery.config.DispatchProperties;
import com.tiklog.delivery.connection.ConnectionRegistry;
import com.tiklog.delivery.connection.ParticipantConnection;
import com.tiklog.delivery.connection.SocketEvents;
import com.tiklog.delivery.dto.RiderNotification;
import com.tiklog.delivery.match.MatchCache;
import com.tiklog.delivery.match.MatchRecord;
import com.tiklog.delivery.metrics.DispatchMetrics;
import com.tiklog.delivery.service.DispatchClaimService.ClaimResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 배차 서비스 - 배송 요청을 버스에 발행하고, 매칭된 라이더에게 전달한다.
 *
 * <h3>동작 흐름</h3>
 * <pre>
 * submitPackageRequest
 *   1. requestId 부여 후 package_request 발행 (TTL = request-expiration)
 *   2. assignPackageToDriver 직접 호출
 *
 * assignPackageToDriver (직접 호출 + 모든 인스턴스의 package_request 구독자)
 *   1. 매칭 레코드 없음                 → NO_CANDIDATE
 *   2. 라이더 소켓이 이 인스턴스에 없음 → 다른 제출이 claim했으면 ALREADY_CLAIMED, 아니면 FORWARDED
 *   3. claim 획득                       → 라이더에게 "notification", assigned_package_requests 발행 → ASSIGNED
 *      같은 requestId가 이미 claim      → 재전송 없이 ASSIGNED
 *      다른 requestId가 이미 claim      → ALREADY_CLAIMED
 * </pre>
 *
 * <p>라이더 알림은 소켓을 가진 인스턴스에서만 나가므로, 버스 메시지를 먼저 처리한 인스턴스가
 * 라이더 없이 claim을 가져가는 일이 없다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchService {

    private final MessageBus messageBus;
    private final MatchCache matchCache;
    private final ConnectionRegistry connectionRegistry;
    private final DispatchClaimService claimService;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;

    public AssignmentOutcome submitPackageRequest(PackageRequest request) {
        if (request == null || request.deliveryId() == null || request.customerId() == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "deliveryId and customerId are required");
        }
        PackageRequest stamped = request.withRequestId();
        messageBus.publish(Exchanges.PACKAGE_REQUEST, stamped,
                PublishOptions.expiringIn(properties.requestExpiration()));

        AssignmentOutcome outcome = assignPackageToDriver(stamped);
        log.info("Package request submitted: deliveryId={}, requestId={}, outcome={}",
                stamped.deliveryId(), stamped.requestId(), outcome);
        return outcome;
    }

    public AssignmentOutcome assignPackageToDriver(PackageRequest request) {
        Long deliveryId = request.deliveryId();
        if (deliveryId == null) {
            log.warn("Ignoring package request without deliveryId: customerId={}", request.customerId());
            return record(AssignmentOutcome.NO_CANDIDATE);
        }

        Optional<MatchRecord> match = matchCache.find(deliveryId);
        if (match.isEmpty()) {
            log.warn("No available drivers found: deliveryId={}", deliveryId);
            return record(AssignmentOutcome.NO_CANDIDATE);
        }

        PackageRequest stamped = request.withRequestId();
        String riderId = match.get().riderId();
        if (!isConnectedHere(riderId)) {
            boolean claimedByOther = claimService.holder(deliveryId)
                    .filter(holder -> !holder.equals(stamped.requestId()))
                    .isPresent();
            log.debug("Rider not connected to this instance: deliveryId={}, riderId={}, claimedByOther={}",
                    deliveryId, riderId, claimedByOther);
            return record(claimedByOther ? AssignmentOutcome.ALREADY_CLAIMED : AssignmentOutcome.FORWARDED);
        }

        ClaimResult claim = claimService.claim(deliveryId, stamped.requestId());
        if (claim == ClaimResult.OTHER_REQUEST) {
            log.debug("Package request already dispatched: deliveryId={}", deliveryId);
            return record(AssignmentOutcome.ALREADY_CLAIMED);
        }
        if (claim == ClaimResult.SAME_REQUEST) {
            log.debug("Package request already delivered to rider: deliveryId={}, requestId={}",
                    deliveryId, stamped.requestId());
            return AssignmentOutcome.ASSIGNED;
        }

        try {
            connectionRegistry.send(riderId, SocketEvents.NOTIFICATION, RiderNotification.newRequest(stamped));
            messageBus.publish(Exchanges.ASSIGNED_PACKAGE_REQUESTS, AssignedPackage.of(stamped, riderId));
        } catch (RuntimeException e) {
            claimService.release(deliveryId);
            throw e;
        }

        log.info("Package request assigned to driver: deliveryId={}, riderId={}", deliveryId, riderId);
        return record(AssignmentOutcome.ASSIGNED);
    }

    private boolean isConnectedHere(String riderId) {
        return connectionRegistry.lookup(riderId)
                .filter(ParticipantConnection::isOpen)
                .isPresent();
    }

    private AssignmentOutcome record(AssignmentOutcome outcome) {
        metrics.recordPackageRequest(outcome.metricTag());
        return outcome;
    }
}
