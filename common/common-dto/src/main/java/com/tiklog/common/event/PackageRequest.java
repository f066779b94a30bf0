package com.tiklog.common.event;

import java.util.UUID;

/**
 * 배송 요청 이벤트 (Package Request)
 *
 * <p>고객 앱이 WebSocket {@code packageRequest} 이벤트 또는 REST로 제출하고,
 * 배차 엔진이 {@code package_request} fanout exchange로 브로드캐스트하는 페이로드.</p>
 *
 * <h3>이벤트 흐름</h3>
 * <pre>
 *   Customer App → DispatchService.submitPackageRequest()
 *     → [package_request, TTL] → 모든 delivery-service 인스턴스
 *     → assignPackageToDriver() (라이더 소켓을 가진 인스턴스가 claim 후 배정)
 * </pre>
 *
 * <p>{@code requestId}는 제출 1건을 식별한다. 같은 제출이 직접 호출과 버스로 두 번 들어와도
 * 같은 requestId이므로 중복 제출로 취급하지 않는다.</p>
 */
public record PackageRequest(
        String requestId,         // 제출 고유 ID (UUID), claim 값으로 사용
        Long deliveryId,          // 배달 엔티티 ID (매칭 레코드 / claim 키)
        String customerId,        // 요청 고객 식별자
        String deliveryRefNumber, // 배달 참조 번호 (정산 멱등 키)
        String senderName,
        String senderAddress,
        String recipientAddress
) {
    /** requestId가 비어 있으면 새 UUID를 부여한 사본을 반환 */
    public PackageRequest withRequestId() {
        if (requestId != null && !requestId.isBlank()) {
            return this;
        }
        return new PackageRequest(UUID.randomUUID().toString(), deliveryId, customerId,
                deliveryRefNumber, senderName, senderAddress, recipientAddress);
    }
}
