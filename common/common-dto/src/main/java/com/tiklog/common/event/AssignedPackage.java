package com.tiklog.common.event;

/**
 * 배정 완료 이벤트 - {@code assigned_package_requests} exchange로 발행된다 (TTL 없음, 정보성).
 *
 * <p>원본 {@link PackageRequest}에 배정된 라이더 ID({@code assignedTo})를 더한 형태.
 * 구독자가 없어도 무방한 fire-and-forget 알림이다.</p>
 */
public record AssignedPackage(
        Long deliveryId,
        String customerId,
        String deliveryRefNumber,
        String senderName,
        String senderAddress,
        String recipientAddress,
        String assignedTo
) {
    public static AssignedPackage of(PackageRequest request, String riderId) {
        return new AssignedPackage(
                request.deliveryId(),
                request.customerId(),
                request.deliveryRefNumber(),
                request.senderName(),
                request.senderAddress(),
                request.recipientAddress(),
                riderId);
    }
}
