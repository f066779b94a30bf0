package com.tiklog.delivery.entity;

/**
 * 배달 상태(DeliveryStatus) 열거형 - 배달의 전체 생명주기를 정의한다.
 *
 * <h3>상태 전이 흐름</h3>
 * <pre>
 * PENDING → ASSIGNED → ON_TRANSIT → DELIVERED
 *    ↓          ↓
 * CANCELED   CANCELED
 * </pre>
 *
 * <ul>
 *   <li>{@code PENDING} - 배송 요청 생성, 라이더 수락 전</li>
 *   <li>{@code ASSIGNED} - 라이더가 요청을 수락함</li>
 *   <li>{@code ON_TRANSIT} - 라이더가 배송을 시작함</li>
 *   <li>{@code DELIVERED} - 배송 완료 (정산 대상)</li>
 *   <li>{@code CANCELED} - 배송 취소</li>
 * </ul>
 *
 * <p>건너뛰는 전이(PENDING → DELIVERED 등)와 종료 상태에서의 전이는 허용하지 않는다.</p>
 */
public enum DeliveryStatus {
    PENDING,
    ASSIGNED,
    ON_TRANSIT,
    DELIVERED,
    CANCELED;

    public boolean canTransitionTo(DeliveryStatus next) {
        return switch (this) {
            case PENDING -> next == ASSIGNED || next == CANCELED;
            case ASSIGNED -> next == ON_TRANSIT || next == CANCELED;
            case ON_TRANSIT -> next == DELIVERED;
            case DELIVERED, CANCELED -> false;
        };
    }
}
