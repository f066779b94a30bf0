package com.tiklog.delivery.entity;

import com.tiklog.common.exception.BusinessException;
import com.tiklog.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 배달(Delivery) 엔티티 - 고객의 배송 요청 한 건을 나타낸다.
 *
 * <p>배송 요청 생성 시 PENDING으로 시작하며, 라이더 수락 → 배송 시작 → 배송 완료 순서로 진행된다.
 * 상태 변경은 반드시 {@link DeliveryStatus#canTransitionTo}를 통과해야 한다.</p>
 *
 * <h3>핵심 필드 설명</h3>
 * <ul>
 *   <li>{@code deliveryRefNumber} - 배송 참조 번호 (unique, 정산 멱등성 키)</li>
 *   <li>{@code senderLatitude/Longitude} - 픽업 좌표, 라이더 탐색의 기준점</li>
 *   <li>{@code recipientLatitude/Longitude} - 수령 좌표, 배송비 거리 계산에 사용</li>
 *   <li>{@code deliveryFee} - 배송비, 배송 완료 시 수수료/라이더 몫으로 나뉜다</li>
 *   <li>{@code version} - JPA Optimistic Lock (@Version)으로 동시 수정 감지</li>
 * </ul>
 */
@Entity
@Table(name = "deliveries", indexes = {
        @Index(name = "idx_delivery_customer", columnList = "customerId"),
        @Index(name = "idx_delivery_status", columnList = "status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Delivery {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "delivery_seq")
    @SequenceGenerator(name = "delivery_seq", sequenceName = "delivery_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false, unique = true)
    private String deliveryRefNumber;

    @Column(nullable = false)
    private String customerId;

    private String riderId;  // 수락 전에는 null

    private String senderName;

    @Column(nullable = false)
    private String senderAddress;

    @Column(nullable = false)
    private String recipientAddress;

    @Column(nullable = false)
    private double senderLatitude;

    @Column(nullable = false)
    private double senderLongitude;

    private double recipientLatitude;

    private double recipientLongitude;

    @Enumerated(EnumType.STRING)
    private VehicleType vehicleType;  // 고객이 고른 차량 종류, null이면 평균 요금

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal deliveryFee;

    private String estimatedDeliveryTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DeliveryStatus status;

    @CreatedDate
    private LocalDateTime createdAt;

    @Builder
    public Delivery(String deliveryRefNumber, String customerId, String senderName,
                    String senderAddress, String recipientAddress,
                    double senderLatitude, double senderLongitude,
                    double recipientLatitude, double recipientLongitude, VehicleType vehicleType,
                    BigDecimal deliveryFee, String estimatedDeliveryTime) {
        this.deliveryRefNumber = deliveryRefNumber;
        this.customerId = customerId;
        this.senderName = senderName;
        this.senderAddress = senderAddress;
        this.recipientAddress = recipientAddress;
        this.senderLatitude = senderLatitude;
        this.senderLongitude = senderLongitude;
        this.recipientLatitude = recipientLatitude;
        this.recipientLongitude = recipientLongitude;
        this.vehicleType = vehicleType;
        this.deliveryFee = deliveryFee;
        this.estimatedDeliveryTime = estimatedDeliveryTime;
        this.status = DeliveryStatus.PENDING;
    }

    /**
     * 주소/좌표/차량 변경. 라이더 수락 전(PENDING)에만 가능하며 배송비와 예상 시간은 다시 계산된 값으로 바뀐다.
     */
    public void edit(String senderName, String senderAddress, String recipientAddress,
                     double senderLatitude, double senderLongitude,
                     double recipientLatitude, double recipientLongitude, VehicleType vehicleType,
                     BigDecimal deliveryFee, String estimatedDeliveryTime) {
        if (status != DeliveryStatus.PENDING) {
            throw new BusinessException(ErrorCode.DELIVERY_NOT_EDITABLE);
        }
        this.senderName = senderName;
        this.senderAddress = senderAddress;
        this.recipientAddress = recipientAddress;
        this.senderLatitude = senderLatitude;
        this.senderLongitude = senderLongitude;
        this.recipientLatitude = recipientLatitude;
        this.recipientLongitude = recipientLongitude;
        this.vehicleType = vehicleType;
        this.deliveryFee = deliveryFee;
        this.estimatedDeliveryTime = estimatedDeliveryTime;
    }

    /** 라이더 수락 시 호출. 같은 라이더의 중복 수락은 무시한다. */
    public void assignRider(String riderId) {
        if (status == DeliveryStatus.ASSIGNED && riderId.equals(this.riderId)) {
            return;
        }
        transitionTo(DeliveryStatus.ASSIGNED);
        this.riderId = riderId;
    }

    public void startTransit() {
        transitionTo(DeliveryStatus.ON_TRANSIT);
    }

    public void complete() {
        transitionTo(DeliveryStatus.DELIVERED);
    }

    /** 배송 시작 전(PENDING, ASSIGNED)에만 취소할 수 있다. */
    public void cancel() {
        transitionTo(DeliveryStatus.CANCELED);
    }

    private void transitionTo(DeliveryStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new BusinessException(ErrorCode.INVALID_DELIVERY_STATUS,
                    "Cannot change delivery " + deliveryRefNumber + " from " + status + " to " + next);
        }
        this.status = next;
    }
}
