package com.tiklog.delivery.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/** 라이더 응답(수락/거절) 기록. 고객이 접속해 있지 않아도 남는다. */
@Entity
@Table(name = "notifications", indexes = {
        @Index(name = "idx_notification_delivery", columnList = "deliveryId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "notification_seq")
    @SequenceGenerator(name = "notification_seq", sequenceName = "notification_seq", allocationSize = 50)
    private Long id;

    private String deliveryRefNumber;

    private boolean riderAvailabilityStatus;  // true = 수락, false = 거절

    @Column(nullable = false)
    private String riderId;

    @Column(nullable = false)
    private String customerId;

    @Column(nullable = false)
    private Long deliveryId;

    @CreatedDate
    private LocalDateTime createdAt;

    @Builder
    public Notification(String deliveryRefNumber, boolean riderAvailabilityStatus,
                        String riderId, String customerId, Long deliveryId) {
        this.deliveryRefNumber = deliveryRefNumber;
        this.riderAvailabilityStatus = riderAvailabilityStatus;
        this.riderId = riderId;
        this.customerId = customerId;
        this.deliveryId = deliveryId;
    }
}
