package com.tiklog.delivery.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 플랫폼 수수료 기록(AdminFee) - 배송 1건당 정확히 1행.
 *
 * <p>{@code deliveryRefNumber} unique 제약이 정산 멱등성의 최종 방어선이다.
 * 동시에 두 번 정산이 시도되면 두 번째 INSERT가 제약 위반으로 실패하고 트랜잭션 전체가 롤백된다.</p>
 */
@Entity
@Table(name = "admin_fees")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class AdminFee {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "admin_fee_seq")
    @SequenceGenerator(name = "admin_fee_seq", sequenceName = "admin_fee_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false, unique = true)
    private String deliveryRefNumber;

    @Column(nullable = false)
    private String riderId;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal adminFee;

    @CreatedDate
    private LocalDateTime createdAt;

    @Builder
    public AdminFee(String deliveryRefNumber, String riderId, BigDecimal adminFee) {
        this.deliveryRefNumber = deliveryRefNumber;
        this.riderId = riderId;
        this.adminFee = adminFee;
    }
}
