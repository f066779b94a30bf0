package com.tiklog.delivery.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * 라이더 지갑(RiderWallet) 엔티티 - 라이더당 하나, 배송 완료마다 라이더 몫이 적립된다.
 *
 * <p>{@code riderId} unique 제약으로 라이더당 지갑 1개를 보장하고,
 * {@code @Version}으로 동시 적립 시 lost update를 감지한다.</p>
 */
@Entity
@Table(name = "rider_wallets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RiderWallet {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "rider_wallet_seq")
    @SequenceGenerator(name = "rider_wallet_seq", sequenceName = "rider_wallet_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false, unique = true)
    private String riderId;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal balance;

    private RiderWallet(String riderId, BigDecimal balance) {
        this.riderId = riderId;
        this.balance = balance;
    }

    /** 첫 정산 시 잔액과 함께 지갑 생성 */
    public static RiderWallet open(String riderId, BigDecimal initialBalance) {
        return new RiderWallet(riderId, initialBalance);
    }

    public void credit(BigDecimal amount) {
        this.balance = this.balance.add(amount);
    }
}
