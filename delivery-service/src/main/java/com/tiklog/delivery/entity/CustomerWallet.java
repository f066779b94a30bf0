package com.tiklog.delivery.entity;

import com.tiklog.common.exception.BusinessException;
import com.tiklog.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * 고객 지갑(CustomerWallet) 엔티티 - 배송 요청 시 배송비가 선차감된다.
 *
 * <p>배송 수정으로 배송비가 바뀌면 차액만큼 차감/환불하고, 배송 취소 시 전액 환불한다.</p>
 */
@Entity
@Table(name = "customer_wallets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerWallet {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "customer_wallet_seq")
    @SequenceGenerator(name = "customer_wallet_seq", sequenceName = "customer_wallet_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false, unique = true)
    private String customerId;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal balance;

    private CustomerWallet(String customerId, BigDecimal balance) {
        this.customerId = customerId;
        this.balance = balance;
    }

    public static CustomerWallet open(String customerId) {
        return new CustomerWallet(customerId, BigDecimal.ZERO);
    }

    public void credit(BigDecimal amount) {
        this.balance = this.balance.add(amount);
    }

    /** 잔액이 부족하면 INSUFFICIENT_BALANCE, 잔액은 변하지 않는다 */
    public void debit(BigDecimal amount) {
        if (balance.compareTo(amount) < 0) {
            throw new BusinessException(ErrorCode.INSUFFICIENT_BALANCE);
        }
        this.balance = this.balance.subtract(amount);
    }
}
