package com.tiklog.delivery.service;

import java.math.BigDecimal;

/**
 * 정산 결과.
 *
 * @param deliveryRefNumber 정산 대상 배송
 * @param deliveryFee       배송비 (중복 정산이면 null)
 * @param adminFee          플랫폼 수수료
 * @param riderFee          라이더 몫 (중복 정산이면 null)
 * @param walletBalance     적립 후 지갑 잔액 (중복 정산이면 null)
 * @param duplicate         이미 정산된 배송이었는지
 */
public record SettlementResult(
        String deliveryRefNumber,
        BigDecimal deliveryFee,
        BigDecimal adminFee,
        BigDecimal riderFee,
        BigDecimal walletBalance,
        boolean duplicate
) {

    static SettlementResult settled(String deliveryRefNumber, FeeSplit split, BigDecimal walletBalance) {
        return new SettlementResult(deliveryRefNumber, split.deliveryFee(), split.adminFee(), split.riderFee(), walletBalance, false);
    }

    static SettlementResult alreadySettled(String deliveryRefNumber, BigDecimal adminFee) {
        return new SettlementResult(deliveryRefNumber, null, adminFee, null, null, true);
    }
}
