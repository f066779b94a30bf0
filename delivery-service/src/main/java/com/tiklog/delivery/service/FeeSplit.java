package com.tiklog.delivery.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 배송비 분배 - 플랫폼 수수료와 라이더 몫.
 *
 * <pre>
 * adminFee = round_half_up(deliveryFee × percent / 100)   (정수 단위)
 * riderFee = deliveryFee − adminFee
 * </pre>
 *
 * <p>반올림된 수수료를 그대로 저장하므로 adminFee + riderFee == deliveryFee 가 항상 성립한다.</p>
 */
public record FeeSplit(BigDecimal deliveryFee, BigDecimal adminFee, BigDecimal riderFee) {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static FeeSplit of(BigDecimal deliveryFee, BigDecimal adminChargesPercent) {
        BigDecimal adminFee = deliveryFee.multiply(adminChargesPercent)
                .divide(HUNDRED, 0, RoundingMode.HALF_UP);
        return new FeeSplit(deliveryFee, adminFee, deliveryFee.subtract(adminFee));
    }
}
