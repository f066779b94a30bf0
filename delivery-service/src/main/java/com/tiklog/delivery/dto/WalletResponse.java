package com.tiklog.delivery.dto;

import com.tiklog.delivery.entity.CustomerWallet;

import java.math.BigDecimal;

public record WalletResponse(String customerId, BigDecimal balance) {

    public static WalletResponse from(CustomerWallet wallet) {
        return new WalletResponse(wallet.getCustomerId(), wallet.getBalance());
    }
}
